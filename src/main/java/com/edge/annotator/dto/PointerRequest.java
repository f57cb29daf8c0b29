package com.edge.annotator.dto;

import com.edge.annotator.core.model.Point;
import lombok.Data;

/**
 * 指针事件：屏幕像素坐标 + 当时的视口
 */
@Data
public class PointerRequest {
    private double x;
    private double y;
    private ViewportDto viewport;

    public Point toPoint() {
        return new Point(x, y);
    }
}
