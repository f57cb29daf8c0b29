package com.edge.annotator.dto;

import com.edge.annotator.core.transform.ViewportTransform;
import lombok.Data;

/**
 * 界面当前的视口变换：缩放 + 图片左上角在屏幕上的位置
 */
@Data
public class ViewportDto {
    private double zoom = 1.0;
    private double panX;
    private double panY;

    public ViewportTransform toTransform() {
        return new ViewportTransform(zoom, panX, panY);
    }

    public static ViewportTransform toTransform(ViewportDto viewport) {
        return viewport == null ? ViewportTransform.identity() : viewport.toTransform();
    }
}
