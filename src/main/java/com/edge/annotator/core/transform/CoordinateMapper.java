package com.edge.annotator.core.transform;

import com.edge.annotator.core.model.Box;
import com.edge.annotator.core.model.Point;

/**
 * 坐标映射
 * <p>
 * 屏幕像素坐标 与 归一化图片坐标 (0.0 - 1.0) 之间的双向转换。
 * 交互阈值（最小拖拽尺寸、手柄半径、点击容差）都以屏幕像素定义，经此换算后在任意缩放下视觉大小不变。
 */
public class CoordinateMapper {

    /**
     * 屏幕坐标 → 归一化坐标
     */
    public Point toNormalized(Point screenPoint, ViewportTransform transform, ImageSize imageSize) {
        double x = (screenPoint.x - transform.getPanX()) / (imageSize.getWidth() * transform.getZoom());
        double y = (screenPoint.y - transform.getPanY()) / (imageSize.getHeight() * transform.getZoom());
        return new Point(x, y);
    }

    /**
     * 归一化坐标 → 屏幕坐标（逆变换）
     */
    public Point toScreen(Point normalizedPoint, ViewportTransform transform, ImageSize imageSize) {
        double x = transform.getPanX() + normalizedPoint.x * imageSize.getWidth() * transform.getZoom();
        double y = transform.getPanY() + normalizedPoint.y * imageSize.getHeight() * transform.getZoom();
        return new Point(x, y);
    }

    /**
     * 屏幕像素长度 → 归一化 X 方向长度
     */
    public double toNormalizedLengthX(double pixels, ViewportTransform transform, ImageSize imageSize) {
        return pixels / (imageSize.getWidth() * transform.getZoom());
    }

    /**
     * 屏幕像素长度 → 归一化 Y 方向长度
     */
    public double toNormalizedLengthY(double pixels, ViewportTransform transform, ImageSize imageSize) {
        return pixels / (imageSize.getHeight() * transform.getZoom());
    }

    /**
     * 将标注框投影到屏幕坐标
     */
    public ScreenRect toScreenRect(Box box, ViewportTransform transform, ImageSize imageSize) {
        Point topLeft = toScreen(new Point(box.getLeft(), box.getTop()), transform, imageSize);
        Point bottomRight = toScreen(new Point(box.getRight(), box.getBottom()), transform, imageSize);
        return new ScreenRect(topLeft.x, topLeft.y, bottomRight.x, bottomRight.y);
    }
}
