package com.edge.annotator.core.transform;

import com.edge.annotator.core.model.Corner;
import com.edge.annotator.core.model.Point;

/**
 * 屏幕坐标系下的矩形
 */
public class ScreenRect {
    private final double left;
    private final double top;
    private final double right;
    private final double bottom;

    public ScreenRect(double left, double top, double right, double bottom) {
        this.left = left;
        this.top = top;
        this.right = right;
        this.bottom = bottom;
    }

    /**
     * 向四周扩展 margin 像素后是否包含该点
     */
    public boolean contains(Point p, double margin) {
        return p.x >= left - margin && p.x <= right + margin
            && p.y >= top - margin && p.y <= bottom + margin;
    }

    public Point corner(Corner corner) {
        return switch (corner) {
            case TOP_LEFT -> new Point(left, top);
            case TOP_RIGHT -> new Point(right, top);
            case BOTTOM_LEFT -> new Point(left, bottom);
            case BOTTOM_RIGHT -> new Point(right, bottom);
        };
    }

    public double getLeft() { return left; }
    public double getTop() { return top; }
    public double getRight() { return right; }
    public double getBottom() { return bottom; }

    public double getWidth() {
        return right - left;
    }

    public double getHeight() {
        return bottom - top;
    }

    @Override
    public String toString() {
        return String.format("ScreenRect[%.2f,%.2f - %.2f,%.2f]", left, top, right, bottom);
    }
}
