package com.edge.annotator.core.model;

import java.util.Objects;

/**
 * 标注框
 * <p>
 * 中心点格式，坐标归一化为图片宽高的比例 (0.0 - 1.0):
 * <class_id> <center_x> <center_y> <width> <height>
 * <p>
 * 不可变对象，编辑操作总是生成新的实例
 */
public final class Box {
    private final int classId;
    private final double cx;
    private final double cy;
    private final double w;
    private final double h;

    public Box(int classId, double cx, double cy, double w, double h) {
        if (classId < 0) {
            throw new IllegalArgumentException("Class id must be non-negative: " + classId);
        }
        this.classId = classId;
        this.cx = cx;
        this.cy = cy;
        this.w = w;
        this.h = h;
    }

    /**
     * 由左上角和右下角构建
     */
    public static Box fromCorners(int classId, double left, double top, double right, double bottom) {
        return new Box(classId, (left + right) / 2.0, (top + bottom) / 2.0, right - left, bottom - top);
    }

    public double getLeft() {
        return cx - w / 2.0;
    }

    public double getRight() {
        return cx + w / 2.0;
    }

    public double getTop() {
        return cy - h / 2.0;
    }

    public double getBottom() {
        return cy + h / 2.0;
    }

    public Point getCorner(Corner corner) {
        return switch (corner) {
            case TOP_LEFT -> new Point(getLeft(), getTop());
            case TOP_RIGHT -> new Point(getRight(), getTop());
            case BOTTOM_LEFT -> new Point(getLeft(), getBottom());
            case BOTTOM_RIGHT -> new Point(getRight(), getBottom());
        };
    }

    public Box withClassId(int newClassId) {
        return new Box(newClassId, cx, cy, w, h);
    }

    public Box withCenter(double newCx, double newCy) {
        return new Box(classId, newCx, newCy, w, h);
    }

    public int getClassId() { return classId; }
    public double getCx() { return cx; }
    public double getCy() { return cy; }
    public double getW() { return w; }
    public double getH() { return h; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box)) return false;
        Box box = (Box) o;
        return classId == box.classId
            && Double.compare(box.cx, cx) == 0
            && Double.compare(box.cy, cy) == 0
            && Double.compare(box.w, w) == 0
            && Double.compare(box.h, h) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(classId, cx, cy, w, h);
    }

    @Override
    public String toString() {
        return String.format("Box[class=%d, center=(%.4f,%.4f), size=%.4fx%.4f]", classId, cx, cy, w, h);
    }
}
