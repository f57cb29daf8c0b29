package com.edge.annotator.core.model;

/**
 * 二维点
 * 屏幕像素坐标或归一化图像坐标，由调用方决定语义
 */
public class Point {
    public double x;
    public double y;

    public Point() {
    }

    public Point(double x, double y) {
        this.x = x;
        this.y = y;
    }

    /**
     * 两个坐标轴上的差值都不超过 radius（切比雪夫距离）
     */
    public boolean isWithin(Point other, double radius) {
        return Math.abs(this.x - other.x) <= radius && Math.abs(this.y - other.y) <= radius;
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
