package com.edge.annotator.core.edit;

/**
 * 交互阈值，全部以屏幕像素为单位
 */
public class InteractionSettings {
    private final double clickTolerance;    // 点击框边界的容差
    private final double minBoxPixels;      // 新建/缩放后框的最小宽高
    private final double minHandleRadius;   // 手柄半径下限

    public InteractionSettings(double clickTolerance, double minBoxPixels, double minHandleRadius) {
        if (clickTolerance < 0 || minBoxPixels <= 0 || minHandleRadius < 0) {
            throw new IllegalArgumentException(String.format(
                "Invalid interaction settings: tolerance=%.2f, minBox=%.2f, handle=%.2f",
                clickTolerance, minBoxPixels, minHandleRadius));
        }
        this.clickTolerance = clickTolerance;
        this.minBoxPixels = minBoxPixels;
        this.minHandleRadius = minHandleRadius;
    }

    public static InteractionSettings defaults() {
        return new InteractionSettings(8.0, 6.0, 6.0);
    }

    public double getClickTolerance() { return clickTolerance; }
    public double getMinBoxPixels() { return minBoxPixels; }
    public double getMinHandleRadius() { return minHandleRadius; }

    /**
     * 手柄命中半径：点击容差，但不小于下限
     */
    public double getHandleRadius() {
        return Math.max(clickTolerance, minHandleRadius);
    }

    @Override
    public String toString() {
        return String.format("InteractionSettings[tolerance=%.1fpx, minBox=%.1fpx, handle=%.1fpx]",
            clickTolerance, minBoxPixels, getHandleRadius());
    }
}
