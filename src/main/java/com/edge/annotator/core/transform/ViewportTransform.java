package com.edge.annotator.core.transform;

/**
 * 视口变换
 * 表示图片像素坐标到屏幕坐标的缩放 + 平移，由界面外壳维护并随每次事件传入
 * <p>
 * screen = pan + imagePixel * zoom
 */
public class ViewportTransform {
    private final double zoom;   // 缩放倍数
    private final double panX;   // 图片左上角在屏幕上的 X
    private final double panY;   // 图片左上角在屏幕上的 Y

    public ViewportTransform(double zoom, double panX, double panY) {
        if (!(zoom > 0) || Double.isInfinite(zoom)) {
            throw new IllegalArgumentException("Zoom must be a positive finite number: " + zoom);
        }
        if (!Double.isFinite(panX) || !Double.isFinite(panY)) {
            throw new IllegalArgumentException("Pan offset must be finite: " + panX + ", " + panY);
        }
        this.zoom = zoom;
        this.panX = panX;
        this.panY = panY;
    }

    public static ViewportTransform identity() {
        return new ViewportTransform(1.0, 0.0, 0.0);
    }

    public double getZoom() { return zoom; }
    public double getPanX() { return panX; }
    public double getPanY() { return panY; }

    @Override
    public String toString() {
        return String.format("Viewport[zoom=%.3f, pan=(%.2f,%.2f)]", zoom, panX, panY);
    }
}
