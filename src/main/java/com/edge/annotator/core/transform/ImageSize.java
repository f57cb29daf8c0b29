package com.edge.annotator.core.transform;

/**
 * 图片原始尺寸（像素）
 */
public class ImageSize {
    private final int width;
    private final int height;

    public ImageSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
