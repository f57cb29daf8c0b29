package com.edge.annotator.core.model;

/**
 * 标注框角点（缩放手柄）
 * <p>
 * 顺序即角点索引，也是命中检测的优先顺序
 */
public enum Corner {
    TOP_LEFT,
    TOP_RIGHT,
    BOTTOM_LEFT,
    BOTTOM_RIGHT;

    public boolean isLeft() {
        return this == TOP_LEFT || this == BOTTOM_LEFT;
    }

    public boolean isTop() {
        return this == TOP_LEFT || this == TOP_RIGHT;
    }

    public Corner opposite() {
        return switch (this) {
            case TOP_LEFT -> BOTTOM_RIGHT;
            case TOP_RIGHT -> BOTTOM_LEFT;
            case BOTTOM_LEFT -> TOP_RIGHT;
            case BOTTOM_RIGHT -> TOP_LEFT;
        };
    }

    public static Corner fromIndex(int index) {
        Corner[] corners = values();
        if (index < 0 || index >= corners.length) {
            throw new IllegalArgumentException("Corner index out of range: " + index);
        }
        return corners[index];
    }
}
