package com.edge.annotator.core.hit;

import com.edge.annotator.core.model.Corner;

/**
 * 命中检测结果：手柄、框体或空白
 */
public class HitResult {

    public enum Type {
        HANDLE,
        BOX,
        NONE
    }

    private static final HitResult NONE = new HitResult(Type.NONE, -1, null);

    private final Type type;
    private final int boxIndex;
    private final Corner corner;

    private HitResult(Type type, int boxIndex, Corner corner) {
        this.type = type;
        this.boxIndex = boxIndex;
        this.corner = corner;
    }

    public static HitResult handle(int boxIndex, Corner corner) {
        return new HitResult(Type.HANDLE, boxIndex, corner);
    }

    public static HitResult box(int boxIndex) {
        return new HitResult(Type.BOX, boxIndex, null);
    }

    public static HitResult none() {
        return NONE;
    }

    public Type getType() { return type; }
    public int getBoxIndex() { return boxIndex; }
    public Corner getCorner() { return corner; }

    public boolean isNone() {
        return type == Type.NONE;
    }

    @Override
    public String toString() {
        return switch (type) {
            case HANDLE -> "Hit[handle " + corner + " of box " + boxIndex + "]";
            case BOX -> "Hit[box " + boxIndex + "]";
            case NONE -> "Hit[none]";
        };
    }
}
