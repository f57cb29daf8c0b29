package com.edge.annotator.core.model;

import java.util.OptionalInt;

/**
 * 选中状态
 * <p>
 * 最多选中一个框，按位置引用（非持有），删除等结构性修改后必须清除或重新计算。
 * 交互模式为 RESIZING 时同时记录被拖动的角点。
 */
public class Selection {
    private static final int NONE = -1;

    private int index = NONE;
    private InteractionMode mode = InteractionMode.NONE;
    private Corner corner;

    public OptionalInt index() {
        return index == NONE ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public boolean isPresent() {
        return index != NONE;
    }

    /**
     * 选中的框是否仍存在于集合中
     */
    public boolean isValidIn(AnnotationSet set) {
        return index != NONE && set.isValidIndex(index);
    }

    public void select(int newIndex) {
        if (newIndex < 0) {
            throw new IllegalArgumentException("Selection index must be non-negative: " + newIndex);
        }
        this.index = newIndex;
    }

    /**
     * 恢复到之前的选中位置，null 表示无选中
     */
    public void restore(Integer previous) {
        this.index = previous == null ? NONE : previous;
    }

    public Integer snapshot() {
        return index == NONE ? null : index;
    }

    public void clear() {
        this.index = NONE;
        resetMode();
    }

    public InteractionMode getMode() {
        return mode;
    }

    public Corner getCorner() {
        return corner;
    }

    public void beginCreating() {
        this.mode = InteractionMode.CREATING;
        this.corner = null;
    }

    public void beginMoving() {
        this.mode = InteractionMode.MOVING;
        this.corner = null;
    }

    public void beginResizing(Corner dragged) {
        this.mode = InteractionMode.RESIZING;
        this.corner = dragged;
    }

    public void resetMode() {
        this.mode = InteractionMode.NONE;
        this.corner = null;
    }

    @Override
    public String toString() {
        return "Selection[index=" + (index == NONE ? "none" : index) + ", mode=" + mode
            + (corner != null ? ", corner=" + corner : "") + "]";
    }
}
