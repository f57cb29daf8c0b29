package com.edge.annotator.core.model;

/**
 * 当前指针交互模式
 */
public enum InteractionMode {
    NONE,
    CREATING,
    MOVING,
    RESIZING
}
