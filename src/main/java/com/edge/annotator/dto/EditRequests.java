package com.edge.annotator.dto;

import lombok.Data;

/**
 * 编辑类接口的请求体
 */
public final class EditRequests {

    private EditRequests() {
    }

    /**
     * 设置类别：classId 与 className 二选一，className 可为旧版名称
     */
    @Data
    public static class AssignClassRequest {
        private Integer classId;
        private String className;
    }

    /**
     * 键盘微调：归一化偏移
     */
    @Data
    public static class MoveRequest {
        private double dx;
        private double dy;
    }

    /**
     * 直接缩放：拖动 corner（0-3）到屏幕位置
     */
    @Data
    public static class ResizeRequest {
        private int corner;
        private double x;
        private double y;
        private ViewportDto viewport;
    }

    /**
     * 直接新建：屏幕拖拽起止点
     */
    @Data
    public static class CreateBoxRequest {
        private double startX;
        private double startY;
        private double endX;
        private double endY;
        private ViewportDto viewport;
    }

    @Data
    public static class ClassNameRequest {
        private String name;
    }

    @Data
    public static class CurrentClassRequest {
        private int classId;
    }

    /**
     * 切换图片：direction 为 next / previous，或直接给出 index
     */
    @Data
    public static class NavigateRequest {
        private String direction;
        private Integer index;
    }

    @Data
    public static class OpenRequest {
        private String directory;
    }
}
