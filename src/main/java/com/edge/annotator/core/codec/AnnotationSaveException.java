package com.edge.annotator.core.codec;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 保存标注或类别文件失败
 * <p>
 * 缺少写权限与其他 IO 错误分开上报，界面据此决定是否允许离开当前图片。
 */
public class AnnotationSaveException extends IOException {

    public enum Reason {
        PERMISSION_DENIED,
        IO_ERROR
    }

    private final Reason reason;
    private final Path path;

    public AnnotationSaveException(Reason reason, Path path, Throwable cause) {
        super(describe(reason, path, cause), cause);
        this.reason = reason;
        this.path = path;
    }

    public Reason getReason() { return reason; }
    public Path getPath() { return path; }

    private static String describe(Reason reason, Path path, Throwable cause) {
        String prefix = reason == Reason.PERMISSION_DENIED
            ? "No write permission for "
            : "Failed to write ";
        return prefix + path + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }
}
