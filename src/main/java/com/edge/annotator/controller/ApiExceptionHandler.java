package com.edge.annotator.controller;

import com.edge.annotator.core.codec.AnnotationSaveException;
import com.edge.annotator.dto.SessionStateResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;

/**
 * 统一错误响应
 * <p>
 * 保存失败区分"无写权限"和其他 IO 错误；未保存的修改仍保留在内存中，界面可重试。
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AnnotationSaveException.class)
    public ResponseEntity<SessionStateResponse> handleSaveFailure(AnnotationSaveException e) {
        logger.error("Save failed ({}): {}", e.getReason(), e.getMessage());
        if (e.getReason() == AnnotationSaveException.Reason.PERMISSION_DENIED) {
            return build(HttpStatus.CONFLICT, "SAVE_PERMISSION_DENIED", e.getMessage());
        }
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "SAVE_FAILED", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<SessionStateResponse> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<SessionStateResponse> handleIllegalState(IllegalStateException e) {
        logger.warn("Request not allowed in current state: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "INVALID_STATE", e.getMessage());
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<SessionStateResponse> handleIo(IOException e) {
        logger.error("I/O error", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "IO_ERROR", e.getMessage());
    }

    private ResponseEntity<SessionStateResponse> build(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(SessionStateResponse.error(code, message));
    }
}
