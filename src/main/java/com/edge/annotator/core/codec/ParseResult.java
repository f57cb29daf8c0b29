package com.edge.annotator.core.codec;

import com.edge.annotator.core.model.Box;

import java.util.Collections;
import java.util.List;

/**
 * 标注文件解析结果：成功解析的框 + 所有被跳过行的错误
 */
public class ParseResult {
    private final List<Box> boxes;
    private final List<LineError> errors;
    private final int registryGrowth;

    public ParseResult(List<Box> boxes, List<LineError> errors, int registryGrowth) {
        this.boxes = Collections.unmodifiableList(boxes);
        this.errors = Collections.unmodifiableList(errors);
        this.registryGrowth = registryGrowth;
    }

    public static ParseResult empty() {
        return new ParseResult(List.of(), List.of(), 0);
    }

    public List<Box> getBoxes() { return boxes; }
    public List<LineError> getErrors() { return errors; }

    /**
     * 解析过程中新增的类别数（占位类别或旧版名称）
     */
    public int getRegistryGrowth() { return registryGrowth; }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
