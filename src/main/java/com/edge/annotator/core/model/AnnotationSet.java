package com.edge.annotator.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 当前图片的标注框集合
 * <p>
 * 列表顺序即叠放顺序，后加入的框位于上层。任何修改都会设置脏标记，保存成功后清除。
 */
public class AnnotationSet {
    private final List<Box> boxes = new ArrayList<>();
    private boolean dirty;

    public AnnotationSet() {
    }

    public AnnotationSet(List<Box> initial) {
        boxes.addAll(initial);
    }

    public Box get(int index) {
        return boxes.get(index);
    }

    public int size() {
        return boxes.size();
    }

    public boolean isEmpty() {
        return boxes.isEmpty();
    }

    public boolean isValidIndex(int index) {
        return index >= 0 && index < boxes.size();
    }

    /**
     * 追加到最上层
     *
     * @return 新框的位置
     */
    public int add(Box box) {
        boxes.add(box);
        dirty = true;
        return boxes.size() - 1;
    }

    public void insert(int index, Box box) {
        boxes.add(index, box);
        dirty = true;
    }

    public void set(int index, Box box) {
        boxes.set(index, box);
        dirty = true;
    }

    public Box remove(int index) {
        Box removed = boxes.remove(index);
        dirty = true;
        return removed;
    }

    public List<Box> boxes() {
        return Collections.unmodifiableList(boxes);
    }

    /**
     * 用重新加载的内容替换，加载后的集合视为干净
     */
    public void replaceAll(List<Box> loaded) {
        boxes.clear();
        boxes.addAll(loaded);
        dirty = false;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markSaved() {
        dirty = false;
    }

    /**
     * 恢复到之前记录的脏标记（拖拽预览最终未产生修改时使用）
     */
    public void restoreDirty(boolean wasDirty) {
        dirty = wasDirty;
    }
}
