package com.edge.annotator.core.history;

import com.edge.annotator.core.model.Box;

/**
 * 撤销记录
 * <p>
 * 按操作类型打标签的逆操作快照，每条只携带撤销该操作所需的字段：
 * <pre>
 * CREATE / DUPLICATE   index                 → 删除 index 处的框
 * MOVE / RESIZE        index, before         → index 处恢复为 before
 * ASSIGN_CLASS         index, before         → index 处恢复为 before，并回滚类别增长
 * DELETE               index, before         → 在 index 处重新插入 before
 * </pre>
 * 所有记录都带有操作前的选中位置，以及操作前后的类别注册表大小。
 */
public final class UndoEntry {

    public enum Kind {
        CREATE,
        MOVE,
        RESIZE,
        DELETE,
        DUPLICATE,
        ASSIGN_CLASS
    }

    private final Kind kind;
    private final int index;
    private final Box before;
    private final Box after;
    private final int registrySizeBefore;
    private final int registrySizeAfter;
    private final Integer priorSelection;

    private UndoEntry(Kind kind, int index, Box before, Box after,
                      int registrySizeBefore, int registrySizeAfter, Integer priorSelection) {
        this.kind = kind;
        this.index = index;
        this.before = before;
        this.after = after;
        this.registrySizeBefore = registrySizeBefore;
        this.registrySizeAfter = registrySizeAfter;
        this.priorSelection = priorSelection;
    }

    public static UndoEntry created(int index, Box created, int registrySize, Integer priorSelection) {
        return new UndoEntry(Kind.CREATE, index, null, created, registrySize, registrySize, priorSelection);
    }

    public static UndoEntry moved(int index, Box before, Box after, int registrySize, Integer priorSelection) {
        return new UndoEntry(Kind.MOVE, index, before, after, registrySize, registrySize, priorSelection);
    }

    public static UndoEntry resized(int index, Box before, Box after, int registrySize, Integer priorSelection) {
        return new UndoEntry(Kind.RESIZE, index, before, after, registrySize, registrySize, priorSelection);
    }

    public static UndoEntry deleted(int index, Box removed, int registrySize, Integer priorSelection) {
        return new UndoEntry(Kind.DELETE, index, removed, null, registrySize, registrySize, priorSelection);
    }

    public static UndoEntry duplicated(int copyIndex, Box copy, int registrySize, Integer priorSelection) {
        return new UndoEntry(Kind.DUPLICATE, copyIndex, null, copy, registrySize, registrySize, priorSelection);
    }

    public static UndoEntry classAssigned(int index, Box before, Box after,
                                          int registrySizeBefore, int registrySizeAfter, Integer priorSelection) {
        return new UndoEntry(Kind.ASSIGN_CLASS, index, before, after, registrySizeBefore, registrySizeAfter, priorSelection);
    }

    public Kind getKind() { return kind; }
    public int getIndex() { return index; }
    public Box getBefore() { return before; }
    public Box getAfter() { return after; }
    public int getRegistrySizeBefore() { return registrySizeBefore; }
    public int getRegistrySizeAfter() { return registrySizeAfter; }
    public Integer getPriorSelection() { return priorSelection; }

    public boolean grewRegistry() {
        return registrySizeAfter > registrySizeBefore;
    }

    @Override
    public String toString() {
        return "UndoEntry[" + kind + " @" + index + "]";
    }
}
