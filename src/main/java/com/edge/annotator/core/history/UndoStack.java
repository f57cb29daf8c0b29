package com.edge.annotator.core.history;

import com.edge.annotator.core.model.AnnotationSet;
import com.edge.annotator.core.model.ClassRegistry;
import com.edge.annotator.core.model.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * 撤销栈
 * <p>
 * 固定容量，超出时丢弃最旧的记录。只作用于当前图片，切换图片时必须 {@link #clear()}。
 * 不支持重做。
 */
public class UndoStack {
    private static final Logger logger = LoggerFactory.getLogger(UndoStack.class);

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<UndoEntry> entries = new ArrayDeque<>();

    public UndoStack() {
        this(DEFAULT_CAPACITY);
    }

    public UndoStack(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Undo capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void push(UndoEntry entry) {
        entries.push(entry);
        if (entries.size() > capacity) {
            UndoEntry evicted = entries.removeLast();
            logger.debug("Undo capacity {} reached, evicted {}", capacity, evicted);
        }
    }

    /**
     * 弹出最新记录并应用其逆操作
     *
     * @return 被撤销的记录，栈为空时返回 empty
     */
    public Optional<UndoEntry> undo(AnnotationSet set, Selection selection, ClassRegistry registry) {
        UndoEntry entry = entries.poll();
        if (entry == null) {
            return Optional.empty();
        }

        switch (entry.getKind()) {
            case CREATE, DUPLICATE -> {
                requireIndex(set, entry, set.size());
                set.remove(entry.getIndex());
            }
            case MOVE, RESIZE, ASSIGN_CLASS -> {
                requireIndex(set, entry, set.size());
                set.set(entry.getIndex(), entry.getBefore());
            }
            case DELETE -> {
                requireIndex(set, entry, set.size() + 1);
                set.insert(entry.getIndex(), entry.getBefore());
            }
        }

        if (entry.grewRegistry()) {
            registry.rollbackGrowth(entry.getRegistrySizeBefore(), entry.getRegistrySizeAfter());
        }
        selection.resetMode();
        selection.restore(entry.getPriorSelection());
        if (!selection.isValidIn(set)) {
            selection.clear();
        }
        logger.debug("Undid {}", entry);
        return Optional.of(entry);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }

    private static void requireIndex(AnnotationSet set, UndoEntry entry, int bound) {
        if (entry.getIndex() < 0 || entry.getIndex() >= bound) {
            throw new IllegalStateException("Undo entry " + entry + " does not match annotation set of size " + set.size());
        }
    }
}
