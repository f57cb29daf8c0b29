package com.edge.annotator.core.edit;

import com.edge.annotator.core.hit.HitResult;
import com.edge.annotator.core.hit.HitTester;
import com.edge.annotator.core.history.UndoEntry;
import com.edge.annotator.core.history.UndoStack;
import com.edge.annotator.core.model.AnnotationSet;
import com.edge.annotator.core.model.Box;
import com.edge.annotator.core.model.ClassRegistry;
import com.edge.annotator.core.model.Corner;
import com.edge.annotator.core.model.InteractionMode;
import com.edge.annotator.core.model.Point;
import com.edge.annotator.core.model.Selection;
import com.edge.annotator.core.transform.CoordinateMapper;
import com.edge.annotator.core.transform.ImageSize;
import com.edge.annotator.core.transform.ViewportTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 标注编辑引擎
 * <p>
 * 每张活动图片一个实例：持有该图片的标注框、选中状态和撤销栈，类别注册表为进程级共享。
 * 所有修改操作都恰好压入一条撤销记录；被拒绝的交互操作是静默的空操作，返回 false。
 * <p>
 * 两类入口：
 * <ul>
 *   <li>直接操作：createBox / selectAt / moveSelected / resizeSelected / deleteSelected /
 *       duplicateSelected / assignClass</li>
 *   <li>指针手势：pointerDown → pointerDrag* → pointerUp，拖拽过程中实时更新框，松开时提交一条撤销记录</li>
 * </ul>
 * 非线程安全，调用方需保证串行访问。
 */
public class EditEngine {
    private static final Logger logger = LoggerFactory.getLogger(EditEngine.class);

    private static final double EPSILON = 1e-12;

    private final ClassRegistry registry;
    private final AnnotationSet annotations;
    private final ImageSize imageSize;
    private final InteractionSettings settings;
    private final CoordinateMapper mapper;
    private final HitTester hitTester;
    private final Selection selection = new Selection();
    private final UndoStack undoStack;

    private int currentClassId;

    // 手势状态，pointerDown 时记录
    private Point gestureStart;
    private Point gestureEnd;
    private Box gestureOrigin;
    private Integer gesturePriorSelection;
    private boolean gestureWasDirty;

    public EditEngine(ClassRegistry registry, AnnotationSet annotations, ImageSize imageSize,
                      InteractionSettings settings, int undoCapacity) {
        this.registry = registry;
        this.annotations = annotations;
        this.imageSize = imageSize;
        this.settings = settings;
        this.mapper = new CoordinateMapper();
        this.hitTester = new HitTester(mapper);
        this.undoStack = new UndoStack(undoCapacity);
    }

    // ==================== 直接操作 ====================

    public HitResult hitTest(Point screenPoint, ViewportTransform transform) {
        return hitTester.hitTest(screenPoint, annotations, selection, transform, imageSize,
            settings.getClickTolerance(), settings.getHandleRadius());
    }

    /**
     * 选中指针下的框；未命中则清除选中。命中已选中框的手柄时保持不变。
     */
    public HitResult selectAt(Point screenPoint, ViewportTransform transform) {
        cancelGesture();
        HitResult hit = hitTest(screenPoint, transform);
        switch (hit.getType()) {
            case BOX -> selection.select(hit.getBoxIndex());
            case NONE -> selection.clear();
            case HANDLE -> { }
        }
        return hit;
    }

    /**
     * 按屏幕拖拽范围新建框，使用当前类别
     *
     * @return 拖拽范围小于最小像素时返回 false，不添加框也不记录撤销
     */
    public boolean createBox(Point startScreen, Point endScreen, ViewportTransform transform) {
        cancelGesture();
        return commitCreate(startScreen, endScreen, transform, selection.snapshot());
    }

    /**
     * 平移选中的框，中心点限制在图片范围内
     *
     * @param dx 归一化 X 偏移
     * @param dy 归一化 Y 偏移
     */
    public boolean moveSelected(double dx, double dy) {
        cancelGesture();
        if (!selection.isValidIn(annotations)) {
            return false;
        }
        int index = selection.index().getAsInt();
        Box before = annotations.get(index);
        Box after = translate(before, dx, dy);
        if (after.equals(before)) {
            return false;
        }
        annotations.set(index, after);
        undoStack.push(UndoEntry.moved(index, before, after, registry.size(), selection.snapshot()));
        logger.debug("Moved box {} to ({}, {})", index, after.getCx(), after.getCy());
        return true;
    }

    /**
     * 拖动选中框的角点到指定屏幕位置，对角固定
     */
    public boolean resizeSelected(Corner corner, Point screenTarget, ViewportTransform transform) {
        cancelGesture();
        if (!selection.isValidIn(annotations)) {
            return false;
        }
        int index = selection.index().getAsInt();
        Box before = annotations.get(index);
        Box after = resize(before, corner, mapper.toNormalized(screenTarget, transform, imageSize), transform);
        if (after.equals(before)) {
            return false;
        }
        annotations.set(index, after);
        undoStack.push(UndoEntry.resized(index, before, after, registry.size(), selection.snapshot()));
        logger.debug("Resized box {} via {} to {}", index, corner, after);
        return true;
    }

    public boolean deleteSelected() {
        cancelGesture();
        if (!selection.isValidIn(annotations)) {
            return false;
        }
        Integer prior = selection.snapshot();
        int index = prior;
        Box removed = annotations.remove(index);
        selection.clear();
        undoStack.push(UndoEntry.deleted(index, removed, registry.size(), prior));
        logger.debug("Deleted box {}: {}", index, removed);
        return true;
    }

    /**
     * 复制选中的框，副本紧跟在原框之后并被选中
     */
    public boolean duplicateSelected() {
        cancelGesture();
        if (!selection.isValidIn(annotations)) {
            return false;
        }
        Integer prior = selection.snapshot();
        int copyIndex = prior + 1;
        Box copy = annotations.get(prior);
        annotations.insert(copyIndex, copy);
        selection.select(copyIndex);
        undoStack.push(UndoEntry.duplicated(copyIndex, copy, registry.size(), prior));
        logger.debug("Duplicated box {} to {}", prior, copyIndex);
        return true;
    }

    /**
     * 按 ID 设置选中框的类别，超出范围的 ID 会补齐占位类别
     */
    public boolean assignClass(int classId) {
        cancelGesture();
        if (!selection.isValidIn(annotations)) {
            return false;
        }
        int sizeBefore = registry.size();
        registry.ensureCapacity(classId);
        return applyClass(classId, sizeBefore);
    }

    /**
     * 按名称设置选中框的类别，未知名称会追加到注册表
     */
    public boolean assignClass(String className) {
        cancelGesture();
        if (!selection.isValidIn(annotations)) {
            return false;
        }
        int sizeBefore = registry.size();
        int classId = registry.resolve(className);
        return applyClass(classId, sizeBefore);
    }

    /**
     * 撤销最近一次修改
     *
     * @return 撤销栈为空时返回 false
     */
    public boolean undo() {
        cancelGesture();
        Optional<UndoEntry> undone = undoStack.undo(annotations, selection, registry);
        undone.ifPresent(entry -> logger.debug("Undo {}", entry));
        return undone.isPresent();
    }

    // ==================== 指针手势 ====================

    /**
     * 按下指针：命中手柄开始缩放，命中框则选中并开始移动，否则清除选中并开始新建
     */
    public HitResult pointerDown(Point screenPoint, ViewportTransform transform) {
        cancelGesture();
        gesturePriorSelection = selection.snapshot();
        gestureWasDirty = annotations.isDirty();
        gestureStart = screenPoint;
        gestureEnd = screenPoint;

        HitResult hit = hitTest(screenPoint, transform);
        switch (hit.getType()) {
            case HANDLE -> {
                gestureOrigin = annotations.get(hit.getBoxIndex());
                selection.beginResizing(hit.getCorner());
            }
            case BOX -> {
                selection.select(hit.getBoxIndex());
                gestureOrigin = annotations.get(hit.getBoxIndex());
                selection.beginMoving();
            }
            case NONE -> {
                selection.clear();
                selection.beginCreating();
            }
        }
        logger.debug("Pointer down at {} -> {}", screenPoint, hit);
        return hit;
    }

    /**
     * 拖动指针，移动/缩放时实时更新框
     *
     * @return 没有进行中的手势时返回 false
     */
    public boolean pointerDrag(Point screenPoint, ViewportTransform transform) {
        InteractionMode mode = selection.getMode();
        if (mode == InteractionMode.NONE) {
            return false;
        }
        gestureEnd = screenPoint;
        if (mode == InteractionMode.CREATING) {
            return true;
        }
        if (!selection.isValidIn(annotations)) {
            resetGesture();
            return false;
        }
        int index = selection.index().getAsInt();
        if (mode == InteractionMode.MOVING) {
            Point from = mapper.toNormalized(gestureStart, transform, imageSize);
            Point to = mapper.toNormalized(screenPoint, transform, imageSize);
            annotations.set(index, translate(gestureOrigin, to.x - from.x, to.y - from.y));
        } else {
            Point target = mapper.toNormalized(screenPoint, transform, imageSize);
            annotations.set(index, resize(gestureOrigin, selection.getCorner(), target, transform));
        }
        return true;
    }

    /**
     * 松开指针，提交手势
     *
     * @return 产生了修改（并记录撤销）时返回 true
     */
    public boolean pointerUp(Point screenPoint, ViewportTransform transform) {
        InteractionMode mode = selection.getMode();
        if (mode == InteractionMode.NONE) {
            return false;
        }
        if (!pointerDrag(screenPoint, transform)) {
            return false;
        }

        boolean committed;
        if (mode == InteractionMode.CREATING) {
            committed = commitCreate(gestureStart, screenPoint, transform, gesturePriorSelection);
        } else {
            committed = commitDrag(mode);
        }
        resetGesture();
        return committed;
    }

    /**
     * 放弃进行中的手势，恢复拖动前的框
     */
    public void cancelGesture() {
        InteractionMode mode = selection.getMode();
        if ((mode == InteractionMode.MOVING || mode == InteractionMode.RESIZING)
            && selection.isValidIn(annotations) && gestureOrigin != null) {
            annotations.set(selection.index().getAsInt(), gestureOrigin);
            annotations.restoreDirty(gestureWasDirty);
        }
        resetGesture();
    }

    /**
     * 新建手势的预览框（归一化坐标）
     */
    public Optional<Box> creationPreview(ViewportTransform transform) {
        if (selection.getMode() != InteractionMode.CREATING || gestureStart == null) {
            return Optional.empty();
        }
        Point a = clampToImage(mapper.toNormalized(gestureStart, transform, imageSize));
        Point b = clampToImage(mapper.toNormalized(gestureEnd, transform, imageSize));
        return Optional.of(Box.fromCorners(effectiveClassId(),
            Math.min(a.x, b.x), Math.min(a.y, b.y), Math.max(a.x, b.x), Math.max(a.y, b.y)));
    }

    // ==================== 状态 ====================

    public void setCurrentClassId(int classId) {
        if (!registry.contains(classId)) {
            throw new IllegalArgumentException("Unknown class id: " + classId);
        }
        this.currentClassId = classId;
    }

    public int getCurrentClassId() {
        return effectiveClassId();
    }

    public AnnotationSet getAnnotations() { return annotations; }
    public Selection getSelection() { return selection; }
    public UndoStack getUndoStack() { return undoStack; }
    public ImageSize getImageSize() { return imageSize; }

    // ==================== 内部实现 ====================

    private boolean commitCreate(Point startScreen, Point endScreen, ViewportTransform transform, Integer prior) {
        Point a = clampToImage(mapper.toNormalized(startScreen, transform, imageSize));
        Point b = clampToImage(mapper.toNormalized(endScreen, transform, imageSize));
        double left = Math.min(a.x, b.x);
        double right = Math.max(a.x, b.x);
        double top = Math.min(a.y, b.y);
        double bottom = Math.max(a.y, b.y);

        double minW = mapper.toNormalizedLengthX(settings.getMinBoxPixels(), transform, imageSize);
        double minH = mapper.toNormalizedLengthY(settings.getMinBoxPixels(), transform, imageSize);
        if (right - left < minW - EPSILON || bottom - top < minH - EPSILON) {
            logger.debug("Drag {} -> {} below minimum {}px, no box created",
                startScreen, endScreen, settings.getMinBoxPixels());
            return false;
        }

        Box box = Box.fromCorners(effectiveClassId(), left, top, right, bottom);
        int index = annotations.add(box);
        selection.select(index);
        undoStack.push(UndoEntry.created(index, box, registry.size(), prior));
        logger.debug("Created box {}: {}", index, box);
        return true;
    }

    private boolean commitDrag(InteractionMode mode) {
        if (!selection.isValidIn(annotations) || gestureOrigin == null) {
            return false;
        }
        int index = selection.index().getAsInt();
        Box after = annotations.get(index);
        if (after.equals(gestureOrigin)) {
            annotations.restoreDirty(gestureWasDirty);
            return false;
        }
        UndoEntry entry = mode == InteractionMode.MOVING
            ? UndoEntry.moved(index, gestureOrigin, after, registry.size(), gesturePriorSelection)
            : UndoEntry.resized(index, gestureOrigin, after, registry.size(), gesturePriorSelection);
        undoStack.push(entry);
        logger.debug("Committed {} for box {}: {} -> {}", entry.getKind(), index, gestureOrigin, after);
        return true;
    }

    private boolean applyClass(int classId, int registrySizeBefore) {
        int index = selection.index().getAsInt();
        Box before = annotations.get(index);
        if (before.getClassId() == classId) {
            return false;
        }
        Box after = before.withClassId(classId);
        annotations.set(index, after);
        undoStack.push(UndoEntry.classAssigned(index, before, after,
            registrySizeBefore, registry.size(), selection.snapshot()));
        logger.debug("Assigned class {} ({}) to box {}", classId, registry.nameOf(classId), index);
        return true;
    }

    private Box translate(Box origin, double dx, double dy) {
        return origin.withCenter(clampUnit(origin.getCx() + dx), clampUnit(origin.getCy() + dy));
    }

    /**
     * 对角固定，拖动的边跟随指针（限制在图片内）；宽高不足最小值时夹到最小值，不翻转。
     * 固定边离图片边缘不足最小值时，固定边向内让出空间，框始终留在图片内。
     */
    private Box resize(Box origin, Corner corner, Point target, ViewportTransform transform) {
        Point fixed = origin.getCorner(corner.opposite());
        double minW = Math.min(1.0, mapper.toNormalizedLengthX(settings.getMinBoxPixels(), transform, imageSize));
        double minH = Math.min(1.0, mapper.toNormalizedLengthY(settings.getMinBoxPixels(), transform, imageSize));
        double[] xs = resizeAxis(fixed.x, clampUnit(target.x), minW, corner.isLeft());
        double[] ys = resizeAxis(fixed.y, clampUnit(target.y), minH, corner.isTop());
        return Box.fromCorners(origin.getClassId(), xs[0], ys[0], xs[1], ys[1]);
    }

    /**
     * 单轴缩放
     *
     * @param draggedIsLow 拖动的是低端（左/上）边
     * @return {低端, 高端}
     */
    private static double[] resizeAxis(double fixedEdge, double target, double min, boolean draggedIsLow) {
        double low;
        double high;
        if (draggedIsLow) {
            high = fixedEdge;
            low = Math.min(target, high - min);
            if (low < 0.0) {
                low = 0.0;
                high = Math.max(high, min);
            }
        } else {
            low = fixedEdge;
            high = Math.max(target, low + min);
            if (high > 1.0) {
                high = 1.0;
                low = Math.min(low, 1.0 - min);
            }
        }
        return new double[] {low, high};
    }

    private int effectiveClassId() {
        return registry.contains(currentClassId) ? currentClassId : 0;
    }

    private void resetGesture() {
        selection.resetMode();
        gestureStart = null;
        gestureEnd = null;
        gestureOrigin = null;
        gesturePriorSelection = null;
    }

    private static Point clampToImage(Point p) {
        return new Point(clampUnit(p.x), clampUnit(p.y));
    }

    private static double clampUnit(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
