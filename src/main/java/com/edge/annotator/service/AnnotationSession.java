package com.edge.annotator.service;

import com.edge.annotator.config.AnnotatorConfig;
import com.edge.annotator.core.codec.AnnotationFileCodec;
import com.edge.annotator.core.codec.AnnotationSaveException;
import com.edge.annotator.core.codec.ClassFileCodec;
import com.edge.annotator.core.codec.LineError;
import com.edge.annotator.core.codec.ParseResult;
import com.edge.annotator.core.edit.EditEngine;
import com.edge.annotator.core.edit.InteractionSettings;
import com.edge.annotator.core.model.AnnotationSet;
import com.edge.annotator.core.model.Box;
import com.edge.annotator.core.model.ClassRegistry;
import com.edge.annotator.core.model.Corner;
import com.edge.annotator.core.model.Point;
import com.edge.annotator.core.model.Selection;
import com.edge.annotator.core.transform.ImageSize;
import com.edge.annotator.core.transform.ViewportTransform;
import com.edge.annotator.dto.BoxView;
import com.edge.annotator.dto.SessionStateResponse;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 标注会话
 * <p>
 * 持有进程级的类别注册表和当前活动图片的编辑引擎，负责图片切换、加载、保存。
 * HTTP 请求在多个线程上到达，所有操作都通过对象锁串行执行，编辑与加载/保存不会交错。
 */
@Service
public class AnnotationSession {
    private static final Logger logger = LoggerFactory.getLogger(AnnotationSession.class);

    private final AnnotatorConfig config;
    private final ImageSource imageSource;
    private final AnnotationFileCodec annotationCodec = new AnnotationFileCodec();
    private final ClassFileCodec classCodec;
    private final InteractionSettings settings;

    private Path directory;
    private List<Path> images = new ArrayList<>();
    private int currentIndex = -1;
    private ClassRegistry registry;
    private EditEngine engine;
    private int currentClassId;
    private List<LineError> loadErrors = new ArrayList<>();

    public AnnotationSession(AnnotatorConfig config, ImageSource imageSource) {
        this.config = config;
        this.imageSource = imageSource;
        this.classCodec = new ClassFileCodec(config.getEdit().getDefaultClass());
        this.settings = config.getInteraction().toSettings();
    }

    @PostConstruct
    public void init() {
        String configured = config.getWorkspace().getImageDirectory();
        if (!StringUtils.hasText(configured)) {
            logger.info("No image directory configured, waiting for open request");
            return;
        }
        try {
            open(Paths.get(configured));
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to open configured image directory: {}", configured, e);
        }
    }

    // ==================== 目录与图片切换 ====================

    /**
     * 打开图片目录：加载类别文件，激活第一张图片
     * <p>
     * 当前图片的未保存修改按配置先保存或丢弃；加载失败时会话保持打开前的状态。
     */
    public synchronized SessionStateResponse open(Path dir) throws IOException {
        List<Path> found = imageSource.listImages(dir);
        ClassRegistry loaded = classCodec.read(dir.resolve(config.getWorkspace().getClassesFile()));
        leaveActive();

        Path oldDirectory = directory;
        List<Path> oldImages = images;
        ClassRegistry oldRegistry = registry;
        EditEngine oldEngine = engine;
        int oldIndex = currentIndex;
        int oldClassId = currentClassId;
        List<LineError> oldErrors = loadErrors;

        this.directory = dir;
        this.images = found;
        this.registry = loaded;
        this.currentClassId = 0;
        this.engine = null;
        this.currentIndex = -1;
        this.loadErrors = new ArrayList<>();
        try {
            if (!images.isEmpty()) {
                activate(0);
            }
        } catch (IOException | RuntimeException e) {
            this.directory = oldDirectory;
            this.images = oldImages;
            this.registry = oldRegistry;
            this.engine = oldEngine;
            this.currentIndex = oldIndex;
            this.currentClassId = oldClassId;
            this.loadErrors = oldErrors;
            throw e;
        }
        logger.info("Opened {} with {} images and {} classes", dir, images.size(), registry.size());
        return snapshot(null, false, null);
    }

    public synchronized SessionStateResponse next() throws IOException {
        requireImages();
        return navigateTo(currentIndex < 0 ? 0 : (currentIndex + 1) % images.size());
    }

    public synchronized SessionStateResponse previous() throws IOException {
        requireImages();
        return navigateTo(currentIndex <= 0 ? images.size() - 1 : currentIndex - 1);
    }

    public synchronized SessionStateResponse goTo(int index) throws IOException {
        requireImages();
        if (index < 0 || index >= images.size()) {
            throw new IllegalArgumentException("Image index out of range: " + index);
        }
        return navigateTo(index);
    }

    /**
     * 切换前按配置保存或丢弃未保存的修改；保存失败时中止切换，修改保留在内存中
     */
    private SessionStateResponse navigateTo(int index) throws IOException {
        leaveActive();
        activate(index);
        return snapshot(null, false, null);
    }

    private void leaveActive() throws AnnotationSaveException {
        if (engine != null && engine.getAnnotations().isDirty()) {
            if (config.getSession().isSaveOnNavigate()) {
                saveActive();
            } else {
                logger.info("Discarding unsaved edits of {}", images.get(currentIndex).getFileName());
            }
        }
    }

    /**
     * 激活图片：读取尺寸和标注文件，新建编辑引擎（撤销栈随之清空）
     */
    private void activate(int index) throws IOException {
        Path image = images.get(index);
        ImageSize size = imageSource.dimensionsOf(image);
        ParseResult parsed = annotationCodec.read(AnnotationFileCodec.annotationPathFor(image), registry);

        EditEngine activated = new EditEngine(registry, new AnnotationSet(parsed.getBoxes()), size,
            settings, config.getEdit().getUndoCapacity());
        if (registry.contains(currentClassId)) {
            activated.setCurrentClassId(currentClassId);
        }
        this.engine = activated;
        this.currentIndex = index;
        this.loadErrors = new ArrayList<>(parsed.getErrors());

        if (parsed.hasErrors()) {
            logger.warn("{} line(s) skipped while loading {}", parsed.getErrors().size(), image.getFileName());
        }
        if (parsed.getRegistryGrowth() > 0) {
            persistClassesQuietly();
        }
        logger.info("Activated image {}/{}: {} ({}, {} boxes)", index + 1, images.size(),
            image.getFileName(), size, parsed.getBoxes().size());
    }

    // ==================== 保存 / 重新加载 ====================

    public synchronized SessionStateResponse save() throws AnnotationSaveException {
        requireActive();
        saveActive();
        return snapshot(null, false, "Saved");
    }

    /**
     * 重新读取当前图片的标注文件，丢弃未保存的修改
     */
    public synchronized SessionStateResponse reload() throws IOException {
        requireActive();
        activate(currentIndex);
        return snapshot(null, false, "Reloaded");
    }

    private void saveActive() throws AnnotationSaveException {
        Path image = images.get(currentIndex);
        if (registry.hasUnpersistedEntries()) {
            classCodec.write(classesPath(), registry);
        }
        List<Box> boxes = engine.getAnnotations().boxes();
        annotationCodec.write(AnnotationFileCodec.annotationPathFor(image), boxes);
        engine.getAnnotations().markSaved();
    }

    /**
     * 加载引入的新类别立即写入类别文件；失败只记录日志，下次保存时重试
     */
    private void persistClassesQuietly() {
        try {
            classCodec.write(classesPath(), registry);
        } catch (AnnotationSaveException e) {
            logger.error("Could not persist discovered classes, will retry on next save: {}", e.getMessage());
        }
    }

    // ==================== 编辑 ====================

    public synchronized SessionStateResponse pointerDown(Point screenPoint, ViewportTransform transform) {
        requireActive();
        engine.pointerDown(screenPoint, transform);
        return snapshot(transform, false, null);
    }

    public synchronized SessionStateResponse pointerDrag(Point screenPoint, ViewportTransform transform) {
        requireActive();
        engine.pointerDrag(screenPoint, transform);
        return snapshot(transform, false, null);
    }

    public synchronized SessionStateResponse pointerUp(Point screenPoint, ViewportTransform transform) {
        requireActive();
        boolean changed = engine.pointerUp(screenPoint, transform);
        return snapshot(transform, changed, null);
    }

    public synchronized SessionStateResponse cancelGesture() {
        requireActive();
        engine.cancelGesture();
        return snapshot(null, false, null);
    }

    public synchronized SessionStateResponse selectAt(Point screenPoint, ViewportTransform transform) {
        requireActive();
        engine.selectAt(screenPoint, transform);
        return snapshot(transform, false, null);
    }

    public synchronized SessionStateResponse createBox(Point start, Point end, ViewportTransform transform) {
        requireActive();
        return snapshot(transform, engine.createBox(start, end, transform), null);
    }

    public synchronized SessionStateResponse moveSelected(double dx, double dy) {
        requireActive();
        return snapshot(null, engine.moveSelected(dx, dy), null);
    }

    public synchronized SessionStateResponse resizeSelected(Corner corner, Point screenTarget, ViewportTransform transform) {
        requireActive();
        return snapshot(transform, engine.resizeSelected(corner, screenTarget, transform), null);
    }

    public synchronized SessionStateResponse deleteSelected() {
        requireActive();
        return snapshot(null, engine.deleteSelected(), null);
    }

    public synchronized SessionStateResponse duplicateSelected() {
        requireActive();
        return snapshot(null, engine.duplicateSelected(), null);
    }

    public synchronized SessionStateResponse assignClass(int classId) {
        requireActive();
        return snapshot(null, engine.assignClass(classId), null);
    }

    public synchronized SessionStateResponse assignClass(String className) {
        requireActive();
        return snapshot(null, engine.assignClass(className), null);
    }

    public synchronized SessionStateResponse undo() {
        requireActive();
        return snapshot(null, engine.undo(), null);
    }

    // ==================== 类别 ====================

    /**
     * 显式添加类别并设为当前类别，立即写入类别文件
     */
    public synchronized SessionStateResponse addClass(String name) throws AnnotationSaveException {
        requireOpen();
        int id = registry.addExplicit(name);
        if (registry.hasUnpersistedEntries()) {
            classCodec.write(classesPath(), registry);
        }
        selectClass(id);
        logger.info("Class '{}' available as id {}", name.trim(), id);
        return snapshot(null, false, null);
    }

    public synchronized SessionStateResponse setCurrentClass(int classId) {
        requireOpen();
        if (!registry.contains(classId)) {
            throw new IllegalArgumentException("Unknown class id: " + classId);
        }
        selectClass(classId);
        return snapshot(null, false, null);
    }

    public synchronized SessionStateResponse state(ViewportTransform transform) {
        return snapshot(transform, false, null);
    }

    public synchronized boolean isDirty() {
        return engine != null && engine.getAnnotations().isDirty();
    }

    private void selectClass(int classId) {
        this.currentClassId = classId;
        if (engine != null) {
            engine.setCurrentClassId(classId);
        }
    }

    // ==================== 内部工具 ====================

    private Path classesPath() {
        return directory.resolve(config.getWorkspace().getClassesFile());
    }

    private void requireOpen() {
        if (registry == null) {
            throw new IllegalStateException("No image directory is open");
        }
    }

    private void requireImages() {
        requireOpen();
        if (images.isEmpty()) {
            throw new IllegalStateException("No images in " + directory);
        }
    }

    private void requireActive() {
        if (engine == null) {
            throw new IllegalStateException("No image is active");
        }
    }

    private SessionStateResponse snapshot(ViewportTransform transform, boolean changed, String message) {
        SessionStateResponse response = new SessionStateResponse();
        response.setSuccess(true);
        response.setChanged(changed);
        response.setMessage(message);
        response.setImageCount(images.size());
        if (directory != null) {
            response.setDirectory(directory.toString());
        }
        if (registry != null) {
            response.setClasses(new ArrayList<>(registry.names()));
            response.setCurrentClassId(registry.contains(currentClassId) ? currentClassId : 0);
        }
        if (engine == null) {
            return response;
        }

        AnnotationSet annotations = engine.getAnnotations();
        Selection selection = engine.getSelection();
        response.setImageIndex(currentIndex);
        response.setImageName(images.get(currentIndex).getFileName().toString());
        response.setImageWidth(engine.getImageSize().getWidth());
        response.setImageHeight(engine.getImageSize().getHeight());
        response.setDirty(annotations.isDirty());
        response.setUndoDepth(engine.getUndoStack().size());
        response.setUndoCapacity(engine.getUndoStack().getCapacity());
        response.setSelectedIndex(selection.snapshot());
        response.setMode(selection.getMode().name());
        response.setCorner(selection.getCorner() != null ? selection.getCorner().name() : null);
        response.setCurrentClassId(engine.getCurrentClassId());

        List<BoxView> views = new ArrayList<>(annotations.size());
        for (int i = 0; i < annotations.size(); i++) {
            views.add(BoxView.from(i, annotations.get(i), registry));
        }
        response.setBoxes(views);
        if (transform != null) {
            engine.creationPreview(transform)
                .ifPresent(preview -> response.setCreationPreview(BoxView.from(-1, preview, registry)));
        }
        response.setLoadErrors(loadErrors.stream().map(LineError::toString).collect(Collectors.toList()));
        return response;
    }
}
