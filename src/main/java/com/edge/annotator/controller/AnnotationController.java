package com.edge.annotator.controller;

import com.edge.annotator.core.codec.AnnotationSaveException;
import com.edge.annotator.core.model.Corner;
import com.edge.annotator.core.model.Point;
import com.edge.annotator.dto.EditRequests.AssignClassRequest;
import com.edge.annotator.dto.EditRequests.ClassNameRequest;
import com.edge.annotator.dto.EditRequests.CreateBoxRequest;
import com.edge.annotator.dto.EditRequests.CurrentClassRequest;
import com.edge.annotator.dto.EditRequests.MoveRequest;
import com.edge.annotator.dto.EditRequests.NavigateRequest;
import com.edge.annotator.dto.EditRequests.OpenRequest;
import com.edge.annotator.dto.EditRequests.ResizeRequest;
import com.edge.annotator.dto.PointerRequest;
import com.edge.annotator.dto.SessionStateResponse;
import com.edge.annotator.dto.ViewportDto;
import com.edge.annotator.service.AnnotationSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * 标注编辑 API
 * <p>
 * 界面层把指针/键盘事件连同当前视口一起转发到这里，每个接口都返回完整的会话状态用于重绘。
 * 错误统一由 {@link ApiExceptionHandler} 转换为响应。
 */
@Tag(name = "标注编辑", description = "边界框标注的新建、选择、移动、缩放、删除、复制、改类别、撤销与保存")
@RestController
@RequestMapping("/api/annotator")
public class AnnotationController {
    private static final Logger logger = LoggerFactory.getLogger(AnnotationController.class);

    private final AnnotationSession session;

    public AnnotationController(AnnotationSession session) {
        this.session = session;
    }

    // ==================== 目录与图片 ====================

    @Operation(summary = "打开图片目录", description = "加载目录下的类别文件并激活第一张图片")
    @PostMapping("/open")
    public ResponseEntity<SessionStateResponse> open(@RequestBody OpenRequest request) throws IOException {
        if (request == null || !StringUtils.hasText(request.getDirectory())) {
            throw new IllegalArgumentException("directory is required");
        }
        logger.info("Open directory request: {}", request.getDirectory());
        return ResponseEntity.ok(session.open(Paths.get(request.getDirectory())));
    }

    @Operation(summary = "切换图片", description = "direction 为 next / previous，或指定 index；按配置先保存当前图片")
    @PostMapping("/navigate")
    public ResponseEntity<SessionStateResponse> navigate(@RequestBody NavigateRequest request) throws IOException {
        if (request.getIndex() != null) {
            return ResponseEntity.ok(session.goTo(request.getIndex()));
        }
        String direction = request.getDirection() == null ? "" : request.getDirection().toLowerCase(Locale.ROOT);
        return switch (direction) {
            case "next" -> ResponseEntity.ok(session.next());
            case "previous", "prev" -> ResponseEntity.ok(session.previous());
            default -> throw new IllegalArgumentException("direction must be next or previous: " + request.getDirection());
        };
    }

    @Operation(summary = "获取会话状态", description = "视口参数可选，用于计算新建预览框")
    @GetMapping("/state")
    public ResponseEntity<SessionStateResponse> state(
            @RequestParam(defaultValue = "1.0") double zoom,
            @RequestParam(defaultValue = "0") double panX,
            @RequestParam(defaultValue = "0") double panY) {
        ViewportDto viewport = new ViewportDto();
        viewport.setZoom(zoom);
        viewport.setPanX(panX);
        viewport.setPanY(panY);
        return ResponseEntity.ok(session.state(viewport.toTransform()));
    }

    @Operation(summary = "保存", description = "写出当前图片的标注文件，必要时同时写出类别文件")
    @PostMapping("/save")
    public ResponseEntity<SessionStateResponse> save() throws AnnotationSaveException {
        return ResponseEntity.ok(session.save());
    }

    @Operation(summary = "重新加载", description = "丢弃未保存的修改，重新读取当前图片的标注文件")
    @PostMapping("/reload")
    public ResponseEntity<SessionStateResponse> reload() throws IOException {
        return ResponseEntity.ok(session.reload());
    }

    // ==================== 指针手势 ====================

    @Operation(summary = "按下指针", description = "命中手柄开始缩放，命中框开始移动，否则开始新建")
    @PostMapping("/pointer/down")
    public ResponseEntity<SessionStateResponse> pointerDown(@RequestBody PointerRequest request) {
        return ResponseEntity.ok(session.pointerDown(request.toPoint(), ViewportDto.toTransform(request.getViewport())));
    }

    @Operation(summary = "拖动指针")
    @PostMapping("/pointer/drag")
    public ResponseEntity<SessionStateResponse> pointerDrag(@RequestBody PointerRequest request) {
        return ResponseEntity.ok(session.pointerDrag(request.toPoint(), ViewportDto.toTransform(request.getViewport())));
    }

    @Operation(summary = "松开指针", description = "提交手势，产生修改时记录一条撤销")
    @PostMapping("/pointer/up")
    public ResponseEntity<SessionStateResponse> pointerUp(@RequestBody PointerRequest request) {
        return ResponseEntity.ok(session.pointerUp(request.toPoint(), ViewportDto.toTransform(request.getViewport())));
    }

    @Operation(summary = "取消手势", description = "恢复拖动前的框")
    @PostMapping("/pointer/cancel")
    public ResponseEntity<SessionStateResponse> cancelGesture() {
        return ResponseEntity.ok(session.cancelGesture());
    }

    // ==================== 编辑命令 ====================

    @Operation(summary = "选择", description = "选中指针下的框，未命中时清除选中")
    @PostMapping("/select")
    public ResponseEntity<SessionStateResponse> select(@RequestBody PointerRequest request) {
        return ResponseEntity.ok(session.selectAt(request.toPoint(), ViewportDto.toTransform(request.getViewport())));
    }

    @Operation(summary = "新建框", description = "按屏幕拖拽起止点新建，使用当前类别")
    @PostMapping("/boxes")
    public ResponseEntity<SessionStateResponse> createBox(@RequestBody CreateBoxRequest request) {
        return ResponseEntity.ok(session.createBox(
            new Point(request.getStartX(), request.getStartY()),
            new Point(request.getEndX(), request.getEndY()),
            ViewportDto.toTransform(request.getViewport())));
    }

    @Operation(summary = "移动选中框", description = "归一化偏移，中心点限制在图片内")
    @PostMapping("/move")
    public ResponseEntity<SessionStateResponse> move(@RequestBody MoveRequest request) {
        return ResponseEntity.ok(session.moveSelected(request.getDx(), request.getDy()));
    }

    @Operation(summary = "缩放选中框", description = "corner: 0 左上, 1 右上, 2 左下, 3 右下")
    @PostMapping("/resize")
    public ResponseEntity<SessionStateResponse> resize(@RequestBody ResizeRequest request) {
        return ResponseEntity.ok(session.resizeSelected(
            Corner.fromIndex(request.getCorner()),
            new Point(request.getX(), request.getY()),
            ViewportDto.toTransform(request.getViewport())));
    }

    @Operation(summary = "删除选中框")
    @PostMapping("/delete")
    public ResponseEntity<SessionStateResponse> delete() {
        return ResponseEntity.ok(session.deleteSelected());
    }

    @Operation(summary = "复制选中框", description = "副本插入在原框之后并被选中")
    @PostMapping("/duplicate")
    public ResponseEntity<SessionStateResponse> duplicate() {
        return ResponseEntity.ok(session.duplicateSelected());
    }

    @Operation(summary = "设置选中框类别", description = "classId 与 className 二选一")
    @PostMapping("/assign-class")
    public ResponseEntity<SessionStateResponse> assignClass(@RequestBody AssignClassRequest request) {
        if (request.getClassId() != null) {
            return ResponseEntity.ok(session.assignClass(request.getClassId()));
        }
        if (StringUtils.hasText(request.getClassName())) {
            return ResponseEntity.ok(session.assignClass(request.getClassName()));
        }
        throw new IllegalArgumentException("classId or className is required");
    }

    @Operation(summary = "撤销", description = "撤销最近一次修改，仅作用于当前图片")
    @PostMapping("/undo")
    public ResponseEntity<SessionStateResponse> undo() {
        return ResponseEntity.ok(session.undo());
    }

    // ==================== 类别 ====================

    @Operation(summary = "添加类别", description = "追加到类别文件并设为当前类别，已存在时直接选中")
    @PostMapping("/classes")
    public ResponseEntity<SessionStateResponse> addClass(@RequestBody ClassNameRequest request)
            throws AnnotationSaveException {
        if (request == null || !StringUtils.hasText(request.getName())) {
            throw new IllegalArgumentException("name is required");
        }
        return ResponseEntity.ok(session.addClass(request.getName()));
    }

    @Operation(summary = "设置当前类别", description = "新建框使用的类别")
    @PutMapping("/current-class")
    public ResponseEntity<SessionStateResponse> setCurrentClass(@RequestBody CurrentClassRequest request) {
        return ResponseEntity.ok(session.setCurrentClass(request.getClassId()));
    }
}
