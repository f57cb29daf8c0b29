package com.edge.annotator.core.codec;

import com.edge.annotator.core.model.Box;
import com.edge.annotator.core.model.ClassRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * YOLO 格式标注文件编解码
 * <p>
 * 每行一个框:
 * <class_token> <center_x> <center_y> <width> <height>
 * <p>
 * 坐标为归一化值 (0.0 - 1.0)。类别字段可以是数字 ID，也可以是旧版文件中的类别名称，
 * 统一经 {@link ClassRegistry#resolve(String)} 转换。写出时总是使用数字 ID、固定 6 位小数。
 * 字段数量、顺序和数字 ID 约定被外部训练流程依赖，不可更改。
 */
public class AnnotationFileCodec {
    private static final Logger logger = LoggerFactory.getLogger(AnnotationFileCodec.class);

    public static final String ANNOTATION_EXTENSION = ".txt";

    private static final int FIELD_COUNT = 5;
    private static final String LINE_FORMAT = "%d %.6f %.6f %.6f %.6f\n";
    // 6 位小数下可表示的最小正尺寸，更小的宽高写出后会变成 0，重新加载时被拒绝
    private static final double MIN_WRITTEN_SIZE = 0.000001;

    /**
     * 图片对应的标注文件：同目录下 <basename>.txt
     */
    public static Path annotationPathFor(Path imagePath) {
        String fileName = imagePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return imagePath.resolveSibling(baseName + ANNOTATION_EXTENSION);
    }

    /**
     * 读取标注文件，文件不存在时返回空结果
     */
    public ParseResult read(Path labelPath, ClassRegistry registry) throws IOException {
        if (!Files.exists(labelPath)) {
            logger.debug("Label file not found: {}", labelPath);
            return ParseResult.empty();
        }
        List<String> lines = LineDecoder.readLines(labelPath);
        ParseResult result = parse(lines, registry);
        logger.info("Parsed {} boxes from {} ({} line errors)", result.getBoxes().size(), labelPath,
            result.getErrors().size());
        return result;
    }

    /**
     * 逐行解析，格式错误的行被跳过并记录，解析继续
     *
     * @param lines 文件各行，null 表示该行不是合法的 UTF-8
     */
    public ParseResult parse(List<String> lines, ClassRegistry registry) {
        List<Box> boxes = new ArrayList<>();
        List<LineError> errors = new ArrayList<>();
        int sizeBefore = registry.size();
        int lineNumber = 0;

        for (String raw : lines) {
            lineNumber++;
            if (raw == null) {
                errors.add(new LineError(lineNumber, "", "line is not valid UTF-8"));
                continue;
            }
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                boxes.add(parseLine(line, registry));
            } catch (IllegalArgumentException e) {
                errors.add(new LineError(lineNumber, line, e.getMessage()));
            }
        }

        for (LineError error : errors) {
            logger.warn("Skipped annotation {}", error);
        }
        return new ParseResult(boxes, errors, registry.size() - sizeBefore);
    }

    /**
     * 解析单行标注。先校验数值字段，再解析类别，格式错误的行不会让注册表增长。
     */
    private Box parseLine(String line, ClassRegistry registry) {
        String[] parts = line.split("\\s+");
        if (parts.length != FIELD_COUNT) {
            throw new IllegalArgumentException("expected " + FIELD_COUNT + " fields but found " + parts.length);
        }

        double cx = parseNumber(parts[1], "cx");
        double cy = parseNumber(parts[2], "cy");
        double w = parseNumber(parts[3], "w");
        double h = parseNumber(parts[4], "h");
        if (w <= 0 || h <= 0) {
            throw new IllegalArgumentException("non-positive box size " + parts[3] + "x" + parts[4]);
        }

        int classId = registry.resolve(parts[0]);
        return new Box(classId, cx, cy, w, h);
    }

    private static double parseNumber(String field, String name) {
        double value;
        try {
            value = Double.parseDouble(field);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number for " + name + ": " + field);
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("non-finite value for " + name + ": " + field);
        }
        return value;
    }

    /**
     * 序列化：按集合顺序每框一行，数字类别 ID，固定 6 位小数。宽高至少写出 0.000001。
     */
    public String serialize(List<Box> boxes) {
        StringBuilder sb = new StringBuilder();
        for (Box box : boxes) {
            sb.append(String.format(Locale.ROOT, LINE_FORMAT,
                box.getClassId(), box.getCx(), box.getCy(),
                Math.max(box.getW(), MIN_WRITTEN_SIZE), Math.max(box.getH(), MIN_WRITTEN_SIZE)));
        }
        return sb.toString();
    }

    /**
     * 写出标注文件（整体覆盖）
     *
     * @throws AnnotationSaveException 缺少写权限或其他 IO 错误
     */
    public void write(Path labelPath, List<Box> boxes) throws AnnotationSaveException {
        try {
            Files.writeString(labelPath, serialize(boxes), StandardCharsets.UTF_8);
        } catch (AccessDeniedException e) {
            throw new AnnotationSaveException(AnnotationSaveException.Reason.PERMISSION_DENIED, labelPath, e);
        } catch (IOException e) {
            throw new AnnotationSaveException(AnnotationSaveException.Reason.IO_ERROR, labelPath, e);
        }
        logger.info("Saved {} boxes to {}", boxes.size(), labelPath);
    }
}
