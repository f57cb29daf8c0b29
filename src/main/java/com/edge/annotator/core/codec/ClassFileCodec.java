package com.edge.annotator.core.codec;

import com.edge.annotator.core.model.ClassRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 类别文件编解码
 * <p>
 * 纯文本，每行一个类别名称，行号即类别 ID。写出时整体覆盖并以换行结尾；读取时忽略末尾空行。
 * 中间的空行或重复名称会变成占位类别，保证后续行的 ID 不发生偏移。
 */
public class ClassFileCodec {
    private static final Logger logger = LoggerFactory.getLogger(ClassFileCodec.class);

    private final String defaultClassName;

    public ClassFileCodec(String defaultClassName) {
        this.defaultClassName = defaultClassName;
    }

    /**
     * 读取类别文件，文件不存在或为空时返回仅含默认类别的注册表
     */
    public ClassRegistry read(Path classesPath) throws IOException {
        List<String> names = Files.exists(classesPath)
            ? parse(LineDecoder.readLines(classesPath))
            : List.of();

        ClassRegistry registry;
        if (names.isEmpty()) {
            logger.info("No classes in {}, using default class '{}'", classesPath, defaultClassName);
            registry = new ClassRegistry(List.of(defaultClassName));
        } else {
            registry = new ClassRegistry(names);
            registry.markPersisted();
            logger.info("Loaded {} classes from {}", registry.size(), classesPath);
        }
        return registry;
    }

    /**
     * 规整类别列表：去掉末尾空行，中间空行、无法解码的行和重复名称替换为占位名称
     *
     * @param lines 文件各行，null 表示该行不是合法的 UTF-8
     */
    public List<String> parse(List<String> lines) {
        int end = lines.size();
        while (end > 0 && lines.get(end - 1) != null && lines.get(end - 1).trim().isEmpty()) {
            end--;
        }

        List<String> names = new ArrayList<>(end);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < end; i++) {
            String raw = lines.get(i);
            String name = raw == null ? "" : raw.trim();
            if (name.isEmpty() || seen.contains(name)) {
                String placeholder = uniquePlaceholder(i, seen);
                logger.warn("Class line {} is {}, using placeholder '{}'", i + 1, describe(raw, name), placeholder);
                name = placeholder;
            }
            seen.add(name);
            names.add(name);
        }
        return names;
    }

    public String serialize(ClassRegistry registry) {
        StringBuilder sb = new StringBuilder();
        for (String name : registry.names()) {
            sb.append(name).append('\n');
        }
        return sb.toString();
    }

    /**
     * 整体覆盖写出类别文件，成功后标记注册表已持久化
     */
    public void write(Path classesPath, ClassRegistry registry) throws AnnotationSaveException {
        try {
            Files.writeString(classesPath, serialize(registry), StandardCharsets.UTF_8);
        } catch (AccessDeniedException e) {
            throw new AnnotationSaveException(AnnotationSaveException.Reason.PERMISSION_DENIED, classesPath, e);
        } catch (IOException e) {
            throw new AnnotationSaveException(AnnotationSaveException.Reason.IO_ERROR, classesPath, e);
        }
        registry.markPersisted();
        logger.info("Saved {} classes to {}", registry.size(), classesPath);
    }

    private static String describe(String raw, String name) {
        if (raw == null) {
            return "not valid UTF-8";
        }
        return name.isEmpty() ? "blank" : "duplicate '" + name + "'";
    }

    private static String uniquePlaceholder(int id, Set<String> seen) {
        String candidate = "class_" + id;
        int suffix = 1;
        while (seen.contains(candidate)) {
            candidate = "class_" + id + "_" + suffix++;
        }
        return candidate;
    }
}
