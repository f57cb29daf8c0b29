package com.edge.annotator.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 类别注册表
 * <p>
 * 有序、只追加的 名称 ↔ ID 表，ID 即名称在列表中的位置。
 * 会话期间 ID 不会被重新编号或删除，其他标注文件引用的 ID 因此始终有效。
 * <p>
 * 唯一的收缩途径是 {@link #rollbackGrowth(int, int)}：撤销某次编辑引起的增长，
 * 且永远不会回退到已经写入类别文件的条目之下。
 */
public class ClassRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ClassRegistry.class);

    /** 允许的最大类别 ID，防止异常标注行生成海量占位类别 */
    public static final int MAX_CLASS_ID = 65535;

    private static final String PLACEHOLDER_PREFIX = "class_";

    private final List<String> names = new ArrayList<>();
    private final Map<String, Integer> ids = new HashMap<>();
    private int persistedSize;

    public ClassRegistry() {
    }

    public ClassRegistry(List<String> initialNames) {
        for (String name : initialNames) {
            addExplicit(name);
        }
    }

    /**
     * 解析标注文件中的类别字段
     * <ul>
     *   <li>数字且在范围内：直接返回</li>
     *   <li>数字但超出范围：用占位名称补齐到该 ID（含），返回原 ID</li>
     *   <li>文本且已存在：返回对应 ID</li>
     *   <li>文本且不存在：作为新类别追加</li>
     * </ul>
     *
     * @param token 类别字段（数字 ID 或旧版的类别名称）
     * @return 类别 ID
     * @throws IllegalArgumentException 负数、超出上限或空白字段
     */
    public int resolve(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Empty class token");
        }
        String trimmed = token.trim();
        if (isNumeric(trimmed)) {
            int id = parseId(trimmed);
            ensureCapacity(id);
            return id;
        }
        if (trimmed.startsWith("-") && isNumeric(trimmed.substring(1))) {
            throw new IllegalArgumentException("Negative class id: " + trimmed);
        }
        Integer existing = ids.get(trimmed);
        if (existing != null) {
            return existing;
        }
        int id = append(trimmed);
        logger.info("Legacy class name '{}' registered as id {}", trimmed, id);
        return id;
    }

    /**
     * 显式添加类别（幂等）
     *
     * @return 已存在时返回原 ID，否则返回新 ID
     * @throws IllegalArgumentException 名称为空白或包含换行（类别文件每行一个名称）
     */
    public int addExplicit(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Class name must not be blank");
        }
        if (name.indexOf('\n') >= 0 || name.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Class name must not contain line breaks");
        }
        String trimmed = name.trim();
        Integer existing = ids.get(trimmed);
        if (existing != null) {
            return existing;
        }
        return append(trimmed);
    }

    /**
     * 确保 ID 可用，不足时补齐占位类别
     */
    public void ensureCapacity(int id) {
        if (id < 0 || id > MAX_CLASS_ID) {
            throw new IllegalArgumentException("Class id out of range: " + id);
        }
        if (id < names.size()) {
            return;
        }
        int from = names.size();
        while (names.size() <= id) {
            append(placeholderName(names.size()));
        }
        logger.warn("Class id {} not in registry, created placeholder classes {}..{}", id, from, id);
    }

    /**
     * 撤销编辑引起的增长，只移除该编辑追加且尚未持久化的条目
     * <p>
     * 若编辑之后注册表又有其他增长（例如显式添加类别），当前大小与 sizeAfter 不一致，不做任何回滚。
     *
     * @param sizeBefore 编辑前的注册表大小
     * @param sizeAfter  编辑后的注册表大小
     * @return 实际移除的条目数
     */
    public int rollbackGrowth(int sizeBefore, int sizeAfter) {
        if (names.size() != sizeAfter) {
            logger.debug("Registry changed since edit (size {} != {}), keeping classes", names.size(), sizeAfter);
            return 0;
        }
        int floor = Math.max(sizeBefore, persistedSize);
        int removed = 0;
        while (names.size() > floor) {
            String name = names.remove(names.size() - 1);
            ids.remove(name);
            removed++;
        }
        if (removed > 0) {
            logger.debug("Rolled back {} class(es), registry size now {}", removed, names.size());
        }
        return removed;
    }

    public String nameOf(int id) {
        if (!contains(id)) {
            throw new IllegalArgumentException("Unknown class id: " + id);
        }
        return names.get(id);
    }

    public Optional<Integer> idOf(String name) {
        return Optional.ofNullable(name == null ? null : ids.get(name.trim()));
    }

    public boolean contains(int id) {
        return id >= 0 && id < names.size();
    }

    public int size() {
        return names.size();
    }

    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    /**
     * 记录当前内容已写入类别文件
     */
    public void markPersisted() {
        persistedSize = names.size();
    }

    public boolean hasUnpersistedEntries() {
        return names.size() != persistedSize;
    }

    private int append(String name) {
        int id = names.size();
        names.add(name);
        ids.put(name, id);
        return id;
    }

    private String placeholderName(int id) {
        String candidate = PLACEHOLDER_PREFIX + id;
        int suffix = 1;
        while (ids.containsKey(candidate)) {
            candidate = PLACEHOLDER_PREFIX + id + "_" + suffix++;
        }
        return candidate;
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static int parseId(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Class id out of range: " + digits, e);
        }
    }

    @Override
    public String toString() {
        return "ClassRegistry" + names;
    }
}
