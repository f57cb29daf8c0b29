package com.edge.annotator.config;

import com.edge.annotator.core.edit.InteractionSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-annotator")
public class AnnotatorConfig {
    private WorkspaceConfig workspace = new WorkspaceConfig();
    private InteractionConfig interaction = new InteractionConfig();
    private EditConfig edit = new EditConfig();
    private SessionConfig session = new SessionConfig();

    @Data
    public static class WorkspaceConfig {
        private String imageDirectory;                  // 启动时自动打开的图片目录（可选）
        private String classesFile = "_darknet.labels"; // 类别文件名，位于图片目录下
        private List<String> imageExtensions = new ArrayList<>(
            List.of("png", "jpg", "jpeg", "bmp", "webp", "tif", "tiff"));
    }

    @Data
    public static class InteractionConfig {
        private double clickTolerance = 8.0;   // 像素
        private double minBoxPixels = 6.0;     // 像素
        private double minHandleRadius = 6.0;  // 像素

        public InteractionSettings toSettings() {
            return new InteractionSettings(clickTolerance, minBoxPixels, minHandleRadius);
        }
    }

    @Data
    public static class EditConfig {
        private int undoCapacity = 100;
        private String defaultClass = "object";
    }

    @Data
    public static class SessionConfig {
        // 切换图片时自动保存；false 则丢弃未保存的修改
        private boolean saveOnNavigate = true;
    }
}
