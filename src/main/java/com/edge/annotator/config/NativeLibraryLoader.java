package com.edge.annotator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV 的 JNI 库（用于读取图片尺寸）
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    /**
     * 加载 OpenCV native 库，必须在调用任何 OpenCV API 之前执行
     *
     * @throws IllegalStateException 当前平台无法加载 OpenCV
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }
        logger.info("Loading OpenCV native library via openpnp...");
        try {
            nu.pattern.OpenCV.loadLocally();
        } catch (UnsatisfiedLinkError | RuntimeException e) {
            throw new IllegalStateException("Failed to load OpenCV native library: " + e.getMessage(), e);
        }
        logger.info("OpenCV loaded successfully (version {})", org.opencv.core.Core.VERSION);
        loaded = true;
    }
}
