package com.edge.annotator.service;

import com.edge.annotator.config.AnnotatorConfig;
import com.edge.annotator.config.NativeLibraryLoader;
import com.edge.annotator.core.transform.ImageSize;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 本地目录图片来源，使用 OpenCV 读取图片尺寸
 */
@Component
public class FolderImageSource implements ImageSource {
    private static final Logger logger = LoggerFactory.getLogger(FolderImageSource.class);

    private final Set<String> extensions;

    public FolderImageSource(AnnotatorConfig config) {
        this.extensions = config.getWorkspace().getImageExtensions().stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
            .collect(Collectors.toSet());
    }

    @Override
    public List<Path> listImages(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }
        try (Stream<Path> files = Files.list(directory)) {
            List<Path> images = files
                .filter(Files::isRegularFile)
                .filter(this::isSupported)
                .sorted()
                .collect(Collectors.toList());
            logger.info("Found {} images in {}", images.size(), directory);
            return images;
        }
    }

    @Override
    public ImageSize dimensionsOf(Path image) throws IOException {
        if (!Files.exists(image)) {
            throw new IOException("Image not found: " + image);
        }
        NativeLibraryLoader.loadNativeLibraries();
        Mat mat = Imgcodecs.imread(image.toString(), Imgcodecs.IMREAD_UNCHANGED);
        try {
            if (mat.empty()) {
                throw new IOException("Cannot decode image: " + image);
            }
            return new ImageSize(mat.cols(), mat.rows());
        } finally {
            mat.release();
        }
    }

    boolean isSupported(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
