package com.edge.annotator.service;

import com.edge.annotator.core.transform.ImageSize;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 图片来源
 * <p>
 * 提供目录中按扩展名筛选的有序图片列表，以及每张图片的像素尺寸（用于坐标归一化）。
 */
public interface ImageSource {

    /**
     * 列出目录中受支持的图片，按路径排序
     */
    List<Path> listImages(Path directory) throws IOException;

    /**
     * 读取图片像素尺寸
     */
    ImageSize dimensionsOf(Path image) throws IOException;
}
