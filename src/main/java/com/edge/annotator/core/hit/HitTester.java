package com.edge.annotator.core.hit;

import com.edge.annotator.core.model.AnnotationSet;
import com.edge.annotator.core.model.Corner;
import com.edge.annotator.core.model.Point;
import com.edge.annotator.core.model.Selection;
import com.edge.annotator.core.transform.CoordinateMapper;
import com.edge.annotator.core.transform.ImageSize;
import com.edge.annotator.core.transform.ScreenRect;
import com.edge.annotator.core.transform.ViewportTransform;

/**
 * 命中检测
 * <p>
 * 全部在屏幕坐标系下比较，容差与手柄半径为屏幕像素：
 * <ol>
 *   <li>已选中框的四个角点手柄优先（区分拖动手柄与新建框）</li>
 *   <li>从最上层（列表末尾）向下扫描，第一个包含该点的框（边界外扩容差）</li>
 *   <li>都不命中返回 NONE</li>
 * </ol>
 * 重叠区域总是命中最近添加或复制的框。
 */
public class HitTester {

    private final CoordinateMapper mapper;

    public HitTester(CoordinateMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param screenPoint  指针位置（屏幕像素）
     * @param set          当前图片的标注框
     * @param selection    当前选中状态
     * @param transform    视口变换
     * @param imageSize    图片尺寸
     * @param tolerance    点击容差（像素）
     * @param handleRadius 手柄半径（像素）
     */
    public HitResult hitTest(Point screenPoint, AnnotationSet set, Selection selection,
                             ViewportTransform transform, ImageSize imageSize,
                             double tolerance, double handleRadius) {
        if (selection.isValidIn(set)) {
            int selected = selection.index().getAsInt();
            ScreenRect rect = mapper.toScreenRect(set.get(selected), transform, imageSize);
            for (Corner corner : Corner.values()) {
                if (screenPoint.isWithin(rect.corner(corner), handleRadius)) {
                    return HitResult.handle(selected, corner);
                }
            }
        }

        for (int i = set.size() - 1; i >= 0; i--) {
            ScreenRect rect = mapper.toScreenRect(set.get(i), transform, imageSize);
            if (rect.contains(screenPoint, tolerance)) {
                return HitResult.box(i);
            }
        }
        return HitResult.none();
    }
}
