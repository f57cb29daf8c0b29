package com.edge.annotator.dto;

import com.edge.annotator.core.model.Box;
import com.edge.annotator.core.model.ClassRegistry;

/**
 * 标注框展示信息
 */
public class BoxView {
    private int index;
    private int classId;
    private String className;
    private double cx;
    private double cy;
    private double w;
    private double h;

    public static BoxView from(int index, Box box, ClassRegistry registry) {
        BoxView view = new BoxView();
        view.index = index;
        view.classId = box.getClassId();
        view.className = registry.contains(box.getClassId()) ? registry.nameOf(box.getClassId()) : null;
        view.cx = box.getCx();
        view.cy = box.getCy();
        view.w = box.getW();
        view.h = box.getH();
        return view;
    }

    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }

    public int getClassId() { return classId; }
    public void setClassId(int classId) { this.classId = classId; }

    public String getClassName() { return className; }
    public void setClassName(String className) { this.className = className; }

    public double getCx() { return cx; }
    public void setCx(double cx) { this.cx = cx; }

    public double getCy() { return cy; }
    public void setCy(double cy) { this.cy = cy; }

    public double getW() { return w; }
    public void setW(double w) { this.w = w; }

    public double getH() { return h; }
    public void setH(double h) { this.h = h; }
}
