package com.edge.annotator.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * 会话状态响应
 * <p>
 * 所有接口统一返回：success 标记、本次操作是否产生修改、当前图片与标注状态，失败时附带错误码和消息
 */
public class SessionStateResponse {
    private boolean success;
    private String message;
    private String error;          // 错误码，仅失败时
    private boolean changed;       // 本次操作是否修改了标注

    private String directory;
    private int imageIndex = -1;
    private int imageCount;
    private String imageName;
    private Integer imageWidth;
    private Integer imageHeight;

    private boolean dirty;
    private int undoDepth;
    private int undoCapacity;

    private Integer selectedIndex;
    private String mode;
    private String corner;
    private int currentClassId;

    private List<String> classes = new ArrayList<>();
    private List<BoxView> boxes = new ArrayList<>();
    private BoxView creationPreview;
    private List<String> loadErrors = new ArrayList<>();

    public static SessionStateResponse error(String error, String message) {
        SessionStateResponse response = new SessionStateResponse();
        response.success = false;
        response.error = error;
        response.message = message;
        return response;
    }

    // Getters and Setters
    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public boolean isChanged() { return changed; }
    public void setChanged(boolean changed) { this.changed = changed; }

    public String getDirectory() { return directory; }
    public void setDirectory(String directory) { this.directory = directory; }

    public int getImageIndex() { return imageIndex; }
    public void setImageIndex(int imageIndex) { this.imageIndex = imageIndex; }

    public int getImageCount() { return imageCount; }
    public void setImageCount(int imageCount) { this.imageCount = imageCount; }

    public String getImageName() { return imageName; }
    public void setImageName(String imageName) { this.imageName = imageName; }

    public Integer getImageWidth() { return imageWidth; }
    public void setImageWidth(Integer imageWidth) { this.imageWidth = imageWidth; }

    public Integer getImageHeight() { return imageHeight; }
    public void setImageHeight(Integer imageHeight) { this.imageHeight = imageHeight; }

    public boolean isDirty() { return dirty; }
    public void setDirty(boolean dirty) { this.dirty = dirty; }

    public int getUndoDepth() { return undoDepth; }
    public void setUndoDepth(int undoDepth) { this.undoDepth = undoDepth; }

    public int getUndoCapacity() { return undoCapacity; }
    public void setUndoCapacity(int undoCapacity) { this.undoCapacity = undoCapacity; }

    public Integer getSelectedIndex() { return selectedIndex; }
    public void setSelectedIndex(Integer selectedIndex) { this.selectedIndex = selectedIndex; }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public String getCorner() { return corner; }
    public void setCorner(String corner) { this.corner = corner; }

    public int getCurrentClassId() { return currentClassId; }
    public void setCurrentClassId(int currentClassId) { this.currentClassId = currentClassId; }

    public List<String> getClasses() { return classes; }
    public void setClasses(List<String> classes) { this.classes = classes; }

    public List<BoxView> getBoxes() { return boxes; }
    public void setBoxes(List<BoxView> boxes) { this.boxes = boxes; }

    public BoxView getCreationPreview() { return creationPreview; }
    public void setCreationPreview(BoxView creationPreview) { this.creationPreview = creationPreview; }

    public List<String> getLoadErrors() { return loadErrors; }
    public void setLoadErrors(List<String> loadErrors) { this.loadErrors = loadErrors; }
}
