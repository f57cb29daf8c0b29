package com.edge.annotator.core.codec;

/**
 * 标注文件中被跳过的一行及原因
 */
public class LineError {
    private final int lineNumber;
    private final String line;
    private final String reason;

    public LineError(int lineNumber, String line, String reason) {
        this.lineNumber = lineNumber;
        this.line = line;
        this.reason = reason;
    }

    public int getLineNumber() { return lineNumber; }
    public String getLine() { return line; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return "line " + lineNumber + ": " + reason + " [" + line + "]";
    }
}
