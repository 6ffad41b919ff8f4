package com.example.pdfrewriter.util.span.dto;

/**
 * 归一化文本中一个视觉字符簇的区间 [start, end)
 *
 * 连字展开后的 "ffi" 是一个簇，占 3 个归一化位置；
 * 组合附加符号与前一个字符合为一个簇。对齐切片时不能把簇切开。
 */
public final class GraphemeSlice {

    private final String text;
    private final int start;
    private final int end;

    public GraphemeSlice(String text, int start, int end) {
        this.text = text;
        this.start = start;
        this.end = end;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return "GraphemeSlice{'" + text + "', [" + start + "," + end + ")}";
    }
}
