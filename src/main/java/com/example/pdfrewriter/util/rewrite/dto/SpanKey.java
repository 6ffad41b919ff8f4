package com.example.pdfrewriter.util.rewrite.dto;

import com.example.pdfrewriter.util.span.dto.SpanRecord;

/**
 * 物理 span 的标识：页 / 块 / 行 / span
 */
public final class SpanKey implements Comparable<SpanKey> {

    private final int pageIndex;
    private final int blockIndex;
    private final int lineIndex;
    private final int spanIndex;

    public SpanKey(int pageIndex, int blockIndex, int lineIndex, int spanIndex) {
        this.pageIndex = pageIndex;
        this.blockIndex = blockIndex;
        this.lineIndex = lineIndex;
        this.spanIndex = spanIndex;
    }

    public static SpanKey of(SpanRecord span) {
        return new SpanKey(span.getPageIndex(), span.getBlockIndex(), span.getLineIndex(), span.getSpanIndex());
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public int getBlockIndex() {
        return blockIndex;
    }

    public int getLineIndex() {
        return lineIndex;
    }

    public int getSpanIndex() {
        return spanIndex;
    }

    @Override
    public int compareTo(SpanKey o) {
        if (pageIndex != o.pageIndex) {
            return Integer.compare(pageIndex, o.pageIndex);
        }
        if (blockIndex != o.blockIndex) {
            return Integer.compare(blockIndex, o.blockIndex);
        }
        if (lineIndex != o.lineIndex) {
            return Integer.compare(lineIndex, o.lineIndex);
        }
        return Integer.compare(spanIndex, o.spanIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpanKey)) {
            return false;
        }
        SpanKey that = (SpanKey) o;
        return pageIndex == that.pageIndex && blockIndex == that.blockIndex
                && lineIndex == that.lineIndex && spanIndex == that.spanIndex;
    }

    @Override
    public int hashCode() {
        int result = pageIndex;
        result = 31 * result + blockIndex;
        result = 31 * result + lineIndex;
        result = 31 * result + spanIndex;
        return result;
    }

    @Override
    public String toString() {
        return pageIndex + "/" + blockIndex + "/" + lineIndex + "/" + spanIndex;
    }
}
