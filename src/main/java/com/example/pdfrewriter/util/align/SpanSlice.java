package com.example.pdfrewriter.util.align;

import com.example.pdfrewriter.util.span.dto.SpanRecord;

import java.util.List;

/**
 * 一个 span 归一化文本的子区间 [start, end)
 */
public final class SpanSlice {

    private final SpanRecord span;
    private final int start;
    private final int end;

    public SpanSlice(SpanRecord span, int start, int end) {
        if (span == null) {
            throw new IllegalArgumentException("span 不能为空");
        }
        int limit = span.getNormalizedText().length();
        this.span = span;
        this.start = Math.max(0, Math.min(start, limit));
        this.end = Math.max(this.start, Math.min(end, limit));
    }

    public SpanRecord getSpan() {
        return span;
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

    public boolean isEmpty() {
        return end <= start;
    }

    public String getText() {
        return span.getNormalizedText().substring(start, end);
    }

    /**
     * 区间内字符包围盒宽度之和
     */
    public double width() {
        return span.widthOf(start, end);
    }

    public static int totalLength(List<SpanSlice> slices) {
        int total = 0;
        for (SpanSlice slice : slices) {
            total += slice.length();
        }
        return total;
    }

    public boolean sameSpan(SpanSlice other) {
        return other != null && other.span == span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpanSlice)) {
            return false;
        }
        SpanSlice that = (SpanSlice) o;
        return span == that.span && start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * System.identityHashCode(span) + start) + end;
    }

    @Override
    public String toString() {
        return "SpanSlice{span=" + span.getBlockIndex() + "/" + span.getLineIndex() + "/" + span.getSpanIndex()
                + ", [" + start + "," + end + "), '" + getText() + "'}";
    }
}
