package com.example.pdfrewriter.util.rewrite.dto;

/**
 * span 归一化区间 [start, end) 上的一处待替换
 */
public final class SpanSliceReplacement {

    private final int start;
    private final int end;
    private final String replacement;
    private final SpanMappingRef mappingRef;
    private final boolean overlayFallback;

    public SpanSliceReplacement(int start, int end, String replacement, SpanMappingRef mappingRef,
                                boolean overlayFallback) {
        this.start = start;
        this.end = end;
        this.replacement = replacement != null ? replacement : "";
        this.mappingRef = mappingRef;
        this.overlayFallback = overlayFallback;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getReplacement() {
        return replacement;
    }

    public SpanMappingRef getMappingRef() {
        return mappingRef;
    }

    /**
     * 来源已声明原位替换无法保持版面，需要覆盖层兜底
     */
    public boolean isOverlayFallback() {
        return overlayFallback;
    }

    public boolean covers(int otherStart, int otherEnd) {
        return start <= otherStart && end >= otherEnd;
    }

    public boolean overlaps(int otherStart, int otherEnd) {
        return !(otherEnd <= start || otherStart >= end);
    }

    @Override
    public String toString() {
        return "SpanSliceReplacement{[" + start + "," + end + ") -> '" + replacement + "'}";
    }
}
