package com.example.pdfrewriter.util.plan.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次替换的完整计划
 *
 * segments 按操作符顺序、再按局部偏移排列；各段局部区间拼起来恰好覆盖
 * 被匹配操作符的解码文本，MATCH 段的 plannedText 依次拼接等于 replacementText。
 */
public final class ReplacementPlan {

    private final int pageIndex;
    private final String originalText;
    private final String replacementText;
    private final List<ReplacementSegment> segments;

    public ReplacementPlan(int pageIndex, String originalText, String replacementText,
                           List<ReplacementSegment> segments) {
        this.pageIndex = pageIndex;
        this.originalText = originalText;
        this.replacementText = replacementText;
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public int getPageIndex() {
        return pageIndex;
    }

    /**
     * 页面中实际命中的原文（忽略空白匹配时可能与请求的目标文本在空白上不同）
     */
    public String getOriginalText() {
        return originalText;
    }

    public String getReplacementText() {
        return replacementText;
    }

    public List<ReplacementSegment> getSegments() {
        return segments;
    }

    public List<ReplacementSegment> getMatchSegments() {
        List<ReplacementSegment> result = new ArrayList<>();
        for (ReplacementSegment segment : segments) {
            if (segment.isMatch()) {
                result.add(segment);
            }
        }
        return result;
    }

    /**
     * MATCH 段计划文本依次拼接
     */
    public String plannedReplacement() {
        StringBuilder sb = new StringBuilder();
        for (ReplacementSegment segment : segments) {
            if (segment.isMatch()) {
                sb.append(segment.getPlannedText());
            }
        }
        return sb.toString();
    }

    /**
     * 涉及的操作符 index（去重，保持顺序）
     */
    public List<Integer> getOperatorIndexes() {
        List<Integer> result = new ArrayList<>();
        for (ReplacementSegment segment : segments) {
            if (!result.contains(segment.getOperatorIndex())) {
                result.add(segment.getOperatorIndex());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "ReplacementPlan{page=" + pageIndex + ", '" + originalText + "' -> '" + replacementText
                + "', segments=" + segments.size() + '}';
    }
}
