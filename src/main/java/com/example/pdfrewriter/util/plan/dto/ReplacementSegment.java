package com.example.pdfrewriter.util.plan.dto;

import com.example.pdfrewriter.util.align.SpanSlice;
import com.example.pdfrewriter.util.stream.AffineMatrix;
import com.example.pdfrewriter.util.stream.dto.LiteralKind;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 替换计划中的一段：某个操作符解码文本的局部区间 [localStart, localEnd)
 *
 * <ul>
 *   <li>text：该区间的原文</li>
 *   <li>spanSlices：渲染这段原文的视觉切片（未对齐时为空）</li>
 *   <li>matrix：段起点的用户空间矩阵（方向 × 字号，原点在首字形左下角）</li>
 *   <li>width：段原文的用户空间宽度</li>
 *   <li>itemSlot：段落在哪个字符串项里（TJ 数组下标；Tj 为 0；跨项或无项为 -1）</li>
 *   <li>仅 MATCH 段：replacementStart/End 是在替换文本中的区间，plannedText 是分到的替换文本</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
public final class ReplacementSegment {

    private final int operatorIndex;
    private final String operator;
    private final SegmentRole role;
    private final String text;
    private final int localStart;
    private final int localEnd;
    @Builder.Default
    private final List<SpanSlice> spanSlices = Collections.emptyList();
    private final AffineMatrix matrix;
    private final String fontResource;
    private final double fontSize;
    private final double width;
    private final LiteralKind literalKind;
    @Builder.Default
    private final int itemSlot = -1;
    private final boolean coversWholeItem;
    private final boolean requiresIsolation;
    private final Integer replacementStart;
    private final Integer replacementEnd;
    @Builder.Default
    private final String plannedText = "";

    public boolean isMatch() {
        return role == SegmentRole.MATCH;
    }

    public int length() {
        return localEnd - localStart;
    }

    public boolean isAligned() {
        return !spanSlices.isEmpty();
    }

    @Override
    public String toString() {
        return "ReplacementSegment{op=" + operatorIndex + ", role=" + role + ", [" + localStart + "," + localEnd
                + "), text='" + text + "'" + (isMatch() ? ", planned='" + plannedText + "'" : "")
                + (requiresIsolation ? ", isolate" : "") + '}';
    }
}
