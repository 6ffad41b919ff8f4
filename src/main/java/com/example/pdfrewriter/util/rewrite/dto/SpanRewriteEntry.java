package com.example.pdfrewriter.util.rewrite.dto;

import com.example.pdfrewriter.util.stream.AffineMatrix;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 一个 span 合并后的最终改写
 *
 * scaleFactor &lt; 1 表示替换文本比原文宽，需要水平压缩；
 * 压缩到下限仍放不下时 overlayFallback 为 true，由调用方改用覆盖层绘制。
 */
@Getter
@Builder
public final class SpanRewriteEntry {

    private final SpanKey spanKey;
    private final Integer operatorIndex;
    private final String originalText;
    private final String replacementText;
    private final String font;
    private final double fontSize;
    private final double[] bbox;
    private final AffineMatrix matrix;
    private final double originalWidth;
    private final double replacementWidth;
    private final double scaleFactor;
    private final boolean requiresScaling;
    private final boolean overlayFallback;
    @Builder.Default
    private final List<SpanMappingRef> mappings = Collections.emptyList();
    @Builder.Default
    private final List<SpanSliceReplacement> sliceReplacements = Collections.emptyList();

    @Override
    public String toString() {
        return "SpanRewriteEntry{span=" + spanKey + ", '" + originalText + "' -> '" + replacementText
                + "', scale=" + scaleFactor + (overlayFallback ? ", overlay" : "") + '}';
    }
}
