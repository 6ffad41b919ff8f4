package com.example.pdfrewriter.util.rewrite;

import com.example.pdfrewriter.util.span.dto.SpanRecord;

import java.util.Map;

/**
 * 文本宽度测量（用户空间单位）
 */
public interface WidthMeasurer {

    /**
     * @param text       要测量的文本
     * @param span       文本所在 span（字体、字号来源）
     * @param charWidths 单字符宽度覆盖表（字符 → 宽度），优先于字体度量；可以为空
     */
    double measure(String text, SpanRecord span, Map<String, Double> charWidths);
}
