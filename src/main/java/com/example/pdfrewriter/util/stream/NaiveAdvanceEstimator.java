package com.example.pdfrewriter.util.stream;

import com.example.pdfrewriter.util.span.SpanTextNormalizer;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;

/**
 * 朴素前进量估算（没有视觉对齐时的退路）
 *
 * <pre>
 * advance = 可见字符数 × 字号 × factor × Th
 *         + Tc × (字符数 − 1) × Th
 *         + Tw × 空格数 × Th
 *         − Σ(adj / 1000 × 字号 × Th)
 * </pre>
 * 其中 Th = Tz / 100，factor 默认 0.5（半个 em）。结果为文本空间单位。
 */
public final class NaiveAdvanceEstimator {

    public static final double DEFAULT_GLYPH_WIDTH_FACTOR = 0.5;

    private NaiveAdvanceEstimator() {
    }

    public static double estimate(OperatorRecord record, TextGraphicsState state, double glyphWidthFactor) {
        String text = record.getDecodedText();
        double scale = state.horizontalScale();
        double fontSize = state.getFontSize();

        int visible = 0;
        int spaces = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (SpanTextNormalizer.isZeroWidth(ch)) {
                continue;
            }
            visible++;
            if (ch == ' ') {
                spaces++;
            }
        }

        double adjustment = 0;
        for (Double adj : record.getTextAdjustments()) {
            adjustment += (adj / 1000.0) * fontSize * scale;
        }

        if (visible == 0) {
            return -adjustment;
        }

        double base = visible * fontSize * glyphWidthFactor * scale;
        double charSpacing = state.getCharSpacing() * Math.max(visible - 1, 0) * scale;
        double wordSpacing = state.getWordSpacing() * spaces * scale;
        return base + charSpacing + wordSpacing - adjustment;
    }
}
