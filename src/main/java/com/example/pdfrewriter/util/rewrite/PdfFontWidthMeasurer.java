package com.example.pdfrewriter.util.rewrite;

import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.PageFonts;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;
import java.util.Map;

/**
 * 用页面字体的字形宽度测量文本
 *
 * 逐字符取宽：覆盖表 → PDFont.getStringWidth → 半个字号的估算值。
 * 字体无法编码某个字符（子集字体里没有）时走估算，不抛异常。
 */
@Slf4j
public class PdfFontWidthMeasurer implements WidthMeasurer {

    private static final double FALLBACK_EM_FACTOR = 0.5;

    private final PageFonts fonts;

    public PdfFontWidthMeasurer(PageFonts fonts) {
        this.fonts = fonts;
    }

    @Override
    public double measure(String text, SpanRecord span, Map<String, Double> charWidths) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        double fontSize = span.getFontSize();
        PDFont font = fonts != null ? fonts.byFontName(span.getFont()) : null;

        double width = 0;
        int estimated = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            String ch = new String(Character.toChars(codePoint));
            i += Character.charCount(codePoint);

            Double override = charWidths != null ? charWidths.get(ch) : null;
            if (override != null) {
                width += override;
                continue;
            }
            Double measured = glyphWidth(font, ch, fontSize);
            if (measured != null) {
                width += measured;
            } else {
                width += FALLBACK_EM_FACTOR * fontSize;
                estimated++;
            }
        }
        if (estimated > 0) {
            log.debug("宽度测量有 {} 个字符使用估算值: font={}, text='{}'", estimated, span.getFont(), text);
        }
        return width;
    }

    private static Double glyphWidth(PDFont font, String ch, double fontSize) {
        if (font == null) {
            return null;
        }
        try {
            return font.getStringWidth(ch) / 1000.0 * fontSize;
        } catch (IOException | IllegalArgumentException | UnsupportedOperationException e) {
            return null;
        }
    }
}
