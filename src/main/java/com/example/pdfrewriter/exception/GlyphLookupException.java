package com.example.pdfrewriter.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基础字体的字符映射表（cmap）里缺少字符
 *
 * 逐字符报告：一次构建中所有缺失的字符都收集在 {@link #getMissingCharacters()} 里。
 */
public class GlyphLookupException extends PdfRewriteException {

    private final String fontName;
    private final List<String> missingCharacters;

    public GlyphLookupException(String fontName, List<String> missingCharacters) {
        super(buildMessage(fontName, missingCharacters));
        this.fontName = fontName;
        this.missingCharacters = Collections.unmodifiableList(new ArrayList<>(missingCharacters));
    }

    public GlyphLookupException(String fontName, String missingCharacter) {
        this(fontName, Collections.singletonList(missingCharacter));
    }

    private static String buildMessage(String fontName, List<String> missing) {
        StringBuilder sb = new StringBuilder();
        sb.append("字体 ").append(fontName).append(" 缺少字符: ");
        for (int i = 0; i < missing.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            String ch = missing.get(i);
            sb.append('\'').append(ch).append('\'');
            if (!ch.isEmpty()) {
                sb.append(String.format(" (U+%04X)", ch.codePointAt(0)));
            }
        }
        return sb.toString();
    }

    public String getFontName() {
        return fontName;
    }

    public List<String> getMissingCharacters() {
        return missingCharacters;
    }
}
