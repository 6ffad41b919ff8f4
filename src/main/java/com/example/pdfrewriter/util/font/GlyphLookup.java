package com.example.pdfrewriter.util.font;

/**
 * 基础字体的字形查询（按 Unicode 码位）
 */
public interface GlyphLookup {

    /**
     * 字体名，用于错误信息
     */
    String fontName();

    boolean isAvailable(int codePoint);

    /**
     * @throws com.example.pdfrewriter.exception.GlyphLookupException 字符不在 cmap 中
     */
    int glyphId(int codePoint);

    String glyphName(int codePoint);

    /**
     * 前进宽度（字体单位）
     */
    double glyphWidth(int codePoint);
}
