package com.example.pdfrewriter.util.font.dto;

import java.nio.file.Path;

/**
 * 一个派生字体的构建结果
 */
public final class FontBuildResult {

    private final int index;
    private final String hiddenChar;
    private final String visualText;
    private final Path fontPath;
    private final boolean usedCache;

    public FontBuildResult(int index, String hiddenChar, String visualText, Path fontPath, boolean usedCache) {
        this.index = index;
        this.hiddenChar = hiddenChar;
        this.visualText = visualText;
        this.fontPath = fontPath;
        this.usedCache = usedCache;
    }

    public int getIndex() {
        return index;
    }

    public String getHiddenChar() {
        return hiddenChar;
    }

    public String getVisualText() {
        return visualText;
    }

    public Path getFontPath() {
        return fontPath;
    }

    public boolean isUsedCache() {
        return usedCache;
    }

    @Override
    public String toString() {
        return "FontBuildResult{index=" + index + ", hidden='" + hiddenChar + "', visual='" + visualText
                + "', path=" + fontPath + (usedCache ? ", cached" : "") + '}';
    }
}
