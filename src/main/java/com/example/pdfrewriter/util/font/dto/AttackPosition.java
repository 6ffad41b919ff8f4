package com.example.pdfrewriter.util.font.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个隐藏字符位置分到的可见内容
 *
 * glyphNames / glyphIds 与 visualText 的字符一一对应，advanceWidth 是这些字形前进量之和（字体单位）。
 */
public final class AttackPosition {

    private final int index;
    private final String hiddenChar;
    private final String visualText;
    private final List<String> glyphNames;
    private final List<Integer> glyphIds;
    private final double advanceWidth;

    public AttackPosition(int index, String hiddenChar, String visualText, List<String> glyphNames,
                          List<Integer> glyphIds, double advanceWidth) {
        this.index = index;
        this.hiddenChar = hiddenChar;
        this.visualText = visualText != null ? visualText : "";
        this.glyphNames = Collections.unmodifiableList(new ArrayList<>(glyphNames));
        this.glyphIds = Collections.unmodifiableList(new ArrayList<>(glyphIds));
        this.advanceWidth = advanceWidth;
    }

    public static AttackPosition blank(int index, String hiddenChar) {
        return new AttackPosition(index, hiddenChar, "", Collections.<String>emptyList(),
                Collections.<Integer>emptyList(), 0.0);
    }

    /**
     * 只有 "隐藏字符原样显示自己" 这一种情况不需要派生字体
     */
    public boolean requiresFont() {
        if (visualText.isEmpty()) {
            return true;
        }
        return !visualText.equals(hiddenChar);
    }

    public boolean isZeroWidth() {
        return visualText.isEmpty();
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

    public List<String> getGlyphNames() {
        return glyphNames;
    }

    public List<Integer> getGlyphIds() {
        return glyphIds;
    }

    public double getAdvanceWidth() {
        return advanceWidth;
    }

    @Override
    public String toString() {
        return "AttackPosition{index=" + index + ", hidden='" + hiddenChar + "', visual='" + visualText
                + "', glyphs=" + glyphNames + ", advance=" + advanceWidth + '}';
    }
}
