package com.example.pdfrewriter.util.stream.dto;

import java.util.Arrays;

/**
 * 文本显示操作数中的一项
 *
 * Tj / ' / " 只有一个字符串项；TJ 数组中字符串与数字（字距调整，千分之一文本空间单位）交替出现。
 * textStart/textEnd 是该项解码文本在整个操作符解码文本中的区间，数字项的区间长度为 0。
 */
public final class ShowTextItem {

    public enum Kind { STRING, NUMBER }

    private final int slot;
    private final Kind kind;
    private final String text;
    private final byte[] rawBytes;
    private final LiteralKind literalKind;
    private final double adjustment;
    private final int textStart;
    private final int textEnd;

    private ShowTextItem(int slot, Kind kind, String text, byte[] rawBytes, LiteralKind literalKind,
                         double adjustment, int textStart, int textEnd) {
        this.slot = slot;
        this.kind = kind;
        this.text = text;
        this.rawBytes = rawBytes;
        this.literalKind = literalKind;
        this.adjustment = adjustment;
        this.textStart = textStart;
        this.textEnd = textEnd;
    }

    public static ShowTextItem string(int slot, String text, byte[] rawBytes, LiteralKind literalKind, int textStart) {
        String value = text != null ? text : "";
        return new ShowTextItem(slot, Kind.STRING, value, rawBytes != null ? rawBytes.clone() : new byte[0],
                literalKind, 0, textStart, textStart + value.length());
    }

    public static ShowTextItem number(int slot, double adjustment, int textOffset) {
        return new ShowTextItem(slot, Kind.NUMBER, "", new byte[0], null, adjustment, textOffset, textOffset);
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    /**
     * 在 TJ 数组（或单操作数）中的下标
     */
    public int getSlot() {
        return slot;
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public byte[] getRawBytes() {
        return rawBytes.clone();
    }

    public LiteralKind getLiteralKind() {
        return literalKind;
    }

    public double getAdjustment() {
        return adjustment;
    }

    public int getTextStart() {
        return textStart;
    }

    public int getTextEnd() {
        return textEnd;
    }

    @Override
    public String toString() {
        if (kind == Kind.NUMBER) {
            return "ShowTextItem{slot=" + slot + ", adjustment=" + adjustment + '}';
        }
        return "ShowTextItem{slot=" + slot + ", text='" + text + "', kind=" + literalKind
                + ", raw=" + Arrays.toString(rawBytes) + ", range=[" + textStart + "," + textEnd + ")}";
    }
}
