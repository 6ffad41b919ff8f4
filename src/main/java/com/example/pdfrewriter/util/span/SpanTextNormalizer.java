package com.example.pdfrewriter.util.span;

import java.text.Normalizer;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 文本归一化工具类
 * 视觉 span 文本与内容流解码文本的对齐、比较都走这里，两边规则必须一致
 */
public final class SpanTextNormalizer {

    /**
     * 连字码位 → 展开后的多字符形式
     *
     * 0x0B-0x0F 是 TeX 系字体（OT1 编码）里 ff/fi/fl/ffi/ffl 的位置，
     * 字体缺少 ToUnicode 时解码出来就是这些控制字符
     */
    private static final Map<Character, String> LIGATURES;

    static {
        Map<Character, String> map = new HashMap<>();
        map.put('\u000b', "ff");
        map.put('\u000c', "fi");
        map.put('\r', "fl");
        map.put('\u000e', "ffi");
        map.put('\u000f', "ffl");
        map.put('\uFB00', "ff");
        map.put('\uFB01', "fi");
        map.put('\uFB02', "fl");
        map.put('\uFB03', "ffi");
        map.put('\uFB04', "ffl");
        map.put('\uFB05', "st");
        map.put('\uFB06', "st");
        LIGATURES = Collections.unmodifiableMap(map);
    }

    private SpanTextNormalizer() {
    }

    /**
     * 零宽字符：不占宽度，归一化视图中丢弃
     * \u200B-\u200D 零宽空格/非连字/连字，\u2060-\u2063 词连接符及不可见运算符，\uFEFF BOM
     */
    public static boolean isZeroWidth(char ch) {
        return (ch >= '\u200B' && ch <= '\u200D')
                || (ch >= '\u2060' && ch <= '\u2063')
                || ch == '\uFEFF';
    }

    /**
     * 空白判断：除 Java 空白外还包括不换行空格（\u00A0、\u2007、\u202F）
     */
    public static boolean isSpace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }

    /**
     * 连字展开；不是连字返回 null
     */
    public static String expandLigature(char ch) {
        return LIGATURES.get(ch);
    }

    /**
     * 单字符展开：连字展开、零宽字符丢弃（返回空串）、其余原样
     */
    public static String expandChar(char ch) {
        if (isZeroWidth(ch)) {
            return "";
        }
        String ligature = LIGATURES.get(ch);
        return ligature != null ? ligature : String.valueOf(ch);
    }

    /**
     * 对齐用归一化：连字展开 → 去零宽字符 → 连续空白折叠为单个空格
     *
     * 示例：
     * 输入："e\\uFB03cient\\u200B  use"
     * 输出："efficient use"
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        boolean previousSpace = false;
        for (int i = 0; i < text.length(); i++) {
            String expanded = expandChar(text.charAt(i));
            for (int k = 0; k < expanded.length(); k++) {
                char ch = expanded.charAt(k);
                if (isSpace(ch)) {
                    if (!previousSpace) {
                        sb.append(' ');
                    }
                    previousSpace = true;
                } else {
                    sb.append(ch);
                    previousSpace = false;
                }
            }
        }
        return sb.toString();
    }

    /**
     * 比较用归一化：NFKD 分解后去掉所有空白和零宽字符
     *
     * 用于校验"期望原文"和"span 当前文本"，容忍全半角、连字、空白差异
     */
    public static String collapseForComparison(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        StringBuilder sb = new StringBuilder(decomposed.length());
        for (int i = 0; i < decomposed.length(); i++) {
            char ch = decomposed.charAt(i);
            if (isSpace(ch) || isZeroWidth(ch)) {
                continue;
            }
            sb.append(ch);
        }
        return sb.toString();
    }

    /**
     * 判断两段文本在比较规则下是否相同
     */
    public static boolean equivalent(String expected, String observed) {
        return collapseForComparison(expected).equals(collapseForComparison(observed));
    }
}
