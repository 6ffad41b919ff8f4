package com.example.pdfrewriter.util.match;

import com.example.pdfrewriter.util.span.SpanTextNormalizer;

/**
 * 忽略空白匹配
 *
 * 两边都去掉全部空白字符（含不换行空格）后做精确匹配，再通过下标映射回原文区间。
 * 内容流里单词间距常用 Td/TJ 调整而不是空格字符表示，
 * 所以目标文本 "total cost" 在解码文本中可能是 "totalcost"，反之亦然。
 *
 * 命中区间从第一个命中字符开始、到最后一个命中字符结束，
 * 不包含两端的空白。
 */
public class WhitespaceCollapsedMatchStrategy implements TextMatchStrategy {

    public static final String NAME = "whitespace-collapsed";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MatchResult find(String haystack, String needle, int fromIndex) {
        if (haystack == null || needle == null) {
            return MatchResult.notFound();
        }
        String collapsedNeedle = stripWhitespace(needle);
        if (collapsedNeedle.isEmpty()) {
            return MatchResult.notFound();
        }

        StringBuilder collapsed = new StringBuilder(haystack.length());
        int[] indexMap = new int[haystack.length()];
        int collapsedFrom = -1;
        for (int i = 0; i < haystack.length(); i++) {
            char ch = haystack.charAt(i);
            if (SpanTextNormalizer.isSpace(ch)) {
                continue;
            }
            if (collapsedFrom < 0 && i >= fromIndex) {
                collapsedFrom = collapsed.length();
            }
            indexMap[collapsed.length()] = i;
            collapsed.append(ch);
        }
        if (collapsedFrom < 0) {
            return MatchResult.notFound();
        }

        int position = collapsed.indexOf(collapsedNeedle, collapsedFrom);
        if (position < 0) {
            return MatchResult.notFound();
        }
        int start = indexMap[position];
        int end = indexMap[position + collapsedNeedle.length() - 1] + 1;
        return MatchResult.found(start, end, NAME);
    }

    static String stripWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (!SpanTextNormalizer.isSpace(ch)) {
                sb.append(ch);
            }
        }
        return sb.toString();
    }
}
