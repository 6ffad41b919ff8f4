package com.example.pdfrewriter.util.match;

/**
 * 文本查找策略
 *
 * 每个策略只做一种确定的匹配规则，不混入相似度打分；
 * 多个策略由 {@link OrderedTextMatcher} 按顺序尝试。
 */
public interface TextMatchStrategy {

    /**
     * 策略名（记录日志和诊断用）
     */
    String name();

    /**
     * 从 fromIndex 开始向后查找 needle
     *
     * @param haystack  被查找文本
     * @param needle    目标文本
     * @param fromIndex 起始位置（只向后查找，不回退）
     * @return 命中区间（haystack 坐标）或 {@link MatchResult#notFound()}
     */
    MatchResult find(String haystack, String needle, int fromIndex);
}
