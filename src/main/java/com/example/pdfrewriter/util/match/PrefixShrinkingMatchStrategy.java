package com.example.pdfrewriter.util.match;

/**
 * 前缀收缩匹配
 *
 * 整串找不到时，逐个去掉尾部字符重试，直到前缀长度降到 minLength。
 * 用于容忍连字、编码差异导致的尾部字符不一致。
 * needle 本身短于 minLength 时直接判定未命中：短文本的前缀太容易误命中。
 */
public class PrefixShrinkingMatchStrategy implements TextMatchStrategy {

    public static final String NAME = "prefix-shrinking";

    public static final int DEFAULT_MIN_LENGTH = 16;

    private final int minLength;

    public PrefixShrinkingMatchStrategy() {
        this(DEFAULT_MIN_LENGTH);
    }

    public PrefixShrinkingMatchStrategy(int minLength) {
        this.minLength = Math.max(minLength, 1);
    }

    @Override
    public String name() {
        return NAME;
    }

    public int getMinLength() {
        return minLength;
    }

    @Override
    public MatchResult find(String haystack, String needle, int fromIndex) {
        if (haystack == null || needle == null || needle.length() < minLength) {
            return MatchResult.notFound();
        }
        int from = Math.max(fromIndex, 0);
        for (int window = needle.length(); window >= minLength; window--) {
            int position = haystack.indexOf(needle.substring(0, window), from);
            if (position >= 0) {
                return MatchResult.found(position, position + window, NAME);
            }
        }
        return MatchResult.notFound();
    }
}
