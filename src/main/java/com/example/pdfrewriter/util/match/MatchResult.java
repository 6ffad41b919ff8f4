package com.example.pdfrewriter.util.match;

/**
 * 一次文本查找的结果：命中区间或未命中
 *
 * start/end 是在原始被查找文本（haystack）中的区间 [start, end)，
 * 不是归一化视图中的位置。
 */
public final class MatchResult {

    private static final MatchResult NOT_FOUND = new MatchResult(false, -1, -1, null);

    private final boolean found;
    private final int start;
    private final int end;
    private final String strategy;

    private MatchResult(boolean found, int start, int end, String strategy) {
        this.found = found;
        this.start = start;
        this.end = end;
        this.strategy = strategy;
    }

    public static MatchResult found(int start, int end, String strategy) {
        return new MatchResult(true, start, end, strategy);
    }

    public static MatchResult notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return found;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return found ? end - start : 0;
    }

    /**
     * 命中所用策略名；未命中为 null
     */
    public String getStrategy() {
        return strategy;
    }

    @Override
    public String toString() {
        return found ? "MatchResult{[" + start + "," + end + "), strategy=" + strategy + '}' : "MatchResult{not found}";
    }
}
