package com.example.pdfrewriter.util.match;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 按顺序尝试多个查找策略，返回第一个命中的结果
 *
 * 顺序即优先级：精确匹配在前，宽松规则在后。
 */
@Slf4j
public class OrderedTextMatcher {

    private final List<TextMatchStrategy> strategies;

    public OrderedTextMatcher(TextMatchStrategy... strategies) {
        this(Arrays.asList(strategies));
    }

    public OrderedTextMatcher(List<TextMatchStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个查找策略");
        }
        this.strategies = Collections.unmodifiableList(new ArrayList<>(strategies));
    }

    /**
     * 对齐用：精确 → 前缀收缩
     */
    public static OrderedTextMatcher forAlignment(int minPrefixLength) {
        return new OrderedTextMatcher(new ExactMatchStrategy(), new PrefixShrinkingMatchStrategy(minPrefixLength));
    }

    /**
     * 替换目标定位用：精确 → 忽略空白
     */
    public static OrderedTextMatcher forTargetLookup() {
        return new OrderedTextMatcher(new ExactMatchStrategy(), new WhitespaceCollapsedMatchStrategy());
    }

    public MatchResult locate(String haystack, String needle, int fromIndex) {
        for (TextMatchStrategy strategy : strategies) {
            MatchResult result = strategy.find(haystack, needle, fromIndex);
            if (result.isFound()) {
                if (!ExactMatchStrategy.NAME.equals(result.getStrategy())) {
                    log.debug("精确匹配失败，{} 策略命中: needle='{}', range=[{}, {})",
                            result.getStrategy(), needle, result.getStart(), result.getEnd());
                }
                return result;
            }
        }
        return MatchResult.notFound();
    }

    public List<TextMatchStrategy> getStrategies() {
        return strategies;
    }
}
