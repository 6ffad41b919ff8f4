package com.example.pdfrewriter.util.match;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderedTextMatcherTest {

    @Test
    @DisplayName("locate: 精确匹配优先")
    void locate_精确() {
        MatchResult result = OrderedTextMatcher.forTargetLookup().locate("total cost", "cost", 0);

        assertThat(result.isFound()).isTrue();
        assertThat(result.getStart()).isEqualTo(6);
        assertThat(result.getStrategy()).isEqualTo(ExactMatchStrategy.NAME);
    }

    @Test
    @DisplayName("locate: 只向后查找")
    void locate_不回退() {
        MatchResult result = OrderedTextMatcher.forTargetLookup().locate("ab ab", "ab", 1);

        assertThat(result.getStart()).isEqualTo(3);
    }

    @Test
    @DisplayName("locate: 空白差异由 whitespace-collapsed 命中，区间映射回原文")
    void locate_忽略空白() {
        MatchResult result = OrderedTextMatcher.forTargetLookup().locate("xx totalcost yy", "total cost", 0);

        assertThat(result.getStrategy()).isEqualTo(WhitespaceCollapsedMatchStrategy.NAME);
        assertThat(result.getStart()).isEqualTo(3);
        assertThat(result.getEnd()).isEqualTo(12);
    }

    @Test
    @DisplayName("locate: 不换行空格按空白处理")
    void locate_不换行空格() {
        MatchResult result = OrderedTextMatcher.forTargetLookup().locate("xx total\u00A0cost yy", "total cost", 0);

        assertThat(result.getStrategy()).isEqualTo(WhitespaceCollapsedMatchStrategy.NAME);
        assertThat(result.getStart()).isEqualTo(3);
        assertThat(result.getEnd()).isEqualTo(13);
    }

    @Test
    @DisplayName("locate: 前缀收缩容忍尾部差异")
    void locate_前缀收缩() {
        OrderedTextMatcher matcher = OrderedTextMatcher.forAlignment(4);

        MatchResult result = matcher.locate("the quick brown", "quick brXX", 0);

        assertThat(result.getStrategy()).isEqualTo(PrefixShrinkingMatchStrategy.NAME);
        assertThat(result.getStart()).isEqualTo(4);
        assertThat(result.getEnd()).isEqualTo(12);
    }

    @Test
    @DisplayName("locate: 短于最小长度的文本不做前缀收缩")
    void locate_短文本() {
        OrderedTextMatcher matcher = OrderedTextMatcher.forAlignment(16);

        assertThat(matcher.locate("Hello", "Help", 0).isFound()).isFalse();
    }

    @Test
    @DisplayName("构造: 没有策略时报错")
    void 构造_无策略() {
        assertThatThrownBy(() -> new OrderedTextMatcher())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
