package com.example.pdfrewriter.util.plan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReplacementAllocatorTest {

    @Test
    @DisplayName("allocate: 按原文长度比例分配，最后一段吸收余数")
    void allocate_比例() {
        List<String> pieces = ReplacementAllocator.allocate("Mars", new int[]{4, 3});

        assertThat(pieces).containsExactly("Ma", "rs");
    }

    @Test
    @DisplayName("allocate: 后面的正长度段至少留 1 个字符")
    void allocate_保底() {
        List<String> pieces = ReplacementAllocator.allocate("abc", new int[]{10, 1, 1});

        assertThat(pieces).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("allocate: 替换文本不够分时后面的段为空")
    void allocate_文本不足() {
        List<String> pieces = ReplacementAllocator.allocate("x", new int[]{2, 2, 2});

        assertThat(String.join("", pieces)).isEqualTo("x");
        assertThat(pieces).hasSize(3);
    }

    @Test
    @DisplayName("allocate: 空替换文本全部为空")
    void allocate_空文本() {
        assertThat(ReplacementAllocator.allocate("", new int[]{3, 4})).containsExactly("", "");
        assertThat(ReplacementAllocator.allocate(null, new int[]{3})).containsExactly("");
    }

    @Test
    @DisplayName("allocate: 没有段时返回空列表")
    void allocate_无段() {
        assertThat(ReplacementAllocator.allocate("abc", new int[0])).isEmpty();
    }
}
