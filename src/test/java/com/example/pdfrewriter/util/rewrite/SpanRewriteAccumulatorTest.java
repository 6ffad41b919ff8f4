package com.example.pdfrewriter.util.rewrite;

import com.example.pdfrewriter.util.rewrite.dto.SpanMappingRef;
import com.example.pdfrewriter.util.rewrite.dto.SpanRewriteEntry;
import com.example.pdfrewriter.util.rewrite.dto.ValidationFailure;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.example.pdfrewriter.support.Fixtures.span;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SpanRewriteAccumulatorTest {

    /** 每个字符 5pt，与 Fixtures 里字号 10 的 span 一致 */
    private static final WidthMeasurer FIXED = (text, span, charWidths) -> text.length() * 5.0;

    private static SpanMappingRef ref(String original, String replacement) {
        return new SpanMappingRef("r1", original, replacement, 3);
    }

    @Test
    @DisplayName("buildEntry: 多处替换从后往前合并")
    void buildEntry_合并() {
        SpanRecord record = span(0, "Mercury is small", 0, 0, 10);
        SpanRewriteAccumulator accumulator = new SpanRewriteAccumulator(record);
        accumulator.addReplacement(11, 16, "tiny", ref("small", "tiny"));
        accumulator.addReplacement(0, 7, "Mars", ref("Mercury", "Mars"));

        SpanRewriteEntry entry = accumulator.buildEntry(0, FIXED, null);

        assertThat(entry.getReplacementText()).isEqualTo("Mars is tiny");
        assertThat(entry.getOriginalText()).isEqualTo("Mercury is small");
        assertThat(entry.isRequiresScaling()).isFalse();
        assertThat(entry.getScaleFactor()).isEqualTo(1.0);
        assertThat(entry.getMappings()).extracting(SpanMappingRef::getOriginal)
                .containsExactly("Mercury", "small");
        assertThat(entry.getOperatorIndex()).isEqualTo(3);
    }

    @Test
    @DisplayName("buildEntry: 替换文本更宽时按比例压缩")
    void buildEntry_压缩() {
        SpanRecord record = span(0, "Mercury", 0, 0, 10);
        SpanRewriteAccumulator accumulator = new SpanRewriteAccumulator(record);
        accumulator.addReplacement(0, 7, "Jupiter!!", ref("Mercury", "Jupiter!!"));

        SpanRewriteEntry entry = accumulator.buildEntry(0, FIXED, null);

        assertThat(entry.isRequiresScaling()).isTrue();
        assertThat(entry.getScaleFactor()).isCloseTo(35.0 / 45.0, within(1e-9));
        assertThat(entry.isOverlayFallback()).isFalse();
    }

    @Test
    @DisplayName("buildEntry: 压缩低于下限时改用覆盖层")
    void buildEntry_覆盖层() {
        SpanRecord record = span(0, "Mercury", 0, 0, 10);
        SpanRewriteAccumulator accumulator = new SpanRewriteAccumulator(record, 0.5);
        accumulator.addReplacement(0, 7, "The innermost planet", ref("Mercury", "The innermost planet"));

        SpanRewriteEntry entry = accumulator.buildEntry(0, FIXED, null);

        assertThat(entry.getScaleFactor()).isEqualTo(0.5);
        assertThat(entry.isOverlayFallback()).isTrue();
    }

    @Test
    @DisplayName("buildEntry: 当前文本与期望原文不一致时不产出改写")
    void buildEntry_校验失败() {
        SpanRecord record = span(0, "Venus", 0, 0, 10);
        SpanRewriteAccumulator accumulator = new SpanRewriteAccumulator(record);
        accumulator.addReplacement(0, 5, "Mars", ref("Mercury", "Mars"));

        SpanRewriteEntry entry = accumulator.buildEntry(0, FIXED, null);

        assertThat(entry).isNull();
        assertThat(accumulator.getValidationFailures()).hasSize(1);
        ValidationFailure failure = accumulator.getValidationFailures().get(0);
        assertThat(failure.getExpected()).isEqualTo("Mercury");
        assertThat(failure.getObserved()).isEqualTo("Venus");
        assertThat(failure.getRequestId()).isEqualTo("r1");
    }

    @Test
    @DisplayName("buildEntry: 期望原文只差空白时视为一致")
    void buildEntry_空白差异() {
        SpanRecord record = span(0, "Mercury", 0, 0, 10);
        SpanRewriteAccumulator accumulator = new SpanRewriteAccumulator(record);
        accumulator.addReplacement(0, 7, "Mars", ref("Mer cury", "Mars"));

        assertThat(accumulator.buildEntry(0, FIXED, null)).isNotNull();
    }

    @Test
    @DisplayName("addReplacement: 新替换覆盖旧的则替换，被覆盖或部分重叠则忽略")
    void addReplacement_重叠规则() {
        SpanRecord record = span(0, "Mercury is small", 0, 0, 10);
        SpanRewriteAccumulator accumulator = new SpanRewriteAccumulator(record);

        accumulator.addReplacement(0, 4, "Ma", ref("Merc", "Ma"));
        accumulator.addReplacement(0, 7, "Mars", ref("Mercury", "Mars"));
        assertThat(accumulator.getReplacements()).hasSize(1);
        assertThat(accumulator.getReplacements().get(0).getReplacement()).isEqualTo("Mars");

        accumulator.addReplacement(2, 3, "x", ref("r", "x"));
        accumulator.addReplacement(5, 9, "y", ref("ry i", "y"));
        assertThat(accumulator.getReplacements()).hasSize(1);

        accumulator.addReplacement(7, 7, "z", ref("", "z"));
        assertThat(accumulator.getReplacements()).hasSize(1);
    }

    @Test
    @DisplayName("buildEntry: 没有替换时返回 null")
    void buildEntry_空() {
        SpanRewriteAccumulator accumulator = new SpanRewriteAccumulator(span(0, "Mercury", 0, 0, 10));

        assertThat(accumulator.isEmpty()).isTrue();
        assertThat(accumulator.buildEntry(0, FIXED, null)).isNull();
    }
}
