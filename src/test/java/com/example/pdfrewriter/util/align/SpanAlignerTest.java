package com.example.pdfrewriter.util.align;

import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.example.pdfrewriter.support.Fixtures.span;
import static com.example.pdfrewriter.support.Fixtures.walk;
import static org.assertj.core.api.Assertions.assertThat;

class SpanAlignerTest {

    private final SpanAligner aligner = new SpanAligner();

    @Test
    @DisplayName("align: 一个操作符跨两个 span，切成两段")
    void align_跨span() {
        List<OperatorRecord> records = walk("BT /F1 8 Tf 100 700 Td (HelloWorld) Tj ET");
        List<SpanRecord> spans = Arrays.asList(span(0, "Hello", 100, 700, 8), span(1, "World", 120, 700, 8));

        Map<Integer, List<SpanSlice>> alignment = aligner.align(records, spans);

        List<SpanSlice> slices = alignment.get(3);
        assertThat(slices).hasSize(2);
        assertThat(slices.get(0).getText()).isEqualTo("Hello");
        assertThat(slices.get(1).getText()).isEqualTo("World");
    }

    @Test
    @DisplayName("align: 重复文本按文档顺序认领")
    void align_重复文本() {
        List<OperatorRecord> records = walk("BT /F1 8 Tf (ab) Tj (ab) Tj ET");
        SpanRecord line = span(0, "abab", 0, 0, 8);

        Map<Integer, List<SpanSlice>> alignment = aligner.align(records, Collections.singletonList(line));

        assertThat(alignment.get(2).get(0).getStart()).isEqualTo(0);
        assertThat(alignment.get(3).get(0).getStart()).isEqualTo(2);
    }

    @Test
    @DisplayName("align: 找不到的操作符不出现在结果里")
    void align_未命中() {
        List<OperatorRecord> records = walk("BT /F1 8 Tf (Nope) Tj ET");

        Map<Integer, List<SpanSlice>> alignment =
                aligner.align(records, Collections.singletonList(span(0, "Hello", 0, 0, 8)));

        assertThat(alignment).isEmpty();
    }

    @Test
    @DisplayName("align: 同一输入多次运行结果相同")
    void align_幂等() {
        List<OperatorRecord> records = walk("BT /F1 8 Tf (Hel) Tj (lo) Tj ET");
        List<SpanRecord> spans = Collections.singletonList(span(0, "Hello", 0, 0, 8));

        assertThat(aligner.align(records, spans)).isEqualTo(aligner.align(records, spans));
    }

    @Test
    @DisplayName("adjustToGraphemes: 组合附加符号并入前一个簇")
    void adjustToGraphemes_组合符号() {
        SpanRecord accented = span(0, "e\u0301x", 0, 0, 8);

        int[] range = SpanAligner.adjustToGraphemes(accented, 0, 1);

        assertThat(range).containsExactly(0, 2);
    }
}
