package com.example.pdfrewriter.util.stream;

import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;
import com.example.pdfrewriter.util.stream.dto.PageAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.example.pdfrewriter.support.Fixtures.ops;
import static com.example.pdfrewriter.support.Fixtures.span;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PageContentAnalyzerTest {

    private PageContentAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new PageContentAnalyzer();
    }

    @Test
    @DisplayName("analyze: 没有 span 时全部使用朴素前进量并带警告")
    void analyze_无span() {
        PageAnalysis analysis = analyzer.analyze(0, ops("BT /F1 10 Tf 100 700 Td (Hello) Tj ET"),
                Collections.<SpanRecord>emptyList(), TextFragmentDecoder.LATIN1);

        OperatorRecord show = analysis.getRecords().get(3);
        assertThat(show.getAdvanceWarning()).isEqualTo(PageContentAnalyzer.WARNING_SPANS_UNAVAILABLE);
        assertThat(show.getAdvance()).isCloseTo(25.0, within(1e-9));
        assertThat(analysis.getWarnings()).hasSize(1);
    }

    @Test
    @DisplayName("analyze: 对齐成功时前进量取 span 几何，矩阵无漂移")
    void analyze_对齐() {
        SpanRecord hello = span(0, "Hello", 100, 700, 8);
        PageAnalysis analysis = analyzer.analyze(0, ops("BT /F1 8 Tf 100 700 Td (Hello) Tj ET"),
                Collections.singletonList(hello), TextFragmentDecoder.LATIN1);

        OperatorRecord show = analysis.getRecords().get(3);
        // 5 个字符 × 4pt
        assertThat(show.getAdvance()).isCloseTo(20.0, within(1e-6));
        assertThat(show.getPostTextMatrix().getE()).isCloseTo(120.0, within(1e-6));
        assertThat(show.getAdvanceError()).isCloseTo(0.0, within(1e-6));
        assertThat(show.getAdvanceWarning()).isNull();
        assertThat(analysis.slicesOf(3)).hasSize(1);
    }

    @Test
    @DisplayName("analyze: 对不上的操作符标记 missing alignment，其余照常")
    void analyze_部分未对齐() {
        SpanRecord hello = span(0, "Hello", 100, 700, 8);
        PageAnalysis analysis = analyzer.analyze(0,
                ops("BT /F1 8 Tf 100 700 Td (Hello) Tj (Zzz) Tj ET"),
                Collections.singletonList(hello), TextFragmentDecoder.LATIN1);

        assertThat(analysis.getRecords().get(3).getAdvanceWarning()).isNull();
        assertThat(analysis.getRecords().get(4).getAdvanceWarning())
                .isEqualTo(PageContentAnalyzer.WARNING_MISSING_ALIGNMENT);
    }

    @Test
    @DisplayName("analyze: 跨两个 span 的操作符，后续操作符从准确位置开始")
    void analyze_后续位置() {
        List<SpanRecord> spans = Arrays.asList(
                span(0, "Hello", 100, 700, 8),
                span(1, "World", 125, 700, 8));
        PageAnalysis analysis = analyzer.analyze(0,
                ops("BT /F1 8 Tf 100 700 Td (Hello) Tj (World) Tj ET"),
                spans, TextFragmentDecoder.LATIN1);

        OperatorRecord second = analysis.getRecords().get(4);
        assertThat(second.getTextMatrix().getE()).isCloseTo(120.0, within(1e-6));
    }
}
