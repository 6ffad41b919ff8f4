package com.example.pdfrewriter.util.rewrite;

import com.example.pdfrewriter.util.plan.MatchPlanner;
import com.example.pdfrewriter.util.plan.dto.ReplacementPlan;
import com.example.pdfrewriter.util.rewrite.dto.SpanRewriteEntry;
import com.example.pdfrewriter.util.rewrite.dto.ValidationFailure;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.PageContentAnalyzer;
import com.example.pdfrewriter.util.stream.TextFragmentDecoder;
import com.example.pdfrewriter.util.stream.dto.PageAnalysis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.example.pdfrewriter.support.Fixtures.ops;
import static com.example.pdfrewriter.support.Fixtures.span;
import static org.assertj.core.api.Assertions.assertThat;

class SpanRewriteCollectorTest {

    private static final WidthMeasurer FIXED = (text, span, charWidths) -> text.length() * 4.0;

    private PageAnalysis analyze(String content, SpanRecord... spans) {
        return new PageContentAnalyzer().analyze(0, ops(content), Arrays.asList(spans), TextFragmentDecoder.LATIN1);
    }

    @Test
    @DisplayName("collect: MATCH 段分发到对应 span")
    void collect_单span() {
        PageAnalysis analysis = analyze("BT /F1 8 Tf 100 700 Td (Hello World) Tj ET",
                span(0, "Hello World", 100, 700, 8));
        ReplacementPlan plan = new MatchPlanner().plan(0, "World", "Earth",
                analysis.getRecords(), analysis.getAlignment());

        SpanRewriteCollector collector = new SpanRewriteCollector();
        collector.collect("r1", plan);
        List<ValidationFailure> failures = new ArrayList<>();
        List<SpanRewriteEntry> entries = collector.buildEntries(0, FIXED, null, failures);

        assertThat(failures).isEmpty();
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getReplacementText()).isEqualTo("Hello Earth");
        assertThat(entries.get(0).getMappings().get(0).getRequestId()).isEqualTo("r1");
    }

    @Test
    @DisplayName("collect: 跨两个 span 的段按切片长度二次分配")
    void collect_跨span() {
        PageAnalysis analysis = analyze("BT /F1 8 Tf 100 700 Td (HelloWorld) Tj ET",
                span(0, "Hello", 100, 700, 8), span(1, "World", 120, 700, 8));
        ReplacementPlan plan = new MatchPlanner().plan(0, "loWo", "p-Wa",
                analysis.getRecords(), analysis.getAlignment());

        SpanRewriteCollector collector = new SpanRewriteCollector();
        collector.collect("r1", plan);
        List<SpanRewriteEntry> entries = collector.buildEntries(0, FIXED, null, new ArrayList<ValidationFailure>());

        assertThat(collector.getAccumulators()).hasSize(2);
        assertThat(entries).extracting(SpanRewriteEntry::getReplacementText)
                .containsExactly("Help-", "Warld");
    }

    @Test
    @DisplayName("collect: 未对齐的段不参与 span 改写")
    void collect_未对齐() {
        PageAnalysis analysis = analyze("BT /F1 8 Tf (Hello World) Tj ET");
        ReplacementPlan plan = new MatchPlanner().plan(0, "World", "Earth",
                analysis.getRecords(), analysis.getAlignment());

        SpanRewriteCollector collector = new SpanRewriteCollector();
        collector.collect("r1", plan);

        assertThat(collector.getAccumulators()).isEmpty();
    }
}
