package com.example.pdfrewriter.util.rewrite;

import com.example.pdfrewriter.exception.PdfRewriteException;
import com.example.pdfrewriter.util.align.SpanSlice;
import com.example.pdfrewriter.util.plan.MatchPlanner;
import com.example.pdfrewriter.util.plan.dto.ReplacementPlan;
import com.example.pdfrewriter.util.stream.ContentOperation;
import com.example.pdfrewriter.util.stream.ContentStateTracker;
import com.example.pdfrewriter.util.stream.TextFragmentDecoder;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.example.pdfrewriter.support.Fixtures.ops;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ContentStreamRewriterTest {

    private static final Map<Integer, List<SpanSlice>> NO_ALIGNMENT = Collections.emptyMap();

    private ContentStreamRewriter rewriter;

    @BeforeEach
    void setUp() {
        // 没有字体资源：按 ISO-8859-1 编码，每个字形 0.5em
        rewriter = new ContentStreamRewriter(null, TextFragmentDecoder.LATIN1);
    }

    private List<ContentOperation> rewrite(String content, String target, String replacement) {
        List<ContentOperation> operations = ops(content);
        List<OperatorRecord> records = new ContentStateTracker().walk(operations);
        ReplacementPlan plan = new MatchPlanner().plan(0, target, replacement, records, NO_ALIGNMENT);
        return rewriter.apply(operations, records, plan);
    }

    private static String text(Object cos) {
        return new String(((COSString) cos).getBytes(), StandardCharsets.ISO_8859_1);
    }

    @Test
    @DisplayName("apply: 等宽替换保持 Tj，只改字节")
    void apply_等宽() {
        List<ContentOperation> result = rewrite("BT /F1 10 Tf (Mercury is here) Tj ET", "Mercury", "Jupiter");

        ContentOperation show = result.get(2);
        assertThat(show.getOperatorName()).isEqualTo("Tj");
        assertThat(text(show.getOperands().get(0))).isEqualTo("Jupiter is here");
    }

    @Test
    @DisplayName("apply: 变窄时 Tj 改成带字距补偿的 TJ")
    void apply_字距补偿() {
        List<ContentOperation> result = rewrite("BT /F1 10 Tf (Mercury is here) Tj ET", "Mercury", "Mars");

        ContentOperation show = result.get(2);
        assertThat(show.getOperatorName()).isEqualTo("TJ");
        COSArray array = (COSArray) show.getOperands().get(0);
        assertThat(text(array.getObject(0))).isEqualTo("Mars is here");
        // 少 3 个字形 × 0.5em
        assertThat(((COSNumber) array.getObject(1)).floatValue()).isCloseTo(-1500f, within(1e-3f));
    }

    @Test
    @DisplayName("apply: TJ 数组内只改命中的字符串项")
    void apply_TJ单项() {
        List<ContentOperation> result = rewrite(
                "BT /F1 10 Tf [(Merc) -20 (ury is here)] TJ ET", "Mercury", "Mars");

        COSArray array = (COSArray) result.get(2).getOperands().get(0);
        assertThat(text(array.getObject(0))).isEqualTo("Ma");
        // "Ma" 比 "Merc" 少 2 个字形
        assertThat(((COSNumber) array.getObject(1)).floatValue()).isCloseTo(-1000f, within(1e-3f));
        assertThat(((COSNumber) array.getObject(2)).floatValue()).isCloseTo(-20f, within(1e-3f));
        assertThat(text(array.getObject(3))).isEqualTo("rs is here");
    }

    @Test
    @DisplayName("apply: 整项删除时换成等宽的负字距")
    void apply_隔离() {
        List<ContentOperation> result = rewrite("BT /F1 10 Tf [(ab) 10 (cd)] TJ ET", "ab", "");

        COSArray array = (COSArray) result.get(2).getOperands().get(0);
        assertThat(array.size()).isEqualTo(3);
        assertThat(((COSNumber) array.getObject(0)).floatValue()).isCloseTo(-1000f, within(1e-3f));
        assertThat(text(array.getObject(2))).isEqualTo("cd");
    }

    @Test
    @DisplayName("apply: ' 操作符只改字符串，不插字距")
    void apply_引号操作符() {
        List<ContentOperation> result = rewrite("BT /F1 10 Tf 12 TL (Mercury) ' ET", "Mercury", "Mars");

        ContentOperation show = result.get(3);
        assertThat(show.getOperatorName()).isEqualTo("'");
        assertThat(text(show.getOperands().get(0))).isEqualTo("Mars");
    }

    @Test
    @DisplayName("apply: 无法编码的替换文本抛异常")
    void apply_编码失败() {
        assertThatThrownBy(() -> rewrite("BT /F1 10 Tf (Mercury) Tj ET", "Mercury", "水星"))
                .isInstanceOf(PdfRewriteException.class);
    }

    @Test
    @DisplayName("apply: 不涉及的指令原样保留")
    void apply_其余不变() {
        List<ContentOperation> original = ops("BT /F1 10 Tf (Mercury) Tj (Venus) Tj ET");

        List<ContentOperation> result = rewrite("BT /F1 10 Tf (Mercury) Tj (Venus) Tj ET", "Mercury", "Mars");

        assertThat(result).hasSize(original.size());
        assertThat(text(result.get(3).getOperands().get(0))).isEqualTo("Venus");
    }

    @Test
    @DisplayName("apply: 需要压缩时前后插 Tz，压缩正好抵消变宽就不再补字距")
    void apply_压缩() {
        List<ContentOperation> operations = ops("BT /F1 10 Tf (Mercury) Tj ET");
        List<OperatorRecord> records = new ContentStateTracker().walk(operations);
        ReplacementPlan plan = new MatchPlanner().plan(0, "Mercury", "Mercurial", records, NO_ALIGNMENT);

        List<ContentOperation> result = rewriter.apply(operations, records, plan.getMatchSegments(),
                Collections.singletonMap(2, 7.0 / 9.0));

        assertThat(result).extracting(ContentOperation::getOperatorName)
                .containsExactly("BT", "Tf", "Tz", "Tj", "Tz", "ET");
        assertThat(((COSNumber) result.get(2).getOperands().get(0)).floatValue())
                .isCloseTo(700f / 9f, within(1e-3f));
        assertThat(((COSNumber) result.get(4).getOperands().get(0)).floatValue()).isCloseTo(100f, within(1e-6f));
        assertThat(text(result.get(3).getOperands().get(0))).isEqualTo("Mercurial");
    }

    @Test
    @DisplayName("apply: TJ 压缩后在数组末尾补回少走的前进量")
    void apply_TJ压缩() {
        List<ContentOperation> operations = ops("BT /F1 10 Tf [(Merc) -20 (ury)] TJ ET");
        List<OperatorRecord> records = new ContentStateTracker().walk(operations);
        ReplacementPlan plan = new MatchPlanner().plan(0, "ury", "urial", records, NO_ALIGNMENT);

        List<ContentOperation> result = rewriter.apply(operations, records, plan.getMatchSegments(),
                Collections.singletonMap(2, 0.8));

        assertThat(result).extracting(ContentOperation::getOperatorName)
                .containsExactly("BT", "Tf", "Tz", "TJ", "Tz", "ET");
        COSArray array = (COSArray) result.get(3).getOperands().get(0);
        assertThat(text(array.getObject(2))).isEqualTo("urial");
        // 原宽 7 × 5 + 0.2 = 35.2；压缩到 0.8 后补 −(1/0.8 − 1) × 35.2 × 100
        float last = ((COSNumber) array.getObject(array.size() - 1)).floatValue();
        assertThat(last).isCloseTo(-880f, within(1e-2f));
    }

    @Test
    @DisplayName("apply: 接近 1 的比例不压缩")
    void apply_不压缩() {
        List<ContentOperation> operations = ops("BT /F1 10 Tf (Mercury) Tj ET");
        List<OperatorRecord> records = new ContentStateTracker().walk(operations);
        ReplacementPlan plan = new MatchPlanner().plan(0, "Mercury", "Jupiter", records, NO_ALIGNMENT);

        List<ContentOperation> result = rewriter.apply(operations, records, plan.getMatchSegments(),
                Collections.singletonMap(2, 0.999));

        assertThat(result).extracting(ContentOperation::getOperatorName).doesNotContain("Tz");
    }
}
