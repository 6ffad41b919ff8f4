package com.example.pdfrewriter.util.stream;

import com.example.pdfrewriter.util.stream.dto.LiteralKind;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.pdfrewriter.support.Fixtures.ops;
import static com.example.pdfrewriter.support.Fixtures.walk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ContentStateTrackerTest {

    @Nested
    @DisplayName("图形状态栈")
    class GraphicsStack {

        @Test
        @DisplayName("Q 恢复 q 之前的 CTM")
        void restore_恢复CTM() {
            List<OperatorRecord> records = walk("q 1 0 0 1 50 60 cm Q BT (x) Tj ET");

            OperatorRecord show = records.get(4);
            assertThat(show.getOperator()).isEqualTo("Tj");
            assertThat(show.getCtm()).isEqualTo(AffineMatrix.identity());
            assertThat(show.getGraphicsDepth()).isZero();
        }

        @Test
        @DisplayName("cm 在 q 内生效并记录嵌套深度")
        void concat_嵌套深度() {
            List<OperatorRecord> records = walk("q 2 0 0 2 10 20 cm BT (x) Tj ET Q");

            OperatorRecord show = records.get(3);
            assertThat(show.getGraphicsDepth()).isEqualTo(1);
            assertThat(show.getTextDepth()).isEqualTo(1);
            assertThat(show.getCtm()).isEqualTo(new AffineMatrix(2, 0, 0, 2, 10, 20));
        }

        @Test
        @DisplayName("多余的 Q 被忽略，不抛异常")
        void restore_不平衡() {
            List<OperatorRecord> records = walk("Q Q BT (x) Tj ET");

            assertThat(records).hasSize(5);
            assertThat(records.get(3).hasTextPayload()).isTrue();
            assertThat(records.get(3).getGraphicsDepth()).isZero();
        }
    }

    @Nested
    @DisplayName("文本矩阵")
    class TextMatrix {

        @Test
        @DisplayName("Td 定位，Tj 之后按朴素前进量右移")
        void advance_朴素前进量() {
            List<OperatorRecord> records = walk("BT /F1 10 Tf 100 200 Td (abcd) Tj (ef) Tj ET");

            OperatorRecord first = records.get(3);
            assertThat(first.getTextMatrix().getE()).isEqualTo(100.0);
            assertThat(first.getTextMatrix().getF()).isEqualTo(200.0);
            // 4 个字符 × 10 × 0.5
            assertThat(first.getAdvance()).isCloseTo(20.0, within(1e-9));
            assertThat(first.getPostTextMatrix().getE()).isCloseTo(120.0, within(1e-9));

            OperatorRecord second = records.get(4);
            assertThat(second.getTextMatrix().getE()).isCloseTo(120.0, within(1e-9));
            // 行矩阵不随前进量移动
            assertThat(second.getTextLineMatrix().getE()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("' 先按行距换行再显示")
        void nextLineShow_先换行() {
            List<OperatorRecord> records = walk("BT 14 TL 0 700 Td (a) Tj (b) ' ET");

            OperatorRecord quote = records.get(4);
            assertThat(quote.getOperator()).isEqualTo("'");
            assertThat(quote.getTextMatrix().getE()).isEqualTo(0.0);
            assertThat(quote.getTextMatrix().getF()).isCloseTo(686.0, within(1e-9));
            assertThat(quote.getDecodedText()).isEqualTo("b");
        }

        @Test
        @DisplayName("\" 设置字间距和词间距后换行显示")
        void nextLineShowWithSpacing() {
            List<OperatorRecord> records = walk("BT 10 TL 0 100 Td 2 1 (c) \" ET");

            OperatorRecord record = records.get(3);
            assertThat(record.getWordSpacing()).isEqualTo(2.0);
            assertThat(record.getCharSpacing()).isEqualTo(1.0);
            assertThat(record.getTextMatrix().getF()).isCloseTo(90.0, within(1e-9));
        }

        @Test
        @DisplayName("BT 重置文本矩阵和间距")
        void beginText_重置() {
            List<OperatorRecord> records = walk("BT 3 Tc 50 50 Td ET BT (x) Tj ET");

            OperatorRecord show = records.get(5);
            assertThat(show.getTextMatrix()).isEqualTo(AffineMatrix.identity());
            assertThat(show.getCharSpacing()).isZero();
        }

        @Test
        @DisplayName("操作数不足按 0 补齐")
        void operands_补零() {
            List<OperatorRecord> records = walk("BT 5 Td (a) Tj ET");

            OperatorRecord show = records.get(2);
            assertThat(show.getTextMatrix().getE()).isEqualTo(5.0);
            assertThat(show.getTextMatrix().getF()).isEqualTo(0.0);
        }
    }

    @Nested
    @DisplayName("文本载荷")
    class Payload {

        @Test
        @DisplayName("TJ 数组拆成字符串和字距调整")
        void array_字符串和数字() {
            List<OperatorRecord> records = walk("BT [(AB) -250 (C)] TJ ET");

            OperatorRecord record = records.get(1);
            assertThat(record.getTextFragments()).containsExactly("AB", "C");
            assertThat(record.getTextAdjustments()).containsExactly(-250.0);
            assertThat(record.getLiteralKind()).isEqualTo(LiteralKind.ARRAY);
            assertThat(record.getStringItems().get(1).getSlot()).isEqualTo(2);
            assertThat(record.getStringItems().get(1).getTextStart()).isEqualTo(2);
            // 3 × 12 × 0.5 + 250 / 1000 × 12
            assertThat(record.getAdvance()).isCloseTo(21.0, within(1e-9));
        }

        @Test
        @DisplayName("十六进制字符串记为 BYTE")
        void hex_字节串() {
            List<OperatorRecord> records = walk("BT <414243> Tj ET");

            OperatorRecord record = records.get(1);
            assertThat(record.getDecodedText()).isEqualTo("ABC");
            assertThat(record.getLiteralKind()).isEqualTo(LiteralKind.BYTE);
        }

        @Test
        @DisplayName("BT 外的 Tj 没有文本载荷")
        void outsideText_无载荷() {
            List<OperatorRecord> records = walk("(abc) Tj");

            assertThat(records.get(0).hasTextPayload()).isFalse();
            assertThat(records.get(0).getAdvance()).isNull();
        }

        @Test
        @DisplayName("resolver 的结果优先于朴素估算")
        void resolver_优先() {
            ContentStateTracker tracker = new ContentStateTracker(
                    (record, state) -> 7.5, TextFragmentDecoder.LATIN1, 0.5);
            List<OperatorRecord> records = tracker.walk(
                    ops("BT (abc) Tj ET"));

            assertThat(records.get(1).getAdvance()).isEqualTo(7.5);
            assertThat(records.get(1).getPostTextMatrix().getE()).isEqualTo(7.5);
        }

        @Test
        @DisplayName("resolver 返回 null 时退回朴素估算")
        void resolver_退回() {
            ContentStateTracker tracker = new ContentStateTracker(
                    (record, state) -> null, TextFragmentDecoder.LATIN1, 0.5);
            List<OperatorRecord> records = tracker.walk(
                    ops("BT /F1 10 Tf (ab) Tj ET"));

            assertThat(records.get(2).getAdvance()).isCloseTo(10.0, within(1e-9));
        }
    }
}
