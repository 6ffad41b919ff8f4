package com.example.pdfrewriter.util.stream;

import com.example.pdfrewriter.util.stream.dto.LiteralKind;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;
import com.example.pdfrewriter.util.stream.dto.ShowTextItem;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 内容流状态跟踪器
 *
 * <h3>工作方式</h3>
 * 单遍重放指令序列，维护图形/文本状态快照栈：
 * <ul>
 *   <li>q：当前快照压栈；Q：出栈（同时视为离开文本对象）</li>
 *   <li>cm：CTM' = CTM ∘ operand</li>
 *   <li>BT：文本矩阵、行矩阵归位，间距参数恢复默认</li>
 *   <li>Tm：文本矩阵 = 行矩阵 = operand</li>
 *   <li>Td、TD、T*、'、"：行矩阵平移 (tx, ty) 或 (0, −leading)，并同步到文本矩阵</li>
 *   <li>Tj/TJ/'/"：解码文本载荷，记录快照，再按前进量水平平移文本矩阵</li>
 * </ul>
 *
 * <h3>两遍运行</h3>
 * <ol>
 *   <li>预备遍：不传 resolver，前进量全部用朴素估算，得到的记录用于视觉对齐</li>
 *   <li>最终遍：传入基于对齐结果的 resolver，得到准确的 postTextMatrix</li>
 * </ol>
 *
 * 操作数个数不足时按 0 补齐，不抛异常。跟踪器本身无共享状态，每页新建一个。
 */
@Slf4j
public class ContentStateTracker {

    private final AdvanceResolver advanceResolver;
    private final TextFragmentDecoder decoder;
    private final double naiveGlyphWidthFactor;

    public ContentStateTracker() {
        this(null, TextFragmentDecoder.LATIN1, NaiveAdvanceEstimator.DEFAULT_GLYPH_WIDTH_FACTOR);
    }

    public ContentStateTracker(AdvanceResolver advanceResolver, TextFragmentDecoder decoder,
                               double naiveGlyphWidthFactor) {
        this.advanceResolver = advanceResolver;
        this.decoder = decoder != null ? decoder : TextFragmentDecoder.LATIN1;
        this.naiveGlyphWidthFactor = naiveGlyphWidthFactor;
    }

    /**
     * 重放整个指令序列
     *
     * @param operations 内容流指令
     * @return 每条指令一条记录，index 与输入下标一致
     */
    public List<OperatorRecord> walk(List<ContentOperation> operations) {
        List<OperatorRecord> records = new ArrayList<>(operations.size());
        Deque<TextGraphicsState> stack = new ArrayDeque<>();
        TextGraphicsState state = TextGraphicsState.initial();
        int graphicsDepth = 0;
        int textDepth = 0;
        boolean insideText = false;

        for (int index = 0; index < operations.size(); index++) {
            ContentOperation operation = operations.get(index);
            String op = operation.getOperatorName();
            List<COSBase> operands = operation.getOperands();
            boolean textShow = insideText && PdfOperators.isTextShow(op);

            // ' 和 " 先换行再显示，快照取换行之后的状态
            if (textShow && (PdfOperators.SHOW_TEXT_LINE.equals(op) || PdfOperators.SHOW_TEXT_LINE_AND_SPACE.equals(op))) {
                if (PdfOperators.SHOW_TEXT_LINE_AND_SPACE.equals(op)) {
                    state = state.withWordSpacing(number(operands, 0, 0)).withCharSpacing(number(operands, 1, 0));
                }
                state = state.withTextMatrices(state.getTextLineMatrix().translate(0, -state.getLeading()));
            }

            OperatorRecord.OperatorRecordBuilder builder = snapshot(index, op, operands, graphicsDepth, textDepth, state);

            if (textShow) {
                builder.showItems(captureTextPayload(op, operands, state.getFontResource()))
                        .literalKind(literalKindOf(op, operands));
                OperatorRecord pending = builder.build();
                double advance = resolveAdvance(pending, state);
                state = state.withTextMatrix(state.getTextMatrix().translate(advance, 0));
                builder.advance(advance).postTextMatrix(state.getTextMatrix());
                records.add(builder.build());
                continue;
            }

            records.add(builder.build());

            switch (op) {
                case PdfOperators.SAVE_GRAPHICS_STATE:
                    graphicsDepth++;
                    stack.push(state);
                    break;
                case PdfOperators.RESTORE_GRAPHICS_STATE:
                    if (graphicsDepth > 0 && !stack.isEmpty()) {
                        graphicsDepth--;
                        state = stack.pop();
                        insideText = false;
                        textDepth = Math.max(textDepth - 1, 0);
                    }
                    break;
                case PdfOperators.CONCAT_MATRIX:
                    state = state.withCtm(state.getCtm().compose(AffineMatrix.fromOperands(operands)));
                    break;
                case PdfOperators.BEGIN_TEXT_OBJECT:
                    insideText = true;
                    textDepth++;
                    state = state.beginText();
                    break;
                case PdfOperators.END_TEXT_OBJECT:
                    insideText = false;
                    textDepth = Math.max(textDepth - 1, 0);
                    break;
                case PdfOperators.SET_FONT_AND_SIZE:
                    state = state.withFont(fontName(operands, state.getFontResource()),
                            operands.size() >= 2 ? number(operands, 1, state.getFontSize()) : state.getFontSize());
                    break;
                case PdfOperators.SET_CHAR_SPACING:
                    state = state.withCharSpacing(number(operands, 0, 0));
                    break;
                case PdfOperators.SET_WORD_SPACING:
                    state = state.withWordSpacing(number(operands, 0, 0));
                    break;
                case PdfOperators.SET_HORIZONTAL_SCALING:
                    state = state.withHorizontalScaling(number(operands, 0, TextGraphicsState.DEFAULT_HORIZONTAL_SCALING));
                    break;
                case PdfOperators.SET_LEADING:
                    state = state.withLeading(number(operands, 0, 0));
                    break;
                case PdfOperators.SET_TEXT_RISE:
                    state = state.withTextRise(number(operands, 0, 0));
                    break;
                case PdfOperators.SET_TEXT_MATRIX:
                    if (insideText) {
                        state = state.withTextMatrices(AffineMatrix.fromOperands(operands));
                    }
                    break;
                case PdfOperators.MOVE_TEXT:
                case PdfOperators.MOVE_TEXT_SET_LEADING:
                    if (insideText) {
                        double tx = number(operands, 0, 0);
                        double ty = number(operands, 1, 0);
                        state = state.withTextMatrices(state.getTextLineMatrix().translate(tx, ty));
                        if (PdfOperators.MOVE_TEXT_SET_LEADING.equals(op)) {
                            state = state.withLeading(-ty);
                        }
                    }
                    break;
                case PdfOperators.NEXT_LINE:
                    if (insideText) {
                        state = state.withTextMatrices(state.getTextLineMatrix().translate(0, -state.getLeading()));
                    }
                    break;
                default:
                    break;
            }
        }

        log.debug("状态跟踪完成: {} 条指令, resolver={}", records.size(), advanceResolver != null);
        return records;
    }

    private OperatorRecord.OperatorRecordBuilder snapshot(int index, String op, List<COSBase> operands,
                                                          int graphicsDepth, int textDepth, TextGraphicsState state) {
        return OperatorRecord.builder()
                .index(index)
                .operator(op)
                .operands(operands)
                .graphicsDepth(graphicsDepth)
                .textDepth(textDepth)
                .ctm(state.getCtm())
                .textMatrix(state.getTextMatrix())
                .textLineMatrix(state.getTextLineMatrix())
                .fontResource(state.getFontResource())
                .fontSize(state.getFontSize())
                .charSpacing(state.getCharSpacing())
                .wordSpacing(state.getWordSpacing())
                .horizontalScaling(state.getHorizontalScaling())
                .leading(state.getLeading())
                .textRise(state.getTextRise());
    }

    /**
     * 解码文本载荷
     *
     * Tj：唯一操作数；' 和 "：最后一个操作数；TJ：数组内字符串与数字交替
     */
    private List<ShowTextItem> captureTextPayload(String op, List<COSBase> operands, String fontResource) {
        List<ShowTextItem> items = new ArrayList<>();
        if (operands.isEmpty()) {
            return items;
        }

        if (PdfOperators.SHOW_TEXT_ADJUSTED.equals(op)) {
            if (!(operands.get(0) instanceof COSArray)) {
                return items;
            }
            COSArray array = (COSArray) operands.get(0);
            int cursor = 0;
            for (int slot = 0; slot < array.size(); slot++) {
                COSBase entry = array.getObject(slot);
                if (entry instanceof COSNumber) {
                    items.add(ShowTextItem.number(slot, ((COSNumber) entry).floatValue(), cursor));
                } else if (entry instanceof COSString) {
                    ShowTextItem item = decodeString(slot, (COSString) entry, fontResource, cursor);
                    items.add(item);
                    cursor = item.getTextEnd();
                }
            }
            return items;
        }

        COSBase operand = PdfOperators.SHOW_TEXT.equals(op) ? operands.get(0) : operands.get(operands.size() - 1);
        if (operand instanceof COSString) {
            items.add(decodeString(0, (COSString) operand, fontResource, 0));
        }
        return items;
    }

    private ShowTextItem decodeString(int slot, COSString string, String fontResource, int textStart) {
        String text = decoder.decode(fontResource, string);
        LiteralKind kind = string.getForceHexForm() ? LiteralKind.BYTE : LiteralKind.TEXT;
        return ShowTextItem.string(slot, text, string.getBytes(), kind, textStart);
    }

    private LiteralKind literalKindOf(String op, List<COSBase> operands) {
        if (PdfOperators.SHOW_TEXT_ADJUSTED.equals(op)) {
            return LiteralKind.ARRAY;
        }
        if (operands.isEmpty()) {
            return LiteralKind.UNKNOWN;
        }
        COSBase operand = PdfOperators.SHOW_TEXT.equals(op) ? operands.get(0) : operands.get(operands.size() - 1);
        if (operand instanceof COSString) {
            return ((COSString) operand).getForceHexForm() ? LiteralKind.BYTE : LiteralKind.TEXT;
        }
        return LiteralKind.UNKNOWN;
    }

    /**
     * 前进量：优先 resolver，失败或返回 null 时退回朴素估算
     */
    private double resolveAdvance(OperatorRecord record, TextGraphicsState state) {
        if (!record.hasTextPayload()) {
            return 0.0;
        }
        if (advanceResolver != null) {
            try {
                Double resolved = advanceResolver.resolve(record, state);
                if (resolved != null && !resolved.isNaN() && !resolved.isInfinite()) {
                    return resolved;
                }
            } catch (RuntimeException e) {
                log.warn("前进量解析失败，退回朴素估算: index={}, error={}", record.getIndex(), e.getMessage());
            }
        }
        return NaiveAdvanceEstimator.estimate(record, state, naiveGlyphWidthFactor);
    }

    private static double number(List<COSBase> operands, int position, double defaultValue) {
        if (position >= operands.size()) {
            return defaultValue;
        }
        COSBase operand = operands.get(position);
        if (operand instanceof COSNumber) {
            return ((COSNumber) operand).floatValue();
        }
        return defaultValue;
    }

    private static String fontName(List<COSBase> operands, String current) {
        if (!operands.isEmpty() && operands.get(0) instanceof COSName) {
            return ((COSName) operands.get(0)).getName();
        }
        return current;
    }
}
