package com.example.pdfrewriter.util.stream.dto;

import com.example.pdfrewriter.util.stream.AffineMatrix;
import lombok.Builder;
import lombok.Getter;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.util.Vector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单条内容流指令的完整状态快照
 *
 * <h3>字段分组</h3>
 * <ul>
 *   <li>指令本身：index / operator / operands</li>
 *   <li>执行前状态：嵌套深度、CTM、文本矩阵、行矩阵、字体、间距、缩放、行距、上升</li>
 *   <li>文本载荷（仅文本显示指令）：showItems + literalKind</li>
 *   <li>前进量诊断（分析阶段填充）：advance、postTextMatrix、方向、投影、世界坐标、漂移误差、警告</li>
 * </ul>
 *
 * 生成后只读；分析阶段补充诊断字段时通过 {@link #toBuilder()} 生成新对象。
 */
@Getter
@Builder(toBuilder = true)
public final class OperatorRecord {

    private final int index;
    private final String operator;
    @Builder.Default
    private final List<COSBase> operands = Collections.emptyList();
    private final int graphicsDepth;
    private final int textDepth;

    private final AffineMatrix ctm;
    private final AffineMatrix textMatrix;
    private final AffineMatrix textLineMatrix;
    private final String fontResource;
    private final double fontSize;
    private final double charSpacing;
    private final double wordSpacing;
    private final double horizontalScaling;
    private final double leading;
    private final double textRise;

    @Builder.Default
    private final List<ShowTextItem> showItems = Collections.emptyList();
    private final LiteralKind literalKind;

    private final Double advance;
    private final AffineMatrix postTextMatrix;
    private final Vector advanceDirection;
    private final Double advanceStartProjection;
    private final Double advanceEndProjection;
    private final Vector worldStart;
    private final Vector worldEnd;
    private final Vector advanceDelta;
    private final Double advanceError;
    private final String advanceWarning;

    /**
     * 是否携带文本载荷（文本显示指令且位于 BT/ET 内）
     */
    public boolean hasTextPayload() {
        return !showItems.isEmpty();
    }

    public List<String> getTextFragments() {
        List<String> fragments = new ArrayList<>();
        for (ShowTextItem item : showItems) {
            if (item.isString()) {
                fragments.add(item.getText());
            }
        }
        return fragments;
    }

    public List<Double> getTextAdjustments() {
        List<Double> adjustments = new ArrayList<>();
        for (ShowTextItem item : showItems) {
            if (!item.isString()) {
                adjustments.add(item.getAdjustment());
            }
        }
        return adjustments;
    }

    public List<byte[]> getRawBytes() {
        List<byte[]> raw = new ArrayList<>();
        for (ShowTextItem item : showItems) {
            if (item.isString()) {
                raw.add(item.getRawBytes());
            }
        }
        return raw;
    }

    /**
     * 所有字符串项解码文本按顺序拼接
     */
    public String getDecodedText() {
        StringBuilder sb = new StringBuilder();
        for (ShowTextItem item : showItems) {
            if (item.isString()) {
                sb.append(item.getText());
            }
        }
        return sb.toString();
    }

    public List<ShowTextItem> getStringItems() {
        List<ShowTextItem> items = new ArrayList<>();
        for (ShowTextItem item : showItems) {
            if (item.isString()) {
                items.add(item);
            }
        }
        return items;
    }

    /**
     * 有效字号：Tf 字号乘以文本矩阵和 CTM 在书写方向上的缩放
     */
    public double effectiveFontSize() {
        if (ctm == null || textMatrix == null) {
            return fontSize;
        }
        AffineMatrix world = ctm.compose(textMatrix);
        return fontSize * Math.hypot(world.getA(), world.getB());
    }

    @Override
    public String toString() {
        return "OperatorRecord{index=" + index + ", operator=" + operator
                + (hasTextPayload() ? ", text='" + getDecodedText() + '\'' : "")
                + (advance != null ? ", advance=" + advance : "")
                + (advanceWarning != null ? ", warning=" + advanceWarning : "")
                + '}';
    }
}
