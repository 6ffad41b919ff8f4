package com.example.pdfrewriter.util.align;

import com.example.pdfrewriter.util.span.dto.CharBox;
import com.example.pdfrewriter.util.span.dto.SpanRecord;
import com.example.pdfrewriter.util.stream.AffineMatrix;
import com.example.pdfrewriter.util.stream.dto.OperatorRecord;

import java.util.List;

/**
 * 操作符前进量计算
 *
 * <h3>span 几何</h3>
 * 每个切片：字符包围盒四角在 span 书写方向（单位向量）上投影的 [min, max]；
 * 前进量 = Σ 切片自身长度 + 相邻切片间的正间隙（重叠/负间隙按 0 计，不扣减）。
 *
 * <h3>朴素退路</h3>
 * 没有对齐结果时，取跟踪器已算出的朴素前进量，方向取 CTM∘Tm 的 x 轴。
 */
public final class OperatorMetrics {

    private static final double EPSILON = 1e-6;

    private OperatorMetrics() {
    }

    /**
     * 由对齐切片计算；切片为空或全部无字符时返回 null
     */
    public static AdvanceMetrics fromSpans(List<SpanSlice> slices) {
        if (slices == null || slices.isEmpty()) {
            return null;
        }

        double total = 0;
        Double firstProjection = null;
        Double lastEnd = null;
        double dirX = 0;
        double dirY = 0;
        boolean haveDirection = false;

        for (SpanSlice slice : slices) {
            SpanRecord span = slice.getSpan();
            List<CharBox> chars = span.getNormalizedChars();
            int upper = Math.min(slice.getEnd(), chars.size());
            if (slice.getStart() >= upper) {
                continue;
            }

            double dx = span.getDirectionX();
            double dy = span.getDirectionY();
            double length = Math.hypot(dx, dy);
            if (length <= EPSILON) {
                dx = 1.0;
                dy = 0.0;
            } else {
                dx /= length;
                dy /= length;
            }

            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (int i = slice.getStart(); i < upper; i++) {
                double[] projection = chars.get(i).project(dx, dy);
                min = Math.min(min, projection[0]);
                max = Math.max(max, projection[1]);
            }

            if (!haveDirection) {
                dirX = dx;
                dirY = dy;
                haveDirection = true;
            }
            if (firstProjection == null) {
                firstProjection = min;
            }
            if (lastEnd != null) {
                double gap = min - lastEnd;
                if (gap > 0) {
                    total += gap;
                }
            }
            total += Math.max(max - min, 0.0);
            lastEnd = max;
        }

        if (firstProjection == null || lastEnd == null) {
            return null;
        }
        return new AdvanceMetrics(total, firstProjection, lastEnd, dirX, dirY, true);
    }

    /**
     * 由跟踪器记录的朴素前进量推出；没有文本或前进量为 0 时返回 null
     *
     * @param worldAdvance 用户空间前进量（文本空间前进量 × |CTM∘Tm 的 x 轴|）
     */
    public static AdvanceMetrics fromRecord(OperatorRecord record, double worldAdvance) {
        if (!record.hasTextPayload() || worldAdvance == 0.0) {
            return null;
        }
        AffineMatrix start = record.getCtm().compose(record.getTextMatrix());

        double dx = start.getA();
        double dy = start.getB();
        if (Math.abs(dx) <= EPSILON && Math.abs(dy) <= EPSILON) {
            dx = start.getC();
            dy = start.getD();
        }
        double length = Math.hypot(dx, dy);
        if (length <= EPSILON) {
            dx = 1.0;
            dy = 0.0;
        } else {
            dx /= length;
            dy /= length;
        }

        double startProjection = start.getE() * dx + start.getF() * dy;
        return new AdvanceMetrics(worldAdvance, startProjection, startProjection + worldAdvance, dx, dy, false);
    }

    /**
     * 文本空间 → 用户空间的长度换算系数：|CTM∘Tm 的 x 轴|
     */
    public static double textToWorldScale(AffineMatrix ctm, AffineMatrix textMatrix) {
        AffineMatrix world = ctm.compose(textMatrix);
        double scale = Math.hypot(world.getA(), world.getB());
        return scale > EPSILON ? scale : 1.0;
    }
}
