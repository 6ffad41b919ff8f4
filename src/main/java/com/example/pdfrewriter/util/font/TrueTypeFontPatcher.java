package com.example.pdfrewriter.util.font;

import com.example.pdfrewriter.exception.FontBuildException;
import org.apache.fontbox.ttf.GlyphData;
import org.apache.fontbox.ttf.GlyphDescription;
import org.apache.fontbox.ttf.GlyphTable;
import org.apache.fontbox.ttf.HorizontalMetricsTable;
import org.apache.fontbox.ttf.TrueTypeFont;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * TrueType 字形替换：把目标字形换成若干字形平移后拼成的简单字形
 *
 * <h3>处理步骤</h3>
 * <ol>
 *   <li>按表目录拆出所有表</li>
 *   <li>用 FontBox 读出来源字形的轮廓点（复合字形已展开），按累计前进量平移后合并为一个简单字形</li>
 *   <li>重建 glyf + loca（统一写成长格式）</li>
 *   <li>重建 hmtx（每个字形一条完整记录），同步 hhea.numberOfHMetrics / advanceWidthMax</li>
 *   <li>maxp 的点数、轮廓数上限，head 的字形边界框和 loca 格式</li>
 *   <li>重新排表、对齐、计算每张表校验和以及 head.checkSumAdjustment</li>
 * </ol>
 *
 * 依赖字形宽度的 hdmx / LTSH 以及签名表 DSIG 改完后不再有效，直接去掉。
 */
final class TrueTypeFontPatcher {

    private static final int ON_CURVE = 0x01;
    private static final long CHECKSUM_MAGIC = 0xB1B0AFBAL;
    private static final Set<String> DROPPED_TABLES = new HashSet<>(Arrays.asList("DSIG", "hdmx", "LTSH"));

    private TrueTypeFontPatcher() {
    }

    /**
     * @param fontBytes     基础字体文件
     * @param font          同一文件解析出的 FontBox 字体（读轮廓和度量）
     * @param targetGid     被替换的字形（隐藏字符的字形）
     * @param sourceGlyphs  按顺序拼接的来源字形
     * @param advanceWidth  新前进宽度；≤ 0 时保留原宽度
     * @param zeroWidth     零宽位置：前进宽度和左侧空白都置 0
     */
    static byte[] patch(byte[] fontBytes, TrueTypeFont font, int targetGid, List<Integer> sourceGlyphs,
                        int advanceWidth, boolean zeroWidth) throws IOException {
        Map<String, byte[]> tables = readTables(fontBytes);
        for (String required : Arrays.asList("glyf", "loca", "head", "hhea", "hmtx", "maxp")) {
            if (!tables.containsKey(required)) {
                throw new FontBuildException("基础字体缺少 " + required + " 表");
            }
        }
        int sfntVersion = ByteBuffer.wrap(fontBytes).getInt(0);

        ByteBuffer head = ByteBuffer.wrap(tables.get("head"));
        ByteBuffer hhea = ByteBuffer.wrap(tables.get("hhea"));
        ByteBuffer maxp = ByteBuffer.wrap(tables.get("maxp"));
        int numGlyphs = maxp.getShort(4) & 0xFFFF;
        if (targetGid <= 0 || targetGid >= numGlyphs) {
            throw new FontBuildException("目标字形超出范围: gid=" + targetGid + ", numGlyphs=" + numGlyphs);
        }

        Outline outline = composeOutline(font, sourceGlyphs);
        if (!zeroWidth) {
            outline.checkRange(advanceWidth);
        }
        byte[] newGlyph = zeroWidth ? new byte[0] : outline.encode();

        // glyf + loca
        long[] loca = readLoca(tables.get("loca"), head.getShort(50), numGlyphs);
        byte[] glyf = tables.get("glyf");
        ByteArrayOutputStream newGlyf = new ByteArrayOutputStream(glyf.length + newGlyph.length);
        ByteBuffer newLoca = ByteBuffer.allocate((numGlyphs + 1) * 4);
        for (int gid = 0; gid < numGlyphs; gid++) {
            newLoca.putInt(newGlyf.size());
            byte[] data;
            if (gid == targetGid) {
                data = newGlyph;
            } else {
                int start = (int) Math.min(loca[gid], glyf.length);
                int end = (int) Math.min(Math.max(loca[gid + 1], start), glyf.length);
                data = Arrays.copyOfRange(glyf, start, end);
            }
            newGlyf.write(data, 0, data.length);
            int padding = (4 - data.length % 4) % 4;
            newGlyf.write(new byte[padding], 0, padding);
        }
        newLoca.putInt(newGlyf.size());
        tables.put("glyf", newGlyf.toByteArray());
        tables.put("loca", newLoca.array());
        head.putShort(50, (short) 1);

        // hmtx + hhea
        HorizontalMetricsTable hmtx = font.getHorizontalMetrics();
        ByteBuffer newHmtx = ByteBuffer.allocate(numGlyphs * 4);
        int advanceMax = 0;
        for (int gid = 0; gid < numGlyphs; gid++) {
            int advance = hmtx.getAdvanceWidth(gid);
            int lsb = hmtx.getLeftSideBearing(gid);
            if (gid == targetGid) {
                if (zeroWidth) {
                    advance = 0;
                    lsb = 0;
                } else {
                    if (advanceWidth > 0) {
                        advance = advanceWidth;
                    }
                    lsb = outline.isEmpty() ? 0 : outline.xMin;
                }
            }
            advanceMax = Math.max(advanceMax, advance);
            newHmtx.putShort((short) advance);
            newHmtx.putShort((short) lsb);
        }
        tables.put("hmtx", newHmtx.array());
        hhea.putShort(10, (short) Math.max(hhea.getShort(10) & 0xFFFF, advanceMax));
        hhea.putShort(34, (short) numGlyphs);

        if (!zeroWidth && !outline.isEmpty()) {
            // maxp 1.0 才有点数/轮廓数上限
            if (maxp.getInt(0) == 0x00010000 && maxp.capacity() >= 10) {
                maxp.putShort(6, (short) Math.max(maxp.getShort(6) & 0xFFFF, outline.pointCount()));
                maxp.putShort(8, (short) Math.max(maxp.getShort(8) & 0xFFFF, outline.contourCount()));
            }
            head.putShort(36, (short) Math.min(head.getShort(36), outline.xMin));
            head.putShort(38, (short) Math.min(head.getShort(38), outline.yMin));
            head.putShort(40, (short) Math.max(head.getShort(40), outline.xMax));
            head.putShort(42, (short) Math.max(head.getShort(42), outline.yMax));
        }

        for (String tag : DROPPED_TABLES) {
            tables.remove(tag);
        }
        return writeFont(sfntVersion, tables);
    }

    private static Map<String, byte[]> readTables(byte[] fontBytes) {
        ByteBuffer buffer = ByteBuffer.wrap(fontBytes);
        int numTables = buffer.getShort(4) & 0xFFFF;
        Map<String, byte[]> tables = new TreeMap<>();
        for (int i = 0; i < numTables; i++) {
            int record = 12 + i * 16;
            String tag = new String(fontBytes, record, 4, StandardCharsets.US_ASCII);
            int offset = buffer.getInt(record + 8);
            int length = buffer.getInt(record + 12);
            if (offset < 0 || length < 0 || offset + length > fontBytes.length) {
                throw new FontBuildException("字体表目录损坏: " + tag);
            }
            tables.put(tag, Arrays.copyOfRange(fontBytes, offset, offset + length));
        }
        return tables;
    }

    private static long[] readLoca(byte[] loca, short indexToLocFormat, int numGlyphs) {
        ByteBuffer buffer = ByteBuffer.wrap(loca);
        long[] offsets = new long[numGlyphs + 1];
        for (int i = 0; i <= numGlyphs; i++) {
            if (indexToLocFormat == 0) {
                offsets[i] = (buffer.getShort(i * 2) & 0xFFFFL) * 2;
            } else {
                offsets[i] = buffer.getInt(i * 4) & 0xFFFFFFFFL;
            }
        }
        return offsets;
    }

    private static Outline composeOutline(TrueTypeFont font, List<Integer> sourceGlyphs) throws IOException {
        GlyphTable glyphTable = font.getGlyph();
        HorizontalMetricsTable hmtx = font.getHorizontalMetrics();
        Outline outline = new Outline();
        int xOffset = 0;
        for (Integer gid : sourceGlyphs) {
            GlyphData data = glyphTable.getGlyph(gid);
            if (data != null) {
                outline.append(data.getDescription(), xOffset);
            }
            xOffset += hmtx.getAdvanceWidth(gid);
        }
        return outline;
    }

    private static byte[] writeFont(int sfntVersion, Map<String, byte[]> tables) {
        int numTables = tables.size();
        int entrySelector = 31 - Integer.numberOfLeadingZeros(Math.max(numTables, 1));
        int searchRange = (1 << entrySelector) * 16;

        int offset = 12 + numTables * 16;
        int total = offset;
        for (byte[] data : tables.values()) {
            total += align4(data.length);
        }
        ByteBuffer out = ByteBuffer.allocate(total);
        out.putInt(sfntVersion);
        out.putShort((short) numTables);
        out.putShort((short) searchRange);
        out.putShort((short) entrySelector);
        out.putShort((short) (numTables * 16 - searchRange));

        int headOffset = -1;
        int dataOffset = offset;
        List<Map.Entry<String, byte[]>> entries = new ArrayList<>(tables.entrySet());
        for (Map.Entry<String, byte[]> entry : entries) {
            byte[] data = entry.getValue();
            if ("head".equals(entry.getKey())) {
                ByteBuffer.wrap(data).putInt(8, 0);
                headOffset = dataOffset;
            }
            out.put(entry.getKey().getBytes(StandardCharsets.US_ASCII));
            out.putInt((int) checksum(data));
            out.putInt(dataOffset);
            out.putInt(data.length);
            dataOffset += align4(data.length);
        }
        for (Map.Entry<String, byte[]> entry : entries) {
            byte[] data = entry.getValue();
            out.put(data);
            out.put(new byte[align4(data.length) - data.length]);
        }

        byte[] font = out.array();
        if (headOffset >= 0) {
            long adjustment = (CHECKSUM_MAGIC - checksum(font)) & 0xFFFFFFFFL;
            ByteBuffer.wrap(font).putInt(headOffset + 8, (int) adjustment);
        }
        return font;
    }

    private static int align4(int length) {
        return (length + 3) & ~3;
    }

    static long checksum(byte[] data) {
        long sum = 0;
        int padded = align4(data.length);
        for (int i = 0; i < padded; i += 4) {
            long word = 0;
            for (int k = 0; k < 4; k++) {
                int index = i + k;
                word = (word << 8) | (index < data.length ? data[index] & 0xFF : 0);
            }
            sum = (sum + word) & 0xFFFFFFFFL;
        }
        return sum;
    }

    /**
     * 合并后的轮廓：简单字形，坐标全部用 16 位差值编码
     */
    private static final class Outline {
        private final List<Integer> endPoints = new ArrayList<>();
        private final List<int[]> points = new ArrayList<>();
        private int xMin = Integer.MAX_VALUE;
        private int yMin = Integer.MAX_VALUE;
        private int xMax = Integer.MIN_VALUE;
        private int yMax = Integer.MIN_VALUE;

        private void append(GlyphDescription description, int xOffset) {
            int base = points.size();
            for (int i = 0; i < description.getPointCount(); i++) {
                int x = description.getXCoordinate(i) + xOffset;
                int y = description.getYCoordinate(i);
                int onCurve = description.getFlags(i) & ON_CURVE;
                points.add(new int[]{x, y, onCurve});
                xMin = Math.min(xMin, x);
                yMin = Math.min(yMin, y);
                xMax = Math.max(xMax, x);
                yMax = Math.max(yMax, y);
            }
            for (int c = 0; c < description.getContourCount(); c++) {
                endPoints.add(base + description.getEndPtOfContours(c));
            }
        }

        private boolean isEmpty() {
            return points.isEmpty() || endPoints.isEmpty();
        }

        /**
         * glyf 的坐标、边界框和相邻点差值都是 int16，hmtx 前进宽度是 uint16；超出时不能写出
         */
        private void checkRange(int advanceWidth) {
            if (advanceWidth > 0xFFFF) {
                throw new FontBuildException("前进宽度超出 uint16 范围: " + advanceWidth);
            }
            if (isEmpty()) {
                return;
            }
            if (points.size() > 0xFFFF) {
                throw new FontBuildException("合并后的点数超出范围: " + points.size());
            }
            if (!fitsShort(xMin) || !fitsShort(xMax) || !fitsShort(yMin) || !fitsShort(yMax)
                    || !fitsShort(xMax - xMin) || !fitsShort(yMax - yMin)) {
                throw new FontBuildException("合并后的轮廓坐标超出 int16 范围: x=[" + xMin + ", " + xMax
                        + "], y=[" + yMin + ", " + yMax + "]");
            }
        }

        private static boolean fitsShort(int value) {
            return value >= Short.MIN_VALUE && value <= Short.MAX_VALUE;
        }

        private int pointCount() {
            return points.size();
        }

        private int contourCount() {
            return endPoints.size();
        }

        private byte[] encode() {
            if (isEmpty()) {
                return new byte[0];
            }
            int n = points.size();
            ByteBuffer buffer = ByteBuffer.allocate(10 + endPoints.size() * 2 + 2 + n + n * 4);
            buffer.putShort((short) endPoints.size());
            buffer.putShort((short) xMin);
            buffer.putShort((short) yMin);
            buffer.putShort((short) xMax);
            buffer.putShort((short) yMax);
            for (Integer end : endPoints) {
                buffer.putShort((short) end.intValue());
            }
            buffer.putShort((short) 0);
            for (int[] point : points) {
                buffer.put((byte) point[2]);
            }
            int previous = 0;
            for (int[] point : points) {
                buffer.putShort((short) (point[0] - previous));
                previous = point[0];
            }
            previous = 0;
            for (int[] point : points) {
                buffer.putShort((short) (point[1] - previous));
                previous = point[1];
            }
            return buffer.array();
        }
    }
}
