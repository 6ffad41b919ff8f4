package com.example.pdfrewriter.util.stream.dto;

import com.example.pdfrewriter.util.align.SpanSlice;
import com.example.pdfrewriter.util.span.dto.SpanRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 单页分析结果：最终操作符记录 + 视觉 span + 对齐表
 */
public final class PageAnalysis {

    private final int pageIndex;
    private final List<OperatorRecord> records;
    private final List<SpanRecord> spans;
    private final Map<Integer, List<SpanSlice>> alignment;

    public PageAnalysis(int pageIndex, List<OperatorRecord> records, List<SpanRecord> spans,
                        Map<Integer, List<SpanSlice>> alignment) {
        this.pageIndex = pageIndex;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.spans = spans != null ? Collections.unmodifiableList(new ArrayList<>(spans)) : Collections.<SpanRecord>emptyList();
        this.alignment = Collections.unmodifiableMap(alignment);
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public List<OperatorRecord> getRecords() {
        return records;
    }

    public List<SpanRecord> getSpans() {
        return spans;
    }

    public Map<Integer, List<SpanSlice>> getAlignment() {
        return alignment;
    }

    public List<SpanSlice> slicesOf(int operatorIndex) {
        List<SpanSlice> slices = alignment.get(operatorIndex);
        return slices != null ? slices : Collections.<SpanSlice>emptyList();
    }

    /**
     * 所有文本显示操作符的记录
     */
    public List<OperatorRecord> getTextRecords() {
        List<OperatorRecord> result = new ArrayList<>();
        for (OperatorRecord record : records) {
            if (record.hasTextPayload()) {
                result.add(record);
            }
        }
        return result;
    }

    /**
     * 带前进量警告的记录
     */
    public List<OperatorRecord> getWarnings() {
        List<OperatorRecord> result = new ArrayList<>();
        for (OperatorRecord record : records) {
            if (record.getAdvanceWarning() != null) {
                result.add(record);
            }
        }
        return result;
    }
}
