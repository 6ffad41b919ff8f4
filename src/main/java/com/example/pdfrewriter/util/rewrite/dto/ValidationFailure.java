package com.example.pdfrewriter.util.rewrite.dto;

/**
 * span 当前文本与期望原文不一致（例如前一次编辑后偏移已失效）
 *
 * start/end 是在 span 原始文本中的区间。
 */
public final class ValidationFailure {

    private final SpanKey spanKey;
    private final String expected;
    private final String observed;
    private final int start;
    private final int end;
    private final String replacement;
    private final String requestId;
    private final Integer operatorIndex;

    public ValidationFailure(SpanKey spanKey, String expected, String observed, int start, int end,
                             String replacement, String requestId, Integer operatorIndex) {
        this.spanKey = spanKey;
        this.expected = expected;
        this.observed = observed;
        this.start = start;
        this.end = end;
        this.replacement = replacement;
        this.requestId = requestId;
        this.operatorIndex = operatorIndex;
    }

    public SpanKey getSpanKey() {
        return spanKey;
    }

    public String getExpected() {
        return expected;
    }

    public String getObserved() {
        return observed;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getReplacement() {
        return replacement;
    }

    public String getRequestId() {
        return requestId;
    }

    public Integer getOperatorIndex() {
        return operatorIndex;
    }

    @Override
    public String toString() {
        return "ValidationFailure{span=" + spanKey + ", expected='" + expected + "', observed='" + observed
                + "', range=[" + start + "," + end + ")}";
    }
}
