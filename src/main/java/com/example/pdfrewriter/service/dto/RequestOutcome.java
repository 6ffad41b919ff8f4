package com.example.pdfrewriter.service.dto;

import com.example.pdfrewriter.util.plan.dto.ReplacementPlan;
import com.example.pdfrewriter.util.rewrite.dto.SpanKey;
import com.example.pdfrewriter.util.rewrite.dto.SpanRewriteEntry;
import com.example.pdfrewriter.util.rewrite.dto.ValidationFailure;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 单个替换请求的处理结果
 *
 * 请求之间互不影响：某个请求失败只记录在自己的结果里。
 */
@Getter
@Builder
public final class RequestOutcome {

    private final String requestId;
    private final String original;
    private final String replacement;
    private final RequestStatus status;
    private final ReplacementPlan plan;
    @Builder.Default
    private final List<SpanRewriteEntry> entries = Collections.emptyList();
    @Builder.Default
    private final List<ValidationFailure> validationFailures = Collections.emptyList();
    /**
     * 压缩到下限仍放不下、需要覆盖层补画的 span
     */
    @Builder.Default
    private final List<SpanKey> overlaySpans = Collections.emptyList();
    private final String message;

    public boolean isApplied() {
        return status == RequestStatus.APPLIED || status == RequestStatus.PARTIALLY_APPLIED;
    }
}
