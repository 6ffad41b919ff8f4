package com.example.pdfrewriter.service.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单页改写结果：每个请求一条结果，外加最后一次分析的前进量警告
 */
public final class PageRewriteResult {

    private final int pageIndex;
    private final List<RequestOutcome> outcomes;
    private final List<String> warnings;

    public PageRewriteResult(int pageIndex, List<RequestOutcome> outcomes, List<String> warnings) {
        this.pageIndex = pageIndex;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public List<RequestOutcome> getOutcomes() {
        return outcomes;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public int getAppliedCount() {
        int count = 0;
        for (RequestOutcome outcome : outcomes) {
            if (outcome.isApplied()) {
                count++;
            }
        }
        return count;
    }
}
