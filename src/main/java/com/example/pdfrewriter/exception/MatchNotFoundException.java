package com.example.pdfrewriter.exception;

/**
 * 目标文本在页面解码文本中找不到（精确匹配和忽略空白匹配都失败）
 *
 * 对单个替换请求是致命的，不返回部分计划。
 */
public class MatchNotFoundException extends PdfRewriteException {

    private final int pageIndex;
    private final String target;

    public MatchNotFoundException(int pageIndex, String target) {
        super(String.format("第 %d 页找不到目标文本: '%s'", pageIndex + 1, target));
        this.pageIndex = pageIndex;
        this.target = target;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public String getTarget() {
        return target;
    }
}
