package com.example.pdfrewriter.util.stream;

import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSBase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 内容流中的一条指令：操作数 + 操作符
 *
 * 例如 {@code /F1 12 Tf} → operands=[/F1, 12], operator="Tf"
 *
 * 保留解析得到的 {@link Operator} 原对象：内联图像（BI）的参数和数据挂在 Operator 上，
 * 回写内容流时必须原样交给 ContentStreamWriter。
 */
public class ContentOperation {

    private final List<COSBase> operands;
    private final Operator operator;

    public ContentOperation(List<COSBase> operands, Operator operator) {
        this.operands = operands == null
                ? Collections.<COSBase>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(operands));
        this.operator = operator;
    }

    public ContentOperation(List<COSBase> operands, String operatorName) {
        this(operands, Operator.getOperator(operatorName));
    }

    public List<COSBase> getOperands() {
        return operands;
    }

    public String getOperatorName() {
        return operator.getName();
    }

    public Operator getOperator() {
        return operator;
    }

    /**
     * 转成 ContentStreamWriter 可写的 token 序列（操作数在前，操作符在后）
     */
    public List<Object> toTokens() {
        List<Object> tokens = new ArrayList<Object>(operands);
        tokens.add(operator);
        return tokens;
    }

    @Override
    public String toString() {
        return operands + " " + operator.getName();
    }
}
