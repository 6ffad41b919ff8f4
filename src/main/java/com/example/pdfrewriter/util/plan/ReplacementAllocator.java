package com.example.pdfrewriter.util.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * 按原文长度比例把替换文本分配到多个段
 *
 * 规则（贪心 + 余数归尾）：
 * <ul>
 *   <li>非最后一段：round(剩余字符数 × 本段长度 / 剩余总长度)</li>
 *   <li>上限：剩余字符数 − 后面长度为正的段数，保证后面每段至少还能分到 1 个字符</li>
 *   <li>本段长度为正、按比例得 0、且字符够分时，至少给 1 个</li>
 *   <li>最后一段吸收全部剩余，分配总长恒等于替换文本长度</li>
 * </ul>
 */
public final class ReplacementAllocator {

    private ReplacementAllocator() {
    }

    public static List<String> allocate(String replacement, int[] lengths) {
        List<String> pieces = new ArrayList<>();
        if (lengths == null || lengths.length == 0) {
            return pieces;
        }
        String text = replacement != null ? replacement : "";

        int count = lengths.length;
        int[] normalized = new int[count];
        int remainingLengths = 0;
        for (int i = 0; i < count; i++) {
            normalized[i] = Math.max(0, lengths[i]);
            remainingLengths += normalized[i];
        }

        int remainingChars = text.length();
        int cursor = 0;
        for (int i = 0; i < count; i++) {
            int length = normalized[i];
            String piece;
            if (i == count - 1) {
                piece = text.substring(cursor);
            } else {
                int remainingPositive = 0;
                for (int k = i + 1; k < count; k++) {
                    if (normalized[k] > 0) {
                        remainingPositive++;
                    }
                }

                int proportional;
                if (remainingLengths > 0) {
                    proportional = (int) Math.round(remainingChars * ((double) length / remainingLengths));
                } else {
                    proportional = remainingChars / Math.max(count - i, 1);
                }
                int maxAllowed = Math.max(0, remainingChars - remainingPositive);
                proportional = Math.max(0, Math.min(proportional, maxAllowed));
                if (length > 0 && proportional == 0 && remainingChars > remainingPositive) {
                    proportional = 1;
                }
                piece = text.substring(cursor, cursor + proportional);
            }

            pieces.add(piece);
            cursor += piece.length();
            remainingChars = Math.max(0, remainingChars - piece.length());
            remainingLengths = Math.max(0, remainingLengths - length);
        }
        return pieces;
    }
}
