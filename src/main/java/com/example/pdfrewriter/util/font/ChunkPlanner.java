package com.example.pdfrewriter.util.font;

import com.example.pdfrewriter.exception.GlyphLookupException;
import com.example.pdfrewriter.util.font.dto.AttackPlan;
import com.example.pdfrewriter.util.font.dto.AttackPosition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 把可见文本分配到隐藏文本的各个字符位置
 *
 * <h3>隐藏文本不短于可见文本</h3>
 * 逐个隐藏字符顺序消耗可见文本，每个位置拿到的是可见文本中连续的一段：
 * <ul>
 *   <li>隐藏字符是空白：下一个可见字符也是空白就取它，否则这个位置零宽</li>
 *   <li>非空白：连同前面的可见空白一起取到下一个非空白可见字符</li>
 *   <li>可见文本用完后剩下的位置都是零宽；没分出去的可见字符接在最后一个非零宽位置后面</li>
 * </ul>
 * 各位置的可见文本按顺序拼起来恒等于输入的可见文本，不增字也不换序。
 *
 * <h3>可见文本更长</h3>
 * 目标宽度 = 可见总前进量 / 隐藏字符数。每个位置贪心取字符，
 * 直到达到取字上限（给后面每个位置至少留一个），或累计宽度达到目标且剩余字符够分；
 * 最后一个位置吸收全部剩余字符。按宽度而不是按字符数切分，渲染后各位置宽度大致均匀。
 */
@Slf4j
public class ChunkPlanner {

    private final GlyphLookup glyphLookup;

    public ChunkPlanner(GlyphLookup glyphLookup) {
        this.glyphLookup = glyphLookup;
    }

    /**
     * @param hiddenText 隐藏文本（写在文本层里的字符），不能为空
     * @param visualText 可见文本，可以为空
     * @throws IllegalArgumentException 隐藏文本为空
     * @throws GlyphLookupException     有字符不在基础字体里（一次报告全部缺失字符）
     */
    public AttackPlan plan(String hiddenText, String visualText) {
        if (hiddenText == null || hiddenText.isEmpty()) {
            throw new IllegalArgumentException("Hidden text must be non-empty");
        }
        String visual = visualText != null ? visualText : "";
        List<String> hiddenChars = codePoints(hiddenText);
        List<String> visualChars = codePoints(visual);

        ensureAvailable(hiddenChars, visualChars);

        List<AttackPosition> positions;
        if (visualChars.isEmpty()) {
            positions = new ArrayList<>();
            for (int i = 0; i < hiddenChars.size(); i++) {
                positions.add(AttackPosition.blank(i, hiddenChars.get(i)));
            }
        } else if (hiddenChars.size() >= visualChars.size()) {
            positions = planWhenHiddenLonger(hiddenChars, visualChars);
        } else {
            positions = planWhenVisualLonger(hiddenChars, visualChars);
        }

        AttackPlan plan = new AttackPlan(hiddenText, visual, positions);
        log.debug("字形分配: hidden='{}', visual='{}', {} 个位置", hiddenText, visual, plan.size());
        return plan;
    }

    private void ensureAvailable(List<String> hiddenChars, List<String> visualChars) {
        Set<String> all = new LinkedHashSet<>(hiddenChars);
        all.addAll(visualChars);
        List<String> missing = new ArrayList<>();
        for (String ch : all) {
            if (!glyphLookup.isAvailable(ch.codePointAt(0))) {
                missing.add(ch);
            }
        }
        if (!missing.isEmpty()) {
            throw new GlyphLookupException(glyphLookup.fontName(), missing);
        }
    }

    private List<AttackPosition> planWhenHiddenLonger(List<String> hiddenChars, List<String> visualChars) {
        List<AttackPosition> positions = new ArrayList<>();
        int visualIndex = 0;

        for (int idx = 0; idx < hiddenChars.size(); idx++) {
            String hiddenChar = hiddenChars.get(idx);
            if (isWhitespace(hiddenChar)) {
                if (visualIndex < visualChars.size() && isWhitespace(visualChars.get(visualIndex))) {
                    positions.add(chunk(idx, hiddenChar, visualChars.subList(visualIndex, visualIndex + 1)));
                    visualIndex++;
                } else {
                    positions.add(AttackPosition.blank(idx, hiddenChar));
                }
                continue;
            }

            int from = visualIndex;
            while (visualIndex < visualChars.size() && isWhitespace(visualChars.get(visualIndex))) {
                visualIndex++;
            }
            if (visualIndex < visualChars.size()) {
                visualIndex++;
            }
            if (visualIndex > from) {
                positions.add(chunk(idx, hiddenChar, visualChars.subList(from, visualIndex)));
            } else {
                positions.add(AttackPosition.blank(idx, hiddenChar));
            }
        }
        if (visualIndex < visualChars.size()) {
            appendLeftover(positions, visualChars.subList(visualIndex, visualChars.size()));
        }
        return positions;
    }

    /**
     * 没分出去的可见字符接到最后一个有可见内容的位置后面；它之后的位置都是零宽，顺序不变
     */
    private void appendLeftover(List<AttackPosition> positions, List<String> leftover) {
        int target = positions.size() - 1;
        for (int i = positions.size() - 1; i >= 0; i--) {
            if (!positions.get(i).isZeroWidth()) {
                target = i;
                break;
            }
        }
        AttackPosition base = positions.get(target);
        StringBuilder chunk = new StringBuilder(base.getVisualText());
        List<String> names = new ArrayList<>(base.getGlyphNames());
        List<Integer> ids = new ArrayList<>(base.getGlyphIds());
        double width = base.getAdvanceWidth();
        for (String ch : leftover) {
            width += append(ch, chunk, names, ids);
        }
        positions.set(target, new AttackPosition(base.getIndex(), base.getHiddenChar(), chunk.toString(),
                names, ids, width));
    }

    private List<AttackPosition> planWhenVisualLonger(List<String> hiddenChars, List<String> visualChars) {
        double totalWidth = 0;
        for (String ch : visualChars) {
            totalWidth += glyphLookup.glyphWidth(ch.codePointAt(0));
        }
        double targetWidth = totalWidth / Math.max(hiddenChars.size(), 1);

        List<AttackPosition> positions = new ArrayList<>();
        int visualIndex = 0;
        for (int idx = 0; idx < hiddenChars.size(); idx++) {
            int remainingSlots = hiddenChars.size() - idx;
            int remainingVisual = visualChars.size() - visualIndex;
            int takeLimit = Math.max(remainingVisual - (remainingSlots - 1), 1);

            StringBuilder chunk = new StringBuilder();
            List<String> names = new ArrayList<>();
            List<Integer> ids = new ArrayList<>();
            double chunkWidth = 0;
            int taken = 0;
            boolean last = idx == hiddenChars.size() - 1;

            while (visualIndex < visualChars.size() && (taken < takeLimit || last)) {
                String ch = visualChars.get(visualIndex++);
                chunkWidth += append(ch, chunk, names, ids);
                taken++;
                if (!last && chunkWidth >= targetWidth
                        && visualChars.size() - visualIndex >= remainingSlots - 1) {
                    break;
                }
            }
            positions.add(new AttackPosition(idx, hiddenChars.get(idx), chunk.toString(), names, ids, chunkWidth));
        }
        return positions;
    }

    private AttackPosition chunk(int index, String hiddenChar, List<String> visualChars) {
        StringBuilder chunk = new StringBuilder();
        List<String> names = new ArrayList<>();
        List<Integer> ids = new ArrayList<>();
        double width = 0;
        for (String ch : visualChars) {
            width += append(ch, chunk, names, ids);
        }
        return new AttackPosition(index, hiddenChar, chunk.toString(), names, ids, width);
    }

    private double append(String ch, StringBuilder chunk, List<String> names, List<Integer> ids) {
        int codePoint = ch.codePointAt(0);
        chunk.append(ch);
        names.add(glyphLookup.glyphName(codePoint));
        ids.add(glyphLookup.glyphId(codePoint));
        return glyphLookup.glyphWidth(codePoint);
    }

    private static boolean isWhitespace(String ch) {
        int codePoint = ch.codePointAt(0);
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    private static List<String> codePoints(String text) {
        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            result.add(new String(Character.toChars(codePoint)));
            i += Character.charCount(codePoint);
        }
        return result;
    }
}
