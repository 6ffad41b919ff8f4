package com.example.pdfrewriter.util.font.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 可见文本在隐藏文本各位置上的分布
 */
public final class AttackPlan implements Iterable<AttackPosition> {

    private final String hiddenText;
    private final String visualText;
    private final List<AttackPosition> positions;

    public AttackPlan(String hiddenText, String visualText, List<AttackPosition> positions) {
        this.hiddenText = hiddenText;
        this.visualText = visualText;
        this.positions = Collections.unmodifiableList(new ArrayList<>(positions));
    }

    public String getHiddenText() {
        return hiddenText;
    }

    public String getVisualText() {
        return visualText;
    }

    public List<AttackPosition> getPositions() {
        return positions;
    }

    public int size() {
        return positions.size();
    }

    /**
     * 各位置可见文本按顺序拼接；ChunkPlanner 生成的计划恒等于输入的可见文本
     */
    public String joinedVisualText() {
        StringBuilder sb = new StringBuilder();
        for (AttackPosition position : positions) {
            sb.append(position.getVisualText());
        }
        return sb.toString();
    }

    @Override
    public Iterator<AttackPosition> iterator() {
        return positions.iterator();
    }
}
