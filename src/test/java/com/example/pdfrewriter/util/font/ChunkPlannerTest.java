package com.example.pdfrewriter.util.font;

import com.example.pdfrewriter.exception.GlyphLookupException;
import com.example.pdfrewriter.util.font.dto.AttackPlan;
import com.example.pdfrewriter.util.font.dto.AttackPosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkPlannerTest {

    private ChunkPlanner planner;

    /**
     * 假字体：ASCII 可打印字符都有，W 宽 1000，i 宽 250，其余 500；'~' 当作缺字
     */
    private static final class FakeGlyphs implements GlyphLookup {
        private final Map<Integer, Integer> widths = new HashMap<>();

        FakeGlyphs() {
            widths.put((int) 'W', 1000);
            widths.put((int) 'i', 250);
        }

        @Override
        public String fontName() {
            return "FakeSans";
        }

        @Override
        public boolean isAvailable(int codePoint) {
            return codePoint >= 0x20 && codePoint < 0x7F && codePoint != '~';
        }

        @Override
        public int glyphId(int codePoint) {
            return codePoint;
        }

        @Override
        public String glyphName(int codePoint) {
            return codePoint == ' ' ? "space" : String.valueOf((char) codePoint);
        }

        @Override
        public double glyphWidth(int codePoint) {
            Integer width = widths.get(codePoint);
            return width != null ? width : 500;
        }
    }

    @BeforeEach
    void setUp() {
        planner = new ChunkPlanner(new FakeGlyphs());
    }

    @Test
    @DisplayName("plan: 一个隐藏字符显示整段可见文本")
    void plan_可见更长_单位置() {
        AttackPlan plan = planner.plan("a", "Bob");

        assertThat(plan.size()).isEqualTo(1);
        AttackPosition position = plan.getPositions().get(0);
        assertThat(position.getVisualText()).isEqualTo("Bob");
        assertThat(position.getGlyphNames()).containsExactly("B", "o", "b");
        assertThat(position.getAdvanceWidth()).isEqualTo(1500.0);
        assertThat(position.requiresFont()).isTrue();
    }

    @Test
    @DisplayName("plan: 隐藏文本更长时多出的位置为零宽")
    void plan_隐藏更长() {
        AttackPlan plan = planner.plan("abc", "X");

        assertThat(plan.getPositions()).extracting(AttackPosition::getVisualText)
                .containsExactly("X", "", "");
        assertThat(plan.getPositions().get(1).isZeroWidth()).isTrue();
        assertThat(plan.getPositions().get(2).getAdvanceWidth()).isEqualTo(0.0);
        assertThat(plan.joinedVisualText()).isEqualTo("X");
    }

    @Test
    @DisplayName("plan: 按宽度而不是字符数切分")
    void plan_按宽度切分() {
        AttackPlan plan = planner.plan("ab", "WWii");

        assertThat(plan.getPositions()).extracting(AttackPosition::getVisualText)
                .containsExactly("WW", "ii");
    }

    @Test
    @DisplayName("plan: 每个位置至少分到一个字符")
    void plan_取字上限() {
        AttackPlan plan = planner.plan("abc", "Wiii");

        assertThat(plan.getPositions()).allMatch(p -> !p.getVisualText().isEmpty());
        assertThat(plan.joinedVisualText()).isEqualTo("Wiii");
    }

    @Test
    @DisplayName("plan: 空白位置对空白位置，拼接结果等于可见文本")
    void plan_空白对齐() {
        AttackPlan plan = planner.plan("ab cd", "wx yz");

        assertThat(plan.joinedVisualText()).isEqualTo("wx yz");
        assertThat(plan.getPositions().get(2).getVisualText()).isEqualTo(" ");
    }

    @Test
    @DisplayName("plan: 可见空白不挪到末尾")
    void plan_可见空白更多() {
        AttackPlan plan = planner.plan("abc", "X Y");

        assertThat(plan.joinedVisualText()).isEqualTo("X Y");
        assertThat(plan.getPositions()).extracting(AttackPosition::getVisualText)
                .containsExactly("X", " Y", "");
    }

    @Test
    @DisplayName("plan: 可见文本没有空白时隐藏空白位置零宽，不补空格")
    void plan_隐藏空白更多() {
        AttackPlan plan = planner.plan("a b", "XY");

        assertThat(plan.joinedVisualText()).isEqualTo("XY");
        assertThat(plan.getPositions().get(1).isZeroWidth()).isTrue();
        assertThat(plan.getPositions().get(2).getVisualText()).isEqualTo("Y");
    }

    @Test
    @DisplayName("plan: 全是空白的隐藏文本，剩余可见字符按顺序并入")
    void plan_隐藏全空白() {
        AttackPlan plan = planner.plan("   ", "ab");

        assertThat(plan.joinedVisualText()).isEqualTo("ab");
        assertThat(plan.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("plan: 各种空白组合下拼接结果都等于可见文本")
    void plan_拼接不变() {
        String[] hidden = {"a", "ab", "a b", " ab", "ab ", "a  b", "abc de", "  x  ", "abcdef", "a b c d"};
        String[] visual = {"", "X", "X Y", " XY", "XY ", "X  Y", "W i W", "  ", "Wiii W", "x y z w v"};
        for (String h : hidden) {
            for (String v : visual) {
                AttackPlan plan = planner.plan(h, v);

                assertThat(plan.joinedVisualText()).as("hidden='%s' visual='%s'", h, v).isEqualTo(v);
                assertThat(plan.size()).as("hidden='%s' visual='%s'", h, v).isEqualTo(h.length());
            }
        }
    }

    @Test
    @DisplayName("plan: 隐藏字符与可见字符相同时不需要派生字体")
    void plan_原样显示() {
        AttackPlan plan = planner.plan("ab", "ax");

        assertThat(plan.getPositions().get(0).requiresFont()).isFalse();
        assertThat(plan.getPositions().get(1).requiresFont()).isTrue();
    }

    @Test
    @DisplayName("plan: 可见文本为空时全部零宽")
    void plan_可见为空() {
        AttackPlan plan = planner.plan("ab", "");

        assertThat(plan.getPositions()).allMatch(AttackPosition::isZeroWidth);
    }

    @Test
    @DisplayName("plan: 隐藏文本为空报错")
    void plan_隐藏为空() {
        assertThatThrownBy(() -> planner.plan("", "abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Hidden text must be non-empty");
    }

    @Test
    @DisplayName("plan: 缺字一次报告全部")
    void plan_缺字() {
        assertThatThrownBy(() -> planner.plan("a~", "é~"))
                .isInstanceOf(GlyphLookupException.class)
                .satisfies(e -> assertThat(((GlyphLookupException) e).getMissingCharacters())
                        .containsExactly("~", "é"));
    }
}
