package com.example.pdfrewriter.util.stream;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 状态跟踪涉及的内容流操作符
 */
public final class PdfOperators {

    public static final String SAVE_GRAPHICS_STATE = "q";
    public static final String RESTORE_GRAPHICS_STATE = "Q";
    public static final String CONCAT_MATRIX = "cm";

    public static final String BEGIN_TEXT_OBJECT = "BT";
    public static final String END_TEXT_OBJECT = "ET";

    public static final String SET_FONT_AND_SIZE = "Tf";
    public static final String SET_CHAR_SPACING = "Tc";
    public static final String SET_WORD_SPACING = "Tw";
    public static final String SET_HORIZONTAL_SCALING = "Tz";
    public static final String SET_LEADING = "TL";
    public static final String SET_TEXT_RISE = "Ts";

    public static final String SET_TEXT_MATRIX = "Tm";
    public static final String MOVE_TEXT = "Td";
    public static final String MOVE_TEXT_SET_LEADING = "TD";
    public static final String NEXT_LINE = "T*";

    public static final String SHOW_TEXT = "Tj";
    public static final String SHOW_TEXT_ADJUSTED = "TJ";
    public static final String SHOW_TEXT_LINE = "'";
    public static final String SHOW_TEXT_LINE_AND_SPACE = "\"";

    public static final Set<String> TEXT_SHOW_OPERATORS = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList(SHOW_TEXT, SHOW_TEXT_ADJUSTED, SHOW_TEXT_LINE, SHOW_TEXT_LINE_AND_SPACE)));

    private PdfOperators() {
    }

    public static boolean isTextShow(String operator) {
        return TEXT_SHOW_OPERATORS.contains(operator);
    }
}
