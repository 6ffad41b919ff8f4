package com.example.pdfrewriter.util.match;

/**
 * 精确匹配
 */
public class ExactMatchStrategy implements TextMatchStrategy {

    public static final String NAME = "exact";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MatchResult find(String haystack, String needle, int fromIndex) {
        if (haystack == null || needle == null || needle.isEmpty()) {
            return MatchResult.notFound();
        }
        int position = haystack.indexOf(needle, Math.max(fromIndex, 0));
        if (position < 0) {
            return MatchResult.notFound();
        }
        return MatchResult.found(position, position + needle.length(), NAME);
    }
}
