package com.example.rcaengine.topology;

import java.util.Map;

/**
 * Label matching against a component's configured matchers. Exact values,
 * or prefixes when the pattern ends with '*'.
 */
public final class LabelMatchers {

    private LabelMatchers() {
    }

    /**
     * @return the number of matched labels when every matcher matches, -1 otherwise
     */
    public static int specificity(Map<String, String> labels, Map<String, String> matchers) {
        if (matchers == null || matchers.isEmpty() || labels == null) return -1;
        for (Map.Entry<String, String> matcher : matchers.entrySet()) {
            String value = labels.get(matcher.getKey());
            if (value == null || !matches(value, matcher.getValue())) {
                return -1;
            }
        }
        return matchers.size();
    }

    static boolean matches(String value, String pattern) {
        if (pattern == null) return false;
        if (pattern.endsWith("*")) {
            return value.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return value.equals(pattern);
    }
}
