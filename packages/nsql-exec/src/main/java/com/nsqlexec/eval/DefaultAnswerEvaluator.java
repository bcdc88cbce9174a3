package com.nsqlexec.eval;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Order-insensitive comparison of normalized answer values. Numbers match within a small
 * tolerance. When the gold answer is a single 0 or 1 (fact verification), yes/true and no/false
 * predictions count as 1 and 0.
 */
public class DefaultAnswerEvaluator implements AnswerEvaluator {

    static final double TOLERANCE = 1e-4;

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^(?:[\\p{Punct}&&[^+\\-]]|\\s)+|(?:\\p{Punct}|\\s)+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Set<String> TRUE_WORDS = new HashSet<>(Arrays.asList("yes", "true", "1"));
    private static final Set<String> FALSE_WORDS = new HashSet<>(Arrays.asList("no", "false", "0"));

    @Override
    public int score(List<Object> predicted, List<Object> gold, String question) {
        if (predicted == null || gold == null) {
            return 0;
        }
        List<String> pred = normalizeAll(predicted);
        List<String> expected = normalizeAll(gold);

        if (expected.size() == 1 && (expected.get(0).equals("0") || expected.get(0).equals("1"))
                && pred.size() == 1) {
            String verdict = pred.get(0);
            if (TRUE_WORDS.contains(verdict)) {
                return expected.get(0).equals("1") ? 1 : 0;
            }
            if (FALSE_WORDS.contains(verdict)) {
                return expected.get(0).equals("0") ? 1 : 0;
            }
        }

        return sameSet(pred, expected) ? 1 : 0;
    }

    private static boolean sameSet(List<String> pred, List<String> gold) {
        List<String> left = distinct(pred);
        List<String> right = distinct(gold);
        if (left.size() != right.size()) {
            return false;
        }
        List<String> unmatched = new ArrayList<>(right);
        for (String value : left) {
            String match = null;
            for (String candidate : unmatched) {
                if (matches(value, candidate)) {
                    match = candidate;
                    break;
                }
            }
            if (match == null) {
                return false;
            }
            unmatched.remove(match);
        }
        return true;
    }

    private static List<String> distinct(List<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            if (!result.contains(value)) {
                result.add(value);
            }
        }
        return result;
    }

    static boolean matches(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        Double x = toNumber(a);
        Double y = toNumber(b);
        return x != null && y != null && Math.abs(x - y) <= TOLERANCE;
    }

    private static Double toNumber(String value) {
        try {
            return new BigDecimal(value.replace(",", "")).doubleValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> normalizeAll(List<Object> values) {
        List<String> normalized = new ArrayList<>();
        for (Object value : values) {
            if (value != null) {
                normalized.add(normalize(value.toString()));
            }
        }
        return normalized;
    }

    static String normalize(String value) {
        String text = WHITESPACE.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ");
        String trimmed = EDGE_PUNCTUATION.matcher(text).replaceAll("");
        // keep values that are nothing but punctuation
        return trimmed.isEmpty() ? text.trim() : trimmed;
    }
}
