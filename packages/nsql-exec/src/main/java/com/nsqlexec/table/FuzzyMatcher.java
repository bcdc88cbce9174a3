package com.nsqlexec.table;

import java.util.Collection;
import java.util.Locale;

/**
 * Canonical-form and edit-distance matching of generated names against actual table names
 * and cell values.
 */
public final class FuzzyMatcher {

    private FuzzyMatcher() {
    }

    /**
     * Lower-case form with all whitespace and punctuation removed.
     * "No." and "no", "Home Team" and "home_team" share a canonical form.
     */
    public static String canonical(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                sb.append(Character.toLowerCase(c));
            }
        }
        // names made only of punctuation ("+/-", "#") keep their symbols
        if (sb.length() == 0) {
            return name.trim().toLowerCase(Locale.ROOT);
        }
        return sb.toString();
    }

    public static boolean canonicalEquals(String a, String b) {
        return canonical(a).equals(canonical(b));
    }

    /**
     * Similarity in [0, 1] derived from the Levenshtein distance of the canonical forms.
     */
    public static double similarity(String a, String b) {
        String ca = canonical(a);
        String cb = canonical(b);
        int maxLen = Math.max(ca.length(), cb.length());
        if (maxLen == 0) {
            return 1.0;
        }
        return 1.0 - (double) editDistance(ca, cb) / maxLen;
    }

    /**
     * Returns the candidate that best matches {@code query}: a canonical match wins outright,
     * otherwise the most similar candidate at or above {@code minSimilarity}. Earlier candidates
     * win ties. Returns null when nothing qualifies.
     */
    public static String closest(String query, Collection<String> candidates, double minSimilarity) {
        String target = canonical(query);
        for (String candidate : candidates) {
            if (candidate != null && canonical(candidate).equals(target)) {
                return candidate;
            }
        }

        String best = null;
        double bestScore = minSimilarity;
        for (String candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            double score = similarity(query, candidate);
            if (score > bestScore || (best == null && score >= bestScore)) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    static int editDistance(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
