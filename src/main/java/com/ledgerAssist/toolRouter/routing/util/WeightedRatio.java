package com.ledgerAssist.toolRouter.routing.util;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Weighted-ratio string similarity, tolerant of token reordering and partial matches.
 *
 * Combines a plain indel ratio with token-sort, token-set and partial (substring) ratios,
 * scaling the partial variants down as the length difference between the strings grows.
 */
public final class WeightedRatio implements SimilarityScorer {

    private static final double UNBASE_SCALE = 0.95;
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    @Override
    public double score(String query, String choice) {
        return weightedRatio(preprocess(query), preprocess(choice));
    }

    /**
     * Lower-cases, replaces every non letter/digit run with a single space and trims.
     */
    public static String preprocess(String value) {
        if (value == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(value.toLowerCase()).replaceAll(" ").trim();
    }

    public static double weightedRatio(String s1, String s2) {
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0;
        }

        int len1 = s1.length();
        int len2 = s2.length();
        double lenRatio = len1 > len2 ? (double) len1 / len2 : (double) len2 / len1;

        double endRatio = ratio(s1, s2);
        if (lenRatio < 1.5) {
            return Math.max(endRatio, tokenRatio(s1, s2) * UNBASE_SCALE);
        }

        double partialScale = lenRatio <= 8.0 ? 0.9 : 0.6;
        endRatio = Math.max(endRatio, partialRatio(s1, s2) * partialScale);
        return Math.max(endRatio, partialTokenRatio(s1, s2) * UNBASE_SCALE * partialScale);
    }

    /**
     * Indel similarity: 100 * 2 * LCS / (len1 + len2).
     */
    public static double ratio(String s1, String s2) {
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 100;
        }
        return 100.0 * 2 * LCS.apply(s1, s2) / total;
    }

    /**
     * Best ratio of the shorter string against every same-length window of the longer one,
     * including the windows cut off at either end.
     */
    public static double partialRatio(String s1, String s2) {
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0;
        }
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;
        int n = shorter.length();
        int m = longer.length();

        double best = 0;
        for (int i = 0; i + n <= m; i++) {
            best = Math.max(best, ratio(shorter, longer.substring(i, i + n)));
            if (best == 100) {
                return best;
            }
        }
        for (int len = 1; len < n && len <= m; len++) {
            best = Math.max(best, ratio(shorter, longer.substring(0, len)));
            best = Math.max(best, ratio(shorter, longer.substring(m - len)));
        }
        return best;
    }

    public static double tokenSortRatio(String s1, String s2) {
        return ratio(sortedJoin(s1), sortedJoin(s2));
    }

    public static double tokenSetRatio(String s1, String s2) {
        TreeSet<String> tokensA = sortedTokens(s1);
        TreeSet<String> tokensB = sortedTokens(s2);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0;
        }

        TreeSet<String> intersection = new TreeSet<>(tokensA);
        intersection.retainAll(tokensB);
        TreeSet<String> diffAB = new TreeSet<>(tokensA);
        diffAB.removeAll(tokensB);
        TreeSet<String> diffBA = new TreeSet<>(tokensB);
        diffBA.removeAll(tokensA);

        if (!intersection.isEmpty() && (diffAB.isEmpty() || diffBA.isEmpty())) {
            return 100;
        }

        String sect = String.join(" ", intersection);
        String combinedAB = joinNonEmpty(sect, String.join(" ", diffAB));
        String combinedBA = joinNonEmpty(sect, String.join(" ", diffBA));

        return Math.max(ratio(combinedAB, combinedBA),
                Math.max(sect.isEmpty() ? 0 : ratio(sect, combinedAB),
                        sect.isEmpty() ? 0 : ratio(sect, combinedBA)));
    }

    public static double partialTokenRatio(String s1, String s2) {
        TreeSet<String> tokensA = sortedTokens(s1);
        TreeSet<String> tokensB = sortedTokens(s2);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0;
        }
        for (String token : tokensA) {
            if (tokensB.contains(token)) {
                return 100;
            }
        }
        return partialRatio(String.join(" ", tokensA), String.join(" ", tokensB));
    }

    private static double tokenRatio(String s1, String s2) {
        return Math.max(tokenSortRatio(s1, s2), tokenSetRatio(s1, s2));
    }

    private static String sortedJoin(String value) {
        if (value.isBlank()) {
            return "";
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(WHITESPACE.split(value.trim())));
        Collections.sort(tokens);
        return String.join(" ", tokens);
    }

    private static TreeSet<String> sortedTokens(String value) {
        TreeSet<String> tokens = new TreeSet<>();
        if (value.isBlank()) {
            return tokens;
        }
        tokens.addAll(Arrays.asList(WHITESPACE.split(value.trim())));
        return tokens;
    }

    private static String joinNonEmpty(String first, String second) {
        if (first.isEmpty()) {
            return second;
        }
        if (second.isEmpty()) {
            return first;
        }
        return first + " " + second;
    }
}
