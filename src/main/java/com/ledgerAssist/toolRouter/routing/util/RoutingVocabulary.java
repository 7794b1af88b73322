package com.ledgerAssist.toolRouter.routing.util;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed bilingual word lists used by the keyword scorer and the language detector.
 */
public final class RoutingVocabulary {

    private RoutingVocabulary() {}

    public static final Set<String> ENGLISH_STOP_WORDS = Set.of(
            "show", "me", "the", "my", "a", "an", "get", "find", "what",
            "is", "are", "can", "you", "i", "want", "to", "see", "all",
            "please", "give", "how", "much", "many", "do", "does", "we", "have",
            "our", "us", "of", "in", "on", "for", "with", "from", "at", "by"
    );

    public static final Set<String> INDONESIAN_STOP_WORDS = Set.of(
            "tampilkan", "saya", "apa", "berapa", "ini", "itu", "yang", "ke",
            "dari", "untuk", "di", "pada", "dengan", "oleh", "kita", "kami",
            "lihat", "cari", "mau", "ingin", "bisa", "tolong", "ada"
    );

    public static final Set<String> STOP_WORDS = union(ENGLISH_STOP_WORDS, INDONESIAN_STOP_WORDS);

    /**
     * Action verb -> tool-name segments that the verb favours.
     */
    public static final Map<String, List<String>> ACTION_VERBS = actionVerbs();

    private static Map<String, List<String>> actionVerbs() {
        Map<String, List<String>> verbs = new LinkedHashMap<>();
        // list/show
        for (String verb : List.of("list", "show", "all", "daftar")) {
            verbs.put(verb, List.of("_list"));
        }
        // search
        for (String verb : List.of("find", "search", "lookup", "cari")) {
            verbs.put(verb, List.of("_search"));
        }
        // detail
        for (String verb : List.of("get", "detail", "details", "info")) {
            verbs.put(verb, List.of("_detail", "_get"));
        }
        // summary/report
        for (String verb : List.of("summary", "report", "total", "totals", "ringkasan", "laporan")) {
            verbs.put(verb, List.of("_summary", "_totals"));
        }
        return Map.copyOf(verbs);
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        Set<String> all = new HashSet<>(first);
        all.addAll(second);
        return Set.copyOf(all);
    }
}
