package com.ledgerAssist.toolRouter.language.service;

import com.ledgerAssist.toolRouter.language.model.LanguageDetectionResult;
import com.ledgerAssist.toolRouter.routing.util.RoutingVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Language Detector service.
 *
 * Both supported languages use the Latin alphabet, so detection counts function words:
 * every token found in the Indonesian or English marker lists is a vote for that language.
 * Ties and queries without markers default to English.
 */
@Slf4j
@Service
public class LanguageDetector {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}]+");

    private static final Set<String> INDONESIAN_MARKERS = markers(RoutingVocabulary.INDONESIAN_STOP_WORDS,
            Set.of("siapa", "mana", "belum", "sudah", "bulan", "minggu", "tahun", "hari", "lalu", "kemarin",
                    "daftar", "saja", "aja", "punya", "bayar", "lunas", "terbesar", "paling", "banyak",
                    "faktur", "pelanggan", "penjualan", "pendapatan", "pemasok", "hutang", "piutang", "barang"));

    private static final Set<String> ENGLISH_MARKERS = markers(RoutingVocabulary.ENGLISH_STOP_WORDS,
            Set.of("who", "which", "last", "this", "month", "week", "year", "today", "yesterday",
                    "list", "unpaid", "paid", "top", "customers", "invoices", "sales", "money"));

    /**
     * Detects the language of the given query text.
     *
     * @param messageText The text to analyze
     * @return LanguageDetectionResult indicating Indonesian or English
     */
    public LanguageDetectionResult detectLanguage(String messageText) {
        if (messageText == null || messageText.isBlank()) {
            return LanguageDetectionResult.builder()
                    .languageCode("en")
                    .confidence(0.0)
                    .build();
        }

        int indonesianHits = 0;
        int englishHits = 0;
        for (String token : TOKEN_SEPARATOR.split(messageText.toLowerCase())) {
            if (INDONESIAN_MARKERS.contains(token)) {
                indonesianHits++;
            }
            if (ENGLISH_MARKERS.contains(token)) {
                englishHits++;
            }
        }

        int total = indonesianHits + englishHits;
        boolean indonesian = indonesianHits > englishHits;
        double confidence = total == 0 ? 0.5 : (double) Math.max(indonesianHits, englishHits) / total;
        String detectedLanguage = indonesian ? "id" : "en";

        log.debug("Language detection - detected: {}, confidence: {}", detectedLanguage, confidence);

        return LanguageDetectionResult.builder()
                .languageCode(detectedLanguage)
                .confidence(confidence)
                .build();
    }

    private static Set<String> markers(Set<String> first, Set<String> second) {
        Set<String> all = new HashSet<>(first);
        all.addAll(second);
        return Set.copyOf(all);
    }
}
