package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.language.model.LanguageDetectionResult;
import com.ledgerAssist.toolRouter.language.service.LanguageDetector;
import com.ledgerAssist.toolRouter.routing.model.DateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the question returned when a query cannot be routed confidently.
 *
 * The prompt is written in the language of the query, and repeats the period the router
 * did understand so the user only has to supply the missing subject.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClarificationService {

    private final LanguageDetector languageDetector;

    /**
     * Generates a clarification prompt for a query that matched no tool.
     *
     * @param query Original query
     * @param dateRange Date range resolved from the query, or null
     * @return Human-readable clarification prompt
     */
    public String buildPrompt(String query, DateRange dateRange) {
        LanguageDetectionResult language = languageDetector.detectLanguage(query);

        String prompt = language.isIndonesian() ? indonesianPrompt(dateRange) : englishPrompt(dateRange);
        log.debug("Clarification prompt built - language: {}, hasDateRange: {}",
                language.getLanguageCode(), dateRange != null);
        return prompt;
    }

    private String englishPrompt(DateRange dateRange) {
        String question = "What would you like to know? For example: invoices, customers, sales, products...";
        if (dateRange == null) {
            return question;
        }
        return "I understood the period " + dateRange.getStart() + " to " + dateRange.getEnd()
                + ", but not which information you need. " + question;
    }

    private String indonesianPrompt(DateRange dateRange) {
        String question = "Informasi apa yang ingin Anda lihat? Misalnya: faktur, pelanggan, penjualan, produk...";
        if (dateRange == null) {
            return question;
        }
        return "Periode " + dateRange.getStart() + " s/d " + dateRange.getEnd()
                + " sudah dipahami, tetapi datanya belum jelas. " + question;
    }
}
