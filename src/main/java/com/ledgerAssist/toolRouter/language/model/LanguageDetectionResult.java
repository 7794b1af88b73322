package com.ledgerAssist.toolRouter.language.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of language detection.
 * Indicates whether the query is Indonesian or English.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LanguageDetectionResult {

    /**
     * Detected language code: "id" for Indonesian, "en" for English.
     */
    private String languageCode;

    /**
     * Confidence score (0.0 to 1.0) indicating detection confidence.
     */
    private double confidence;

    public boolean isIndonesian() {
        return "id".equals(languageCode);
    }

    public boolean isEnglish() {
        return "en".equals(languageCode);
    }
}
