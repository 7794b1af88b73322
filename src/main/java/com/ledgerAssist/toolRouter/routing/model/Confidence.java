package com.ledgerAssist.toolRouter.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How sure the router is that a suggested tool is the right one.
 */
public enum Confidence {

    /**
     * The query names this tool unambiguously.
     */
    DEFINITIVE("definitive"),

    /**
     * The tool is a reasonable answer but the caller may need more context.
     */
    CONTEXT_DEPENDENT("context-dependent");

    private final String tag;

    Confidence(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static Confidence fromTag(String tag) {
        for (Confidence confidence : values()) {
            if (confidence.tag.equalsIgnoreCase(tag) || confidence.name().equalsIgnoreCase(tag)) {
                return confidence;
            }
        }
        throw new IllegalArgumentException("Unknown confidence: " + tag);
    }
}
