package com.ledgerAssist.toolRouter.routing.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A tool the caller may want to invoke, with pre-filled parameter values.
 */
@Value
@Builder
public class ToolSuggestion {

    String toolName;

    /**
     * One-line description of what the tool does.
     */
    String purpose;

    List<String> keyParameters;

    /**
     * Parameter values inferred from the query (dates, status filters).
     */
    Map<String, Object> suggestedParameters;

    double score;
    Confidence confidence;
}
