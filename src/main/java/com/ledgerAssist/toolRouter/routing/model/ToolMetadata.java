package com.ledgerAssist.toolRouter.routing.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Catalog entry for one callable tool. Keywords are already normalized to canonical terms.
 */
@Value
@Builder
public class ToolMetadata {

    String name;
    String purpose;
    Set<String> keywords;
    List<String> parameters;

    public boolean acceptsParameter(String parameter) {
        return parameters.contains(parameter);
    }
}
