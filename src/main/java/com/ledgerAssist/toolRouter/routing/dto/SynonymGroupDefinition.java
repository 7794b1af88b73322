package com.ledgerAssist.toolRouter.routing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One business concept as declared in the synonym resource file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SynonymGroupDefinition {

    /**
     * Canonical term, e.g. "invoice".
     */
    private String canonical;

    /**
     * Surface forms in English and Indonesian that mean the canonical term.
     */
    @Builder.Default
    private List<String> forms = new ArrayList<>();

    /**
     * Tools known to serve this concept.
     */
    @Builder.Default
    private List<String> tools = new ArrayList<>();
}
