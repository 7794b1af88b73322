package com.ledgerAssist.toolRouter.routing.dto;

import com.ledgerAssist.toolRouter.routing.model.Confidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pattern entry as declared in the pattern resource file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PatternDefinition {

    private String id;

    @Builder.Default
    private List<String> phrases = new ArrayList<>();

    private String tool;

    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    private String defaultPeriod;

    @Builder.Default
    private Confidence confidence = Confidence.DEFINITIVE;
}
