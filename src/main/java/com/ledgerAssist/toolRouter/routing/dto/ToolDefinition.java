package com.ledgerAssist.toolRouter.routing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Tool entry as supplied by the external tool catalog.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ToolDefinition {

    private String name;

    private String purpose;

    /**
     * Free-text usage hints ("sales invoices", "faktur penjualan"); tokenized into keywords.
     */
    @Builder.Default
    private List<String> hints = new ArrayList<>();

    @Builder.Default
    private List<String> parameters = new ArrayList<>();
}
