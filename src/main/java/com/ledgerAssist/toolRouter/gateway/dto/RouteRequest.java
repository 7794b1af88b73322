package com.ledgerAssist.toolRouter.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for routing a query.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteRequest {

    @NotBlank(message = "query cannot be blank")
    private String query;

    /**
     * Date relative phrases are resolved against; today in the configured time zone when absent.
     */
    private LocalDate referenceDate;
}
