package com.subscription.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierUpdateRequest {

    @Size(min = 1, max = 100)
    private String name;

    private String description;

    @DecimalMin("0.0")
    private BigDecimal price;

    @Pattern(regexp = "[A-Za-z]{3}", message = "must be a 3-letter currency code")
    private String currency;
}
