package com.dashboard.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Value;

/**
 * An Assembly Constituency (AC). Drawn from configuration, never created at runtime.
 */
@Value
public class Tenant {

    @Positive
    int id;

    @NotBlank
    String name;
}
