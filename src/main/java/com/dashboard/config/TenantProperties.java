package com.dashboard.config;

import com.dashboard.domain.model.Tenant;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * The fixed set of Assembly Constituencies this deployment serves.
 * 
 * app:
 *   tenants:
 *     - id: 111
 *       name: Thondamuthur
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class TenantProperties {

    @Valid
    @NotEmpty
    private List<Tenant> tenants = new ArrayList<>();
}
