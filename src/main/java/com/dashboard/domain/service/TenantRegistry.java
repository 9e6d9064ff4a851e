package com.dashboard.domain.service;

import com.dashboard.config.TenantProperties;
import com.dashboard.domain.exception.UnknownTenantException;
import com.dashboard.domain.model.Tenant;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The enumerated set of ACs. Fixed at startup.
 */
@Component
public class TenantRegistry {
    
    private final Map<Integer, Tenant> tenants;
    
    public TenantRegistry(TenantProperties properties) {
        Map<Integer, Tenant> byId = new LinkedHashMap<>();
        for (Tenant tenant : properties.getTenants()) {
            if (byId.putIfAbsent(tenant.getId(), tenant) != null) {
                throw new IllegalStateException("Duplicate AC id in configuration: " + tenant.getId());
            }
        }
        this.tenants = Collections.unmodifiableMap(byId);
    }
    
    public static TenantRegistry of(List<Tenant> tenants) {
        TenantProperties properties = new TenantProperties();
        properties.setTenants(tenants);
        return new TenantRegistry(properties);
    }
    
    public Tenant require(int acId) {
        Tenant tenant = tenants.get(acId);
        if (tenant == null) {
            throw new UnknownTenantException(acId);
        }
        return tenant;
    }
    
    public boolean contains(int acId) {
        return tenants.containsKey(acId);
    }
    
    /**
     * All ACs in configuration order.
     */
    public List<Tenant> all() {
        return List.copyOf(tenants.values());
    }
}
