package com.dashboard.infrastructure.cache;

/**
 * Cache key builders, so every caller names keys the same way.
 * 
 * All keys of one AC share the prefix "ac:{acId}:"; the trailing colon keeps
 * AC 11 from matching AC 111 on prefix invalidation.
 */
public final class CacheKeys {
    
    public static final String GLOBAL_PREFIX = "global:";
    public static final String OVERVIEW = GLOBAL_PREFIX + "overview";
    
    private CacheKeys() {
    }
    
    public static String tenantPrefix(int acId) {
        return generate("ac", acId) + ":";
    }
    
    public static String dashboardStats(int acId) {
        return generate("ac", acId, "dashboard", "stats");
    }
    
    /**
     * Generate cache key from parts.
     */
    public static String generate(String prefix, Object... params) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object param : params) {
            key.append(":").append(param != null ? param.toString() : "null");
        }
        return key.toString();
    }
}
