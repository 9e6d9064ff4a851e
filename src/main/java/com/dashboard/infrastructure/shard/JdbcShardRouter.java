package com.dashboard.infrastructure.shard;

import com.dashboard.domain.service.TenantRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Routes each AC to its own voters table (voters_111, voters_119, ...).
 * 
 * Handles are built on first use and kept for the process lifetime.
 * The AC is checked against the configured set before anything is built,
 * so an unknown id can never bind a new table.
 */
@Slf4j
@Component
public class JdbcShardRouter implements ShardRouter {
    
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    
    private final TenantRegistry tenantRegistry;
    private final String tablePrefix;
    private final ConcurrentMap<Integer, ShardHandle> handles = new ConcurrentHashMap<>();
    
    public JdbcShardRouter(TenantRegistry tenantRegistry,
                           @Value("${app.shard.table-prefix:voters_}") String tablePrefix) {
        this.tenantRegistry = tenantRegistry;
        this.tablePrefix = tablePrefix;
    }
    
    @Override
    public ShardHandle resolve(int acId) {
        tenantRegistry.require(acId);
        return handles.computeIfAbsent(acId, this::bind);
    }
    
    int boundShardCount() {
        return handles.size();
    }
    
    private ShardHandle bind(int acId) {
        String tableName = tablePrefix + acId;
        
        // Table names are spliced into SQL, so only plain identifiers are allowed
        if (!TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalStateException("Invalid shard table name: " + tableName);
        }
        
        log.info("Bound AC {} to shard table {}", acId, tableName);
        return new ShardHandle(acId, tableName);
    }
}
