package com.dashboard.infrastructure.shard;

import com.dashboard.domain.exception.UnknownTenantException;
import com.dashboard.domain.model.Tenant;
import com.dashboard.support.TestTenants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class JdbcShardRouterTest {
    
    private JdbcShardRouter router;
    
    @BeforeEach
    void setUp() {
        router = new JdbcShardRouter(TestTenants.registry(), "voters_");
    }
    
    @Test
    void testResolve_IdempotentForEveryConfiguredAc() {
        for (Tenant tenant : TestTenants.FIVE) {
            ShardHandle first = router.resolve(tenant.getId());
            ShardHandle second = router.resolve(tenant.getId());
            
            assertSame(first, second);
            assertEquals(tenant.getId(), first.getAcId());
            assertEquals("voters_" + tenant.getId(), first.getTableName());
        }
        assertEquals(TestTenants.FIVE.size(), router.boundShardCount());
    }
    
    @Test
    void testResolve_UnknownAcFailsWithoutBinding() {
        UnknownTenantException e = assertThrows(UnknownTenantException.class, () -> router.resolve(103));
        
        assertEquals(103, e.getAcId());
        assertEquals(0, router.boundShardCount());
    }
    
    @Test
    void testResolve_ConcurrentCallersShareOneHandle() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ShardHandle>> calls = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                calls.add(() -> router.resolve(119));
            }
            ShardHandle expected = router.resolve(119);
            for (Future<ShardHandle> handle : pool.invokeAll(calls)) {
                assertSame(expected, handle.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
    
    @Test
    void testResolve_RejectsUnsafeTablePrefix() {
        JdbcShardRouter unsafe = new JdbcShardRouter(TestTenants.registry(), "voters; DROP TABLE x; --");
        
        assertThrows(IllegalStateException.class, () -> unsafe.resolve(111));
    }
}
