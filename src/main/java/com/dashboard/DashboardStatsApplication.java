package com.dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Constituency Dashboard Statistics Backend
 * 
 * Serves per-AC dashboard statistics without running the heavy voter
 * aggregations on every request.
 * 
 * Architecture:
 * - Voter data sharded into one table per Assembly Constituency (voters_{acId})
 * - In-memory TTL cache in front of everything (minutes)
 * - Durable precomputed snapshot per AC (precomputed_stats table)
 * - Real-time computation as the cold-start / outage fallback
 * - Background refresh of every AC snapshot every 5 minutes
 * 
 * Read path:
 * cache -> precomputed snapshot -> real-time aggregation
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
@ConfigurationPropertiesScan
public class DashboardStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DashboardStatsApplication.class, args);
    }
}
