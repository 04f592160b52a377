package com.gatediscovery.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Gate Discovery Engine.
 *
 * Annotations Explained:
 * - @SpringBootApplication: Combines @Configuration, @EnableAutoConfiguration, @ComponentScan
 * - @EnableAsync: Discovery cycles triggered by check-in milestones run off the request thread
 * - @EnableScheduling: Fixed-rate discovery, enforcement, duplicate and snapshot refresh timers
 *
 * Flow:
 * 1. Scanners post check-ins (REST or STOMP); each is stored with a GPS quality weight
 * 2. Discovery cycles cluster accepted scans and materialize gates
 * 3. Orphaned check-ins are attached to the nearest gate within bounds
 * 4. Enforcement cycles learn category bindings per gate (probation, enforced, unbound)
 * 5. Duplicate detection proposes or applies merges of gates that are really one gate
 * 6. Validation answers allow / flag-mismatch / deny-out-of-range from cached gate snapshots
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class GateDiscoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(GateDiscoveryApplication.class, args);
    }
}
