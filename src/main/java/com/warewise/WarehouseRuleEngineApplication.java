package com.warewise;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Warehouse Rule Engine Application.
 *
 * Location intelligence and anomaly detection over inventory snapshots. Service layers embed
 * the engine and call {@link com.warewise.service.InventoryAnalysisOrchestrator}.
 */
@SpringBootApplication
public class WarehouseRuleEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(WarehouseRuleEngineApplication.class, args);
    }
}
