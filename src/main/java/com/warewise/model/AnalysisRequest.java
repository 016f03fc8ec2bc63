package com.warewise.model;

import lombok.Builder;

import java.util.List;
import java.util.Locale;

/**
 * Inputs of one analysis run, all supplied in memory by the calling service layer.
 *
 * @param explicitWarehouseId when set, warehouse detection is skipped for the whole run
 */
@Builder
public record AnalysisRequest(
    List<InventoryRecord> inventory,
    List<WarehouseTemplate> templates,
    List<RuleDefinition> rules,
    String explicitWarehouseId,
    CancellationToken cancellationToken
) {

    public AnalysisRequest {
        inventory = inventory == null ? List.of() : List.copyOf(inventory);
        templates = templates == null ? List.of() : List.copyOf(templates);
        rules = rules == null ? List.of() : List.copyOf(rules);
        explicitWarehouseId = explicitWarehouseId == null || explicitWarehouseId.isBlank()
                ? null : explicitWarehouseId.trim().toUpperCase(Locale.ROOT);
        cancellationToken = cancellationToken == null ? CancellationToken.none() : cancellationToken;
    }
}
