package com.xyznexus.agent.tool.impl.finance;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OperationalCostCapabilityTest {

    private final OperationalCostCapability capability = new OperationalCostCapability();

    @Test
    @SuppressWarnings("unchecked")
    void invoke_knownBlock_usesBlockOpexAndSplitsCost() {
        Map<String, Object> result = capability.invoke(Map.of("block_name", "Rokan", "production_volume_bopd", 100_000));

        assertThat(result)
                .containsEntry("operating_cost_per_barrel_usd", 22.5)
                .containsEntry("total_daily_cost_usd", 2_250_000.0);
        assertThat((Map<String, Object>) result.get("cost_breakdown"))
                .containsEntry("labor_usd", 787_500.0)
                .containsEntry("maintenance_usd", 562_500.0)
                .containsEntry("energy_usd", 450_000.0)
                .containsEntry("other_usd", 450_000.0);
    }

    @Test
    void invoke_unknownBlock_defaultOpex() {
        Map<String, Object> result = capability.invoke(Map.of("block_name", "Natuna", "production_volume_bopd", 10));

        assertThat(result).containsEntry("operating_cost_per_barrel_usd", 25.0);
    }
}
