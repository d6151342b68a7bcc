package com.xyznexus.agent.tool.impl.finance;

import com.xyznexus.agent.exception.CapabilityException;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.tool.Capability;
import com.xyznexus.agent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class OperationalCostCapability implements Capability {

    static final double DEFAULT_OPEX_PER_BARREL = 25.0;

    static final Map<String, Double> OPEX_PER_BARREL = Map.of(
            "rokan", 22.5,
            "mahakam", 28.0,
            "cepu", 35.0
    );

    @Override
    public Specialist getSpecialist() {
        return Specialist.FINANCE;
    }

    @Override
    public String getName() {
        return "analyze_operational_cost";
    }

    @Override
    public String getDescription() {
        return "Daily operating cost of a block for a production volume, with a breakdown "
                + "into labor, maintenance, energy and other costs.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "block_name", Map.of("type", "string", "description", "Block name"),
                        "production_volume_bopd", Map.of(
                                "type", "integer",
                                "description", "Production volume in barrels of oil per day"
                        )
                ),
                "required", List.of("block_name", "production_volume_bopd")
        );
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        String block = ToolArguments.requireString(arguments, "block_name");
        long volume = Math.round(ToolArguments.requireNumber(arguments, "production_volume_bopd"));
        if (volume < 0) {
            throw new CapabilityException("'production_volume_bopd' must not be negative");
        }

        double opex = OPEX_PER_BARREL.getOrDefault(block.toLowerCase(Locale.ROOT), DEFAULT_OPEX_PER_BARREL);
        double dailyCost = volume * opex;

        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("labor_usd", Money.round(dailyCost * 0.35));
        breakdown.put("maintenance_usd", Money.round(dailyCost * 0.25));
        breakdown.put("energy_usd", Money.round(dailyCost * 0.20));
        breakdown.put("other_usd", Money.round(dailyCost * 0.20));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("block", block);
        result.put("production_volume_bopd", volume);
        result.put("operating_cost_per_barrel_usd", opex);
        result.put("total_daily_cost_usd", Money.round(dailyCost));
        result.put("cost_breakdown", breakdown);
        result.put("analysis_date", LocalDate.now().toString());
        return result;
    }
}
