package com.xyznexus.agent.tool.impl.finance;

import com.xyznexus.agent.exception.CapabilityException;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.tool.Capability;
import com.xyznexus.agent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Revenue of a crude volume in USD and IDR.
 */
@Component
public class RevenueImpactCapability implements Capability {

    static final double DEFAULT_PRICE_USD = 85.0;
    static final int USD_TO_IDR = 15_800;

    @Override
    public Specialist getSpecialist() {
        return Specialist.FINANCE;
    }

    @Override
    public String getName() {
        return "calculate_revenue_impact";
    }

    @Override
    public String getDescription() {
        return "Calculate revenue of an oil volume in USD and IDR. "
                + "Price defaults to the $85/bbl Indonesian Crude Price estimate.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "oil_volume_barrels", Map.of("type", "integer", "description", "Oil volume in barrels"),
                        "oil_price_usd", Map.of(
                                "type", "number",
                                "description", "Price per barrel in USD. Default: 85.0",
                                "default", DEFAULT_PRICE_USD
                        )
                ),
                "required", List.of("oil_volume_barrels")
        );
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        long volume = Math.round(ToolArguments.requireNumber(arguments, "oil_volume_barrels"));
        double price = ToolArguments.optionalNumber(arguments, "oil_price_usd", DEFAULT_PRICE_USD);
        if (volume < 0) {
            throw new CapabilityException("'oil_volume_barrels' must not be negative");
        }
        if (price <= 0) {
            throw new CapabilityException("'oil_price_usd' must be positive");
        }

        double revenueUsd = volume * price;

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("volume_barrels", volume);
        result.put("price_per_barrel_usd", price);
        result.put("total_revenue_usd", Money.round(revenueUsd));
        result.put("total_revenue_idr", Money.round(revenueUsd * USD_TO_IDR));
        result.put("exchange_rate", USD_TO_IDR);
        result.put("calculation_date", LocalDate.now().toString());
        result.put("price_benchmark", "Indonesian Crude Price (ICP)");
        return result;
    }
}
