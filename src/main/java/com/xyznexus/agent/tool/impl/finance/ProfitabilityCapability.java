package com.xyznexus.agent.tool.impl.finance;

import com.xyznexus.agent.exception.CapabilityException;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.tool.Capability;
import com.xyznexus.agent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ProfitabilityCapability implements Capability {

    private static final double BREAKEVEN_PRICE_USD = 85.0;

    @Override
    public Specialist getSpecialist() {
        return Specialist.FINANCE;
    }

    @Override
    public String getName() {
        return "calculate_profitability";
    }

    @Override
    public String getDescription() {
        return "Compute gross profit, margin percentage, a profitability assessment and "
                + "the break-even volume from revenue and operating cost in USD.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "revenue_usd", Map.of("type", "number", "description", "Total revenue in USD"),
                        "operating_cost_usd", Map.of("type", "number", "description", "Total operating cost in USD")
                ),
                "required", List.of("revenue_usd", "operating_cost_usd")
        );
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        double revenue = ToolArguments.requireNumber(arguments, "revenue_usd");
        double cost = ToolArguments.requireNumber(arguments, "operating_cost_usd");
        if (revenue < 0 || cost < 0) {
            throw new CapabilityException("'revenue_usd' and 'operating_cost_usd' must not be negative");
        }

        double grossProfit = revenue - cost;
        double margin = revenue > 0 ? grossProfit / revenue * 100 : 0;

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("revenue_usd", Money.round(revenue));
        result.put("operating_cost_usd", Money.round(cost));
        result.put("gross_profit_usd", Money.round(grossProfit));
        result.put("profit_margin_percentage", Money.round(margin));
        result.put("profitability_assessment", assess(margin));
        result.put("breakeven_volume_bopd", Math.round(cost / BREAKEVEN_PRICE_USD));
        result.put("calculation_timestamp", LocalDateTime.now().toString());
        return result;
    }

    static String assess(double marginPercentage) {
        if (marginPercentage > 70) {
            return "Excellent - Highly profitable operation";
        }
        if (marginPercentage > 50) {
            return "Good - Healthy profit margin";
        }
        if (marginPercentage > 30) {
            return "Moderate - Acceptable profitability";
        }
        return "Low - Requires cost optimization";
    }
}
