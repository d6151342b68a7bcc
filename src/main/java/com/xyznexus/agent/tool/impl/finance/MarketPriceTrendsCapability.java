package com.xyznexus.agent.tool.impl.finance;

import com.xyznexus.agent.exception.CapabilityException;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.tool.Capability;
import com.xyznexus.agent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Commodity price trend. Crude in USD/bbl, natural gas in USD/MMBTU.
 */
@Component
public class MarketPriceTrendsCapability implements Capability {

    static final Map<String, Double> BASE_PRICES = Map.of(
            "crude_oil", 85.0,
            "natural_gas", 3.2
    );

    private static final List<String> VOLATILITY = List.of("low", "moderate", "high");
    private static final List<String> OUTLOOKS = List.of(
            "Prices expected to stabilize",
            "Potential upward pressure from demand",
            "Risk of correction due to oversupply");

    @Override
    public Specialist getSpecialist() {
        return Specialist.FINANCE;
    }

    @Override
    public String getName() {
        return "get_market_price_trends";
    }

    @Override
    public String getDescription() {
        return "Price trend for an energy commodity ('crude_oil' or 'natural_gas') over the last days: "
                + "current price, historical price, change percentage, trend and outlook.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "commodity", Map.of(
                                "type", "string",
                                "enum", List.of("crude_oil", "natural_gas"),
                                "description", "Commodity. Default: crude_oil"
                        ),
                        "days_back", Map.of(
                                "type", "integer",
                                "description", "History window in days. Default: 30",
                                "default", 30
                        )
                ),
                "required", List.of()
        );
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        String commodity = ToolArguments.optionalString(arguments, "commodity", "crude_oil")
                .toLowerCase(Locale.ROOT);
        int daysBack = ToolArguments.optionalInt(arguments, "days_back", 30);

        Double currentPrice = BASE_PRICES.get(commodity);
        if (currentPrice == null) {
            throw new CapabilityException("Unsupported commodity '" + commodity
                    + "'. Supported: " + BASE_PRICES.keySet());
        }
        if (daysBack < 1) {
            throw new CapabilityException("'days_back' must be at least 1");
        }

        ThreadLocalRandom random = ThreadLocalRandom.current();
        double pastPrice = currentPrice * random.nextDouble(0.90, 1.05);
        double changePct = (currentPrice - pastPrice) / pastPrice * 100;

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("commodity", commodity);
        result.put("days_back", daysBack);
        result.put("current_price_usd", Money.round(currentPrice));
        result.put("price_" + daysBack + "_days_ago_usd", Money.round(pastPrice));
        result.put("price_change_percentage", Money.round(changePct));
        result.put("trend", currentPrice > pastPrice ? "upward" : "downward");
        result.put("volatility", VOLATILITY.get(random.nextInt(VOLATILITY.size())));
        result.put("forecast_outlook", OUTLOOKS.get(random.nextInt(OUTLOOKS.size())));
        result.put("data_source", "Mock Market Data");
        result.put("last_updated", LocalDateTime.now().toString());
        return result;
    }
}
