package com.xyznexus.agent.tool.impl.logistics;

import com.xyznexus.agent.exception.CapabilityException;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.tool.Capability;
import com.xyznexus.agent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

@Component
public class WeatherForecastCapability implements Capability {

    private static final int MAX_HOURS_AHEAD = 240;

    @Override
    public Specialist getSpecialist() {
        return Specialist.LOGISTICS;
    }

    @Override
    public String getName() {
        return "get_weather_forecast";
    }

    @Override
    public String getDescription() {
        return "Marine weather forecast for a shipping lane or strait: wave height, wind speed, "
                + "visibility, risk level (low/moderate/high) and navigation advice.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "location", Map.of("type", "string", "description", "Location, e.g. 'Selat Sunda'"),
                        "hours_ahead", Map.of(
                                "type", "integer",
                                "description", "Forecast horizon in hours. Default: 24",
                                "default", 24
                        )
                ),
                "required", List.of("location")
        );
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        String location = ToolArguments.requireString(arguments, "location");
        int hoursAhead = ToolArguments.optionalInt(arguments, "hours_ahead", 24);
        if (hoursAhead < 1 || hoursAhead > MAX_HOURS_AHEAD) {
            throw new CapabilityException("'hours_ahead' must be between 1 and " + MAX_HOURS_AHEAD);
        }

        ThreadLocalRandom random = ThreadLocalRandom.current();
        double waveHeight = random.nextDouble(0.5, 4.5);
        double windSpeed = random.nextDouble(8, 35);
        String riskLevel = riskLevel(waveHeight, windSpeed);

        LocalDateTime now = LocalDateTime.now();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("location", location);
        result.put("forecast_period_hours", hoursAhead);
        result.put("wave_height_meters", Math.round(waveHeight * 10) / 10.0);
        result.put("wind_speed_knots", Math.round(windSpeed * 10) / 10.0);
        result.put("visibility_km", random.nextInt(5, 21));
        result.put("risk_level", riskLevel);
        result.put("navigation_advice", navigationAdvice(riskLevel));
        result.put("forecast_timestamp", now.toString());
        result.put("valid_until", now.plusHours(hoursAhead).toString());
        return result;
    }

    static String riskLevel(double waveHeightMeters, double windSpeedKnots) {
        if (waveHeightMeters > 3.5 || windSpeedKnots > 30) {
            return "high";
        }
        if (waveHeightMeters > 2.0 || windSpeedKnots > 20) {
            return "moderate";
        }
        return "low";
    }

    private static String navigationAdvice(String riskLevel) {
        return switch (riskLevel) {
            case "high" -> "Consider delaying departure. High waves and strong winds.";
            case "moderate" -> "Proceed with caution. Expect speed reduction.";
            default -> "Normal sailing conditions.";
        };
    }
}
