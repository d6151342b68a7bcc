package com.xyznexus.agent.tool.impl.logistics;

import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.tool.Capability;
import com.xyznexus.agent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Position, speed, route and ETA of a tanker.
 */
@Component
public class VesselTrackingCapability implements Capability {

    private static final int BASE_SPEED_KNOTS = 14;
    // mostly on schedule, sometimes slowed by weather
    private static final List<Integer> WEATHER_IMPACT_KNOTS = List.of(0, 0, -2, -4, -6);

    record Route(String origin, String destination, String currentLocation, double latitude, double longitude) {}

    static final Map<String, Route> ROUTES = Map.of(
            "MT XYZ Prime", new Route("Dumai Terminal", "Kilang Balongan", "Selat Sunda", -6.123, 106.456),
            "MT XYZ Excellence", new Route("Balikpapan Terminal", "Kilang Cilacap", "Selat Makassar", -3.456, 118.789)
    );

    private static final Route UNKNOWN_ROUTE = new Route("Unknown", "Unknown", "Unknown", 0, 0);

    @Override
    public Specialist getSpecialist() {
        return Specialist.LOGISTICS;
    }

    @Override
    public String getName() {
        return "track_vessel";
    }

    @Override
    public String getDescription() {
        return "Track a tanker in real time: coordinates, speed in knots, origin, destination, "
                + "cargo volume and ETA in hours. Example vessel: 'MT XYZ Prime'.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "vessel_name", Map.of("type", "string", "description", "Vessel name, e.g. 'MT XYZ Prime'")
                ),
                "required", List.of("vessel_name")
        );
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        String vessel = ToolArguments.requireString(arguments, "vessel_name");
        Route route = ROUTES.getOrDefault(vessel, UNKNOWN_ROUTE);

        ThreadLocalRandom random = ThreadLocalRandom.current();
        int weatherImpact = WEATHER_IMPACT_KNOTS.get(random.nextInt(WEATHER_IMPACT_KNOTS.size()));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("vessel_name", vessel);
        result.put("origin", route.origin());
        result.put("destination", route.destination());
        result.put("current_location", route.currentLocation());
        result.put("current_position", Map.of("latitude", route.latitude(), "longitude", route.longitude()));
        result.put("speed_knots", BASE_SPEED_KNOTS + weatherImpact);
        result.put("status", weatherImpact >= -2 ? "on_schedule" : "delayed");
        result.put("cargo_volume_barrels", random.nextInt(450_000, 550_001));
        result.put("eta_hours", random.nextInt(12, 31));
        result.put("timestamp", LocalDateTime.now().toString());
        return result;
    }
}
