package com.xyznexus.agent.tool.impl.upstream;

import com.xyznexus.agent.exception.CapabilityException;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.tool.Capability;
import com.xyznexus.agent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Tanker lifting schedule from a block to refineries and terminals.
 */
@Component
public class LiftingScheduleCapability implements Capability {

    private static final int MAX_DAYS_AHEAD = 90;
    private static final List<String> VESSELS = List.of(
            "MT XYZ Prime", "MT XYZ Excellence", "MT XYZ Victory", "MT XYZ Glory");
    private static final List<String> DESTINATIONS = List.of(
            "Kilang Balongan", "Kilang Cilacap", "Terminal BBM Tanjung Priok");

    @Override
    public Specialist getSpecialist() {
        return Specialist.UPSTREAM;
    }

    @Override
    public String getName() {
        return "get_lifting_schedule";
    }

    @Override
    public String getDescription() {
        return "Get the planned tanker liftings (date, volume in barrels, vessel, destination) "
                + "for a block over the coming days.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "block_name", Map.of("type", "string", "description", "Block name"),
                        "days_ahead", Map.of(
                                "type", "integer",
                                "description", "How many days ahead to look. Default: 7",
                                "default", 7
                        )
                ),
                "required", List.of("block_name")
        );
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        String block = ToolArguments.requireString(arguments, "block_name");
        int daysAhead = ToolArguments.optionalInt(arguments, "days_ahead", 7);
        if (daysAhead < 1 || daysAhead > MAX_DAYS_AHEAD) {
            throw new CapabilityException("'days_ahead' must be between 1 and " + MAX_DAYS_AHEAD);
        }

        ThreadLocalRandom random = ThreadLocalRandom.current();
        LocalDate today = LocalDate.now();
        List<Map<String, Object>> schedule = new ArrayList<>();
        long totalVolume = 0;

        // one lifting every 2-3 days
        int step = random.nextInt(2, 4);
        for (int day = 0; day < daysAhead; day += step) {
            int volume = random.nextInt(400_000, 600_001);
            Map<String, Object> lifting = new LinkedHashMap<>();
            lifting.put("date", today.plusDays(day).toString());
            lifting.put("volume_barrels", volume);
            lifting.put("vessel", VESSELS.get(random.nextInt(VESSELS.size())));
            lifting.put("destination", DESTINATIONS.get(random.nextInt(DESTINATIONS.size())));
            schedule.add(lifting);
            totalVolume += volume;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("block", block);
        result.put("schedule_period_days", daysAhead);
        result.put("schedule", schedule);
        result.put("total_volume_barrels", totalVolume);
        return result;
    }
}
