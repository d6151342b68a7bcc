package com.xyznexus.agent.tool.impl.upstream;

import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.tool.Capability;
import com.xyznexus.agent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

@Component
public class WellStatusCapability implements Capability {

    private static final int DEFAULT_WELL_COUNT = 5;
    // weighted towards producing
    private static final List<String> STATUSES = List.of(
            "producing", "producing", "producing", "maintenance", "shut-in");

    @Override
    public Specialist getSpecialist() {
        return Specialist.UPSTREAM;
    }

    @Override
    public String getName() {
        return "get_well_status";
    }

    @Override
    public String getDescription() {
        return "Get operational status of wells in a block (producing, maintenance, shut-in). "
                + "Pass well_ids to query specific wells, otherwise the first wells of the block are returned.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "block_name", Map.of("type", "string", "description", "Block name"),
                        "well_ids", Map.of(
                                "type", "array",
                                "items", Map.of("type", "string"),
                                "description", "Optional well ids, e.g. ['RKN-001', 'RKN-002']"
                        )
                ),
                "required", List.of("block_name")
        );
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        String block = ToolArguments.requireString(arguments, "block_name");
        List<String> wellIds = ToolArguments.optionalStringList(arguments, "well_ids");
        if (wellIds.isEmpty()) {
            wellIds = defaultWellIds(block);
        }

        ThreadLocalRandom random = ThreadLocalRandom.current();
        List<Map<String, Object>> wells = new ArrayList<>();
        for (String wellId : wellIds) {
            String status = STATUSES.get(random.nextInt(STATUSES.size()));
            Map<String, Object> well = new LinkedHashMap<>();
            well.put("id", wellId);
            well.put("status", status);
            if ("producing".equals(status)) {
                well.put("production_bopd", random.nextInt(80, 201));
            } else if ("maintenance".equals(status)) {
                well.put("downtime_hours", random.nextInt(24, 121));
                well.put("expected_restart", LocalDateTime.now().plusHours(random.nextInt(12, 73)).toString());
            }
            wells.add(well);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("block", block);
        result.put("total_wells_queried", wells.size());
        result.put("wells", wells);
        result.put("query_timestamp", LocalDateTime.now().toString());
        return result;
    }

    static List<String> defaultWellIds(String block) {
        String prefix = block.substring(0, Math.min(3, block.length())).toUpperCase(Locale.ROOT);
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= DEFAULT_WELL_COUNT; i++) {
            ids.add(String.format("%s-%03d", prefix, i));
        }
        return ids;
    }
}
