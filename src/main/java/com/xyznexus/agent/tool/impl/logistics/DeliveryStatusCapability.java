package com.xyznexus.agent.tool.impl.logistics;

import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.tool.Capability;
import com.xyznexus.agent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * End-to-end shipment status from block to refinery.
 */
@Component
public class DeliveryStatusCapability implements Capability {

    private static final List<String> STAGES = List.of(
            "scheduled", "loading", "in_transit", "arrived", "discharged");
    private static final List<String> BLOCKS = List.of("Rokan", "Mahakam", "Cepu");
    private static final List<String> REFINERIES = List.of(
            "Kilang Balongan", "Kilang Cilacap", "Kilang Balikpapan");
    private static final List<String> VESSELS = List.of("MT XYZ Prime", "MT XYZ Excellence");

    @Override
    public Specialist getSpecialist() {
        return Specialist.LOGISTICS;
    }

    @Override
    public String getName() {
        return "get_delivery_status";
    }

    @Override
    public String getDescription() {
        return "Get the status of a shipment (scheduled, loading, in_transit, arrived, discharged) "
                + "with progress, vessel, volume and estimated arrival. Example id: 'SHP-2026-001'.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "shipment_id", Map.of("type", "string", "description", "Unique shipment id")
                ),
                "required", List.of("shipment_id")
        );
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        String shipmentId = ToolArguments.requireString(arguments, "shipment_id");

        ThreadLocalRandom random = ThreadLocalRandom.current();
        String stage = STAGES.get(random.nextInt(STAGES.size()));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("shipment_id", shipmentId);
        result.put("status", stage);
        result.put("progress_percentage", progressOf(stage, random));
        result.put("origin_block", BLOCKS.get(random.nextInt(BLOCKS.size())));
        result.put("destination_refinery", REFINERIES.get(random.nextInt(REFINERIES.size())));
        result.put("vessel_assigned", VESSELS.get(random.nextInt(VESSELS.size())));
        result.put("volume_barrels", random.nextInt(450_000, 550_001));
        result.put("departure_date", LocalDate.now().minusDays(random.nextInt(1, 6)).toString());
        result.put("estimated_arrival", LocalDateTime.now().plusHours(random.nextInt(6, 49)).toString());
        result.put("last_updated", LocalDateTime.now().toString());
        return result;
    }

    private static int progressOf(String stage, ThreadLocalRandom random) {
        return switch (stage) {
            case "scheduled" -> 0;
            case "loading" -> 20;
            case "in_transit" -> random.nextInt(30, 81);
            case "arrived" -> 90;
            default -> 100;
        };
    }
}
