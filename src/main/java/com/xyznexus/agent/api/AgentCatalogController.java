package com.xyznexus.agent.api;

import com.xyznexus.agent.model.RoutingDecision;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.specialist.SpecialistCatalog;
import com.xyznexus.agent.specialist.SpecialistProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/health  liveness plus the specialists this instance serves
 * GET /api/v1/agents  specialist catalogue and routing patterns
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AgentCatalogController {

    static final String VERSION = "1.0.0";

    private final SpecialistCatalog catalog;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "version", VERSION,
                "agentsAvailable", Arrays.stream(Specialist.values()).map(Specialist::id).toList(),
                "timestamp", Instant.now().toString()
        ));
    }

    @GetMapping("/agents")
    public ResponseEntity<Map<String, Object>> agents() {
        List<Map<String, Object>> agents = catalog.all().stream()
                .map(this::describe)
                .toList();

        Map<String, Object> routingPatterns = new LinkedHashMap<>();
        routingPatterns.put("singleAgent", Arrays.stream(RoutingDecision.values())
                .filter(d -> d.specialists().size() == 1).toList());
        routingPatterns.put("multiAgent", Arrays.stream(RoutingDecision.values())
                .filter(RoutingDecision::isMultiSpecialist).toList());

        return ResponseEntity.ok(Map.of("agents", agents, "routingPatterns", routingPatterns));
    }

    private Map<String, Object> describe(SpecialistProfile profile) {
        Map<String, Object> agent = new LinkedHashMap<>();
        agent.put("id", profile.getSpecialist().id());
        agent.put("name", profile.getDisplayName());
        agent.put("description", profile.getDescription());
        agent.put("capabilities", profile.getResponsibilities());
        agent.put("tools", profile.getCapabilityNames());
        return agent;
    }
}
