package com.xyznexus.agent.specialist;

import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.tool.CapabilityRegistry;
import com.xyznexus.agent.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the profile of every specialist once at start-up. The capability list in
 * each directive is rendered from the registry so prompt and tool binding never drift.
 */
@Component
@Slf4j
public class SpecialistCatalog {

    private static final String UPSTREAM_DIRECTIVE = """
            You are the Upstream Production Specialist for XYZ.

            Your expertise:
            - Oil and gas production data from all XYZ blocks (Rokan, Mahakam, Cepu, etc.)
            - Lifting schedules and tanker operations
            - Well status and operational metrics
            - Production forecasting and capacity analysis

            Important guidelines:
            1. Always provide specific numerical data when available
            2. Include units (BOPD for oil, MMSCFD for gas)
            3. Mention data quality and timestamp
            4. If production seems abnormal, flag it proactively
            5. When asked about multiple blocks, request the tools for all of them at once

            Response format:
            - Start with key findings (production numbers)
            - Provide context (compared to normal operations)
            - Flag any issues or anomalies
            - Be concise but complete
            """;

    private static final String LOGISTICS_DIRECTIVE = """
            You are the Maritime Logistics Specialist for XYZ.

            Your expertise:
            - Real-time vessel tracking and positioning
            - Weather forecasting for Indonesian waters
            - Shipping route optimization and delivery schedules
            - Maritime risk assessment

            Important guidelines:
            1. Always check weather when discussing vessel movements
            2. Provide ETA in hours and specific timestamps
            3. Flag any delays or risks immediately
            4. Include vessel names, current locations and cargo volumes

            Response format:
            - Current vessel status (position, speed, ETA)
            - Weather conditions and impact
            - Any delays or concerns
            - Clear next steps or recommendations

            Always prioritize crew and cargo safety over schedule.
            """;

    private static final String FINANCE_DIRECTIVE = """
            You are the Financial Analysis Specialist for XYZ.

            Your expertise:
            - Revenue impact of oil and gas production
            - Operating cost analysis per production block
            - Profitability, margin and break-even assessment
            - Market price trends

            Important guidelines:
            1. Always provide revenue in both USD and IDR
            2. Include profit margins and break-even points
            3. Consider market price volatility in your analysis
            4. Flag low profitability blocks for cost optimization

            Response format:
            - Key financial metrics (revenue, costs, margins)
            - Profitability assessment (excellent/good/moderate/low)
            - Business implications and recommendations

            Assume the Indonesian Crude Price (ICP) benchmark at ~$85/barrel unless told otherwise.
            """;

    private static final String TOOL_GUIDANCE = """

            If a tool result starts with ERROR, do not repeat the identical call. \
            Correct the arguments, use another tool, or explain the limitation in your answer.
            """;

    private final Map<Specialist, SpecialistProfile> profiles;

    public SpecialistCatalog(CapabilityRegistry registry) {
        Map<Specialist, SpecialistProfile> built = new EnumMap<>(Specialist.class);

        built.put(Specialist.UPSTREAM, profile(registry, Specialist.UPSTREAM, "Upstream Agent",
                "Specialist in oil & gas upstream production data. Handles queries about production "
                        + "volumes, lifting schedules, well status, and field operations.",
                UPSTREAM_DIRECTIVE,
                List.of("Production data retrieval", "Lifting schedule queries", "Well status monitoring")));

        built.put(Specialist.LOGISTICS, profile(registry, Specialist.LOGISTICS, "Logistics Agent",
                "Specialist in maritime logistics. Handles vessel tracking, weather along shipping "
                        + "routes, shipping delays, and delivery status.",
                LOGISTICS_DIRECTIVE,
                List.of("Vessel tracking", "Weather forecasting", "Delivery status tracking")));

        built.put(Specialist.FINANCE, profile(registry, Specialist.FINANCE, "Finance Agent",
                "Specialist in financial analysis. Handles revenue calculations, cost analysis, "
                        + "profitability, and market price trends.",
                FINANCE_DIRECTIVE,
                List.of("Revenue calculation", "Cost analysis", "Profitability assessment")));

        this.profiles = Collections.unmodifiableMap(built);
        log.info("Specialist catalog ready: {}", profiles.keySet());
    }

    public SpecialistProfile profile(Specialist specialist) {
        return profiles.get(specialist);
    }

    public List<SpecialistProfile> all() {
        return List.copyOf(profiles.values());
    }

    private static SpecialistProfile profile(CapabilityRegistry registry,
                                             Specialist specialist,
                                             String displayName,
                                             String description,
                                             String directive,
                                             List<String> responsibilities) {
        List<ToolDefinition> tools = registry.definitionsFor(specialist);
        String toolList = tools.stream()
                .map(t -> "- " + t.getName() + ": " + t.getDescription().strip().replace('\n', ' '))
                .collect(Collectors.joining("\n"));

        String fullDirective = directive
                + (toolList.isEmpty() ? "" : "\nTools available:\n" + toolList + "\n")
                + TOOL_GUIDANCE;

        return SpecialistProfile.builder()
                .specialist(specialist)
                .displayName(displayName)
                .description(description)
                .directive(fullDirective)
                .responsibilities(responsibilities)
                .capabilityNames(tools.stream().map(ToolDefinition::getName).toList())
                .build();
    }
}
