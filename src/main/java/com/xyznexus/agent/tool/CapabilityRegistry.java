package com.xyznexus.agent.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xyznexus.agent.exception.CapabilityException;
import com.xyznexus.agent.model.Specialist;
import com.xyznexus.agent.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each specialist to its named capabilities.
 *
 * Spring injects every {@link Capability} bean; they are indexed per specialist
 * at construction and read-only afterwards, so concurrent loops can share it.
 *
 * {@link #invoke} never throws: unknown names, malformed or missing arguments
 * and capability failures all come back as error results.
 */
@Component
@Slf4j
public class CapabilityRegistry {

    private final Map<Specialist, Map<String, Capability>> capabilities;
    private final ObjectMapper objectMapper;

    public CapabilityRegistry(List<Capability> capabilityBeans, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;

        Map<Specialist, Map<String, Capability>> index = new EnumMap<>(Specialist.class);
        for (Specialist specialist : Specialist.values()) {
            index.put(specialist, new LinkedHashMap<>());
        }
        capabilityBeans.forEach(capability -> {
            Capability previous = index.get(capability.getSpecialist()).put(capability.getName(), capability);
            if (previous != null) {
                throw new IllegalStateException("Duplicate capability name '" + capability.getName()
                        + "' for specialist " + capability.getSpecialist().id());
            }
            log.info("Registered capability: [{}/{}]", capability.getSpecialist().id(), capability.getName());
        });
        index.replaceAll((specialist, byName) -> Collections.unmodifiableMap(byName));
        this.capabilities = Collections.unmodifiableMap(index);

        log.info("Total capabilities registered: {}", capabilityBeans.size());
    }

    public List<ToolDefinition> definitionsFor(Specialist specialist) {
        return capabilities.get(specialist).values().stream()
                .map(ToolDefinition::from)
                .toList();
    }

    public List<String> capabilityNames(Specialist specialist) {
        return List.copyOf(capabilities.get(specialist).keySet());
    }

    /**
     * Dispatches one capability invocation on behalf of a specialist.
     * Capabilities belonging to other specialists are treated as unknown.
     */
    public CapabilityResult invoke(Specialist specialist, ToolCall call) {
        Capability capability = capabilities.get(specialist).get(call.getToolName());

        if (capability == null) {
            String msg = String.format("Unknown capability '%s'. Available capabilities: %s",
                    call.getToolName(), capabilities.get(specialist).keySet());
            log.warn("[{}] {}", specialist.id(), msg);
            return CapabilityResult.failure(call, msg);
        }

        if (call.getArgumentError() != null) {
            log.warn("[{}] Rejecting call to '{}': {}", specialist.id(), call.getToolName(), call.getArgumentError());
            return CapabilityResult.failure(call, call.getArgumentError());
        }

        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();
        String missing = firstMissingRequired(capability, arguments);
        if (missing != null) {
            return CapabilityResult.failure(call,
                    "Missing required argument '" + missing + "' for '" + call.getToolName() + "'");
        }

        log.info("Invoking capability: [{}/{}] with args: {}", specialist.id(), call.getToolName(), arguments);

        long start = System.currentTimeMillis();
        try {
            Map<String, Object> result = capability.invoke(arguments);
            String json = objectMapper.writeValueAsString(result);
            long latency = System.currentTimeMillis() - start;
            log.debug("Capability [{}] returned in {}ms: {}", call.getToolName(), latency, json);
            return CapabilityResult.success(call, json, latency);
        } catch (CapabilityException e) {
            log.warn("Capability [{}] failed: {}", call.getToolName(), e.getMessage());
            return CapabilityResult.failure(call, e.getMessage(), System.currentTimeMillis() - start);
        } catch (JsonProcessingException e) {
            log.error("Capability [{}] returned an unserializable result", call.getToolName(), e);
            return CapabilityResult.failure(call, "Result could not be serialized",
                    System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.error("Unexpected error in capability [{}]", call.getToolName(), e);
            return CapabilityResult.failure(call, "Capability execution failed: " + e.getMessage(),
                    System.currentTimeMillis() - start);
        }
    }

    @SuppressWarnings("unchecked")
    private String firstMissingRequired(Capability capability, Map<String, Object> arguments) {
        Object required = capability.getInputSchema().get("required");
        if (!(required instanceof List<?> names)) {
            return null;
        }
        for (Object name : (List<Object>) names) {
            Object value = arguments.get(name.toString());
            if (value == null || (value instanceof String s && s.isBlank())) {
                return name.toString();
            }
        }
        return null;
    }
}
