package com.xyznexus.agent.model;

import java.util.List;
import java.util.Locale;

/**
 * Closed vocabulary returned by the intent router.
 */
public enum RoutingDecision {

    UPSTREAM,
    LOGISTICS,
    FINANCE,
    UPSTREAM_LOGISTICS,
    UPSTREAM_FINANCE,
    LOGISTICS_FINANCE,
    ALL_AGENTS,
    CLARIFY;

    /**
     * Maps raw classifier output to a decision. The text is trimmed and
     * upper-cased, then must equal a label exactly; anything else is CLARIFY.
     */
    public static RoutingDecision parse(String raw) {
        String label = normalize(raw);
        if (label == null) {
            return CLARIFY;
        }
        for (RoutingDecision decision : values()) {
            if (decision.name().equals(label)) {
                return decision;
            }
        }
        return CLARIFY;
    }

    public static boolean isKnownLabel(String raw) {
        String label = normalize(raw);
        if (label == null) {
            return false;
        }
        for (RoutingDecision decision : values()) {
            if (decision.name().equals(label)) {
                return true;
            }
        }
        return false;
    }

    /** Specialists activated by this decision, in precedence order. Empty only for CLARIFY. */
    public List<Specialist> specialists() {
        return switch (this) {
            case UPSTREAM -> List.of(Specialist.UPSTREAM);
            case LOGISTICS -> List.of(Specialist.LOGISTICS);
            case FINANCE -> List.of(Specialist.FINANCE);
            case UPSTREAM_LOGISTICS -> List.of(Specialist.UPSTREAM, Specialist.LOGISTICS);
            case UPSTREAM_FINANCE -> List.of(Specialist.UPSTREAM, Specialist.FINANCE);
            case LOGISTICS_FINANCE -> List.of(Specialist.LOGISTICS, Specialist.FINANCE);
            case ALL_AGENTS -> List.of(Specialist.UPSTREAM, Specialist.LOGISTICS, Specialist.FINANCE);
            case CLARIFY -> List.of();
        };
    }

    public boolean isMultiSpecialist() {
        return specialists().size() > 1;
    }

    private static String normalize(String raw) {
        return raw == null ? null : raw.trim().toUpperCase(Locale.ROOT);
    }
}
