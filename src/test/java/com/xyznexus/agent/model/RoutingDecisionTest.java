package com.xyznexus.agent.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingDecisionTest {

    @Test
    void parse_trimsAndIgnoresCase() {
        assertThat(RoutingDecision.parse(" upstream_finance\n")).isEqualTo(RoutingDecision.UPSTREAM_FINANCE);
    }

    @Test
    void parse_requiresExactLabel() {
        assertThat(RoutingDecision.parse("UPSTREAM_FINANCE_EXTRA")).isEqualTo(RoutingDecision.CLARIFY);
        assertThat(RoutingDecision.parse("UPSTREAM and FINANCE")).isEqualTo(RoutingDecision.CLARIFY);
        assertThat(RoutingDecision.parse(null)).isEqualTo(RoutingDecision.CLARIFY);
        assertThat(RoutingDecision.isKnownLabel("MAYBE")).isFalse();
        assertThat(RoutingDecision.isKnownLabel("clarify")).isTrue();
    }

    @Test
    void specialists_followPrecedenceOrder() {
        assertThat(RoutingDecision.ALL_AGENTS.specialists())
                .containsExactly(Specialist.UPSTREAM, Specialist.LOGISTICS, Specialist.FINANCE);
        assertThat(RoutingDecision.LOGISTICS_FINANCE.specialists())
                .containsExactly(Specialist.LOGISTICS, Specialist.FINANCE);
        assertThat(RoutingDecision.UPSTREAM_FINANCE.specialists())
                .containsExactly(Specialist.UPSTREAM, Specialist.FINANCE);
    }

    @ParameterizedTest
    @EnumSource(value = RoutingDecision.class, names = "CLARIFY", mode = EnumSource.Mode.EXCLUDE)
    void specialists_nonEmptyAndMatchLabel(RoutingDecision decision) {
        assertThat(decision.specialists()).isNotEmpty();
        for (Specialist specialist : decision.specialists()) {
            if (decision != RoutingDecision.ALL_AGENTS) {
                assertThat(decision.name()).contains(specialist.name());
            }
        }
    }

    @Test
    void clarify_activatesNoSpecialist() {
        assertThat(RoutingDecision.CLARIFY.specialists()).isEmpty();
        assertThat(RoutingDecision.CLARIFY.isMultiSpecialist()).isFalse();
        assertThat(RoutingDecision.UPSTREAM_LOGISTICS.isMultiSpecialist()).isTrue();
    }
}
