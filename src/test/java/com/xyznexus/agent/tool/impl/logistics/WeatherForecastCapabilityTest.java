package com.xyznexus.agent.tool.impl.logistics;

import com.xyznexus.agent.exception.CapabilityException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeatherForecastCapabilityTest {

    private final WeatherForecastCapability capability = new WeatherForecastCapability();

    @Test
    void riskLevel_thresholds() {
        assertThat(WeatherForecastCapability.riskLevel(3.6, 10)).isEqualTo("high");
        assertThat(WeatherForecastCapability.riskLevel(1.0, 31)).isEqualTo("high");
        assertThat(WeatherForecastCapability.riskLevel(2.1, 10)).isEqualTo("moderate");
        assertThat(WeatherForecastCapability.riskLevel(1.0, 21)).isEqualTo("moderate");
        assertThat(WeatherForecastCapability.riskLevel(2.0, 20)).isEqualTo("low");
    }

    @Test
    void invoke_returnsForecastForHorizon() {
        Map<String, Object> result = capability.invoke(Map.of("location", "Selat Sunda"));

        assertThat(result).containsEntry("location", "Selat Sunda").containsEntry("forecast_period_hours", 24);
        assertThat(result.get("risk_level")).isIn("low", "moderate", "high");
    }

    @Test
    void invoke_horizonOutOfRange_throws() {
        assertThatThrownBy(() -> capability.invoke(Map.of("location", "Selat Sunda", "hours_ahead", 500)))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("hours_ahead");
    }
}
