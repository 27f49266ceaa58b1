package org.carball.tempo.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PerformanceProfileTest {

    @Test
    void shouldKeepDefaultsForDefaultProfile() {
        OptimizerConfig config = PerformanceProfile.DEFAULT.buildConfig();

        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(50.0);
        assertThat(config.getDefaultTtlMs()).isEqualTo(300_000L);
        assertThat(config.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldTightenStrictProfile() {
        OptimizerConfig config = PerformanceProfile.STRICT.buildConfig();

        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(40.0);
        assertThat(config.getCriticalRiskThresholdMs()).isEqualTo(80.0);
        assertThat(config.getDefaultTtlMs()).isEqualTo(150_000L);
        assertThat(config.getSubscriptionTtlMs()).isEqualTo(900_000L);
        assertThat(config.getSlowQueryFractionThreshold()).isEqualTo(0.05);
        assertThat(config.getLowCacheHitRatePercent()).isEqualTo(70.0);
    }

    @Test
    void shouldLoosenRelaxedProfile() {
        OptimizerConfig config = PerformanceProfile.RELAXED.buildConfig();

        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(100.0);
        assertThat(config.getMediumRiskThresholdMs()).isEqualTo(50.0);
        assertThat(config.getStaticTtlMs()).isEqualTo(172_800_000L);
        assertThat(config.getSlowQueryFractionThreshold()).isEqualTo(0.20);
        assertThat(config.getLowCacheHitRatePercent()).isEqualTo(40.0);
    }

    @Test
    void shouldFindProfileByNameIgnoringCase() {
        assertThat(PerformanceProfile.fromName("STRICT")).isEqualTo(PerformanceProfile.STRICT);
        assertThat(PerformanceProfile.fromName("relaxed")).isEqualTo(PerformanceProfile.RELAXED);
    }

    @Test
    void shouldListAvailableProfilesInUnknownProfileError() {
        assertThatThrownBy(() -> PerformanceProfile.fromName("turbo"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown performance profile: turbo. Available profiles: default, strict, relaxed");
    }
}
