package org.carball.tempo.cache;

import org.carball.tempo.config.OptimizerConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class CacheTtlPolicyTest {

    private final CacheTtlPolicy policy = new CacheTtlPolicy(OptimizerConfig.defaults());

    @Test
    void shouldPreferExplicitTtl() {
        assertThat(policy.ttlFor("select_static_pages", 42L)).isEqualTo(42L);
    }

    @Test
    void shouldChooseTtlByQueryIdMarker() {
        assertThat(policy.ttlFor("select_user_profile")).isEqualTo(300_000L);
        assertThat(policy.ttlFor("select_static_pages")).isEqualTo(86_400_000L);
        assertThat(policy.ttlFor("select_api_keys")).isEqualTo(600_000L);
        assertThat(policy.ttlFor("select_content_feed")).isEqualTo(300_000L);
        assertThat(policy.ttlFor("count_subscription_tiers")).isEqualTo(1_800_000L);
        assertThat(policy.ttlFor("select_orders")).isEqualTo(300_000L);
    }

    @Test
    void shouldApplyFirstMatchingMarker() {
        // "user" is checked before "subscription"
        assertThat(policy.ttlFor("select_user_subscription")).isEqualTo(300_000L);
        // "static" is checked before "content"
        assertThat(policy.ttlFor("select_static_content")).isEqualTo(86_400_000L);
    }

    @Test
    void shouldMatchMarkersIgnoringCase() {
        assertThat(policy.ttlFor("SelectStaticBanner")).isEqualTo(86_400_000L);
    }
}
