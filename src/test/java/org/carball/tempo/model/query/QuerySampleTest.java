package org.carball.tempo.model.query;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QuerySampleTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldRejectMissingTimestamp() {
        assertThatThrownBy(() -> QuerySample.miss("select_users", "SELECT * FROM users", 12.0, null, 3L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("timestamp must not be null");
    }

    @Test
    void shouldKeepSuppliedTimestamp() {
        QuerySample sample = QuerySample.hit("select_users", null, 0.4, NOW);

        assertThat(sample.timestamp()).isEqualTo(NOW);
        assertThat(sample.rawQueryText()).isEqualTo("select_users");
        assertThat(sample.cacheHit()).isTrue();
    }

    @Test
    void shouldRejectBlankQueryIdAndNegativeTime() {
        assertThatThrownBy(() -> QuerySample.miss(" ", null, 1.0, NOW, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuerySample.miss("q", null, -1.0, NOW, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-negative");
    }
}
