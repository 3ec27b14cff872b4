package org.genemeta.datapipeline.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class AggregationOptionsTest {

    @Test
    void missingKeysKeepDefaults() {
        Config options = ConfigFactory.parseString("max-attempts = 5");

        AggregationOptions parsed = AggregationOptions.fromConfig(options);

        assertThat(parsed.maxAttempts()).isEqualTo(5);
        assertThat(parsed.initialBackoffMs()).isEqualTo(100L);
        assertThat(parsed.backoffMultiplier()).isEqualTo(2.0);
        assertThat(parsed.sliceLockTimeoutMs()).isEqualTo(30_000L);
        assertThat(parsed.minCorrelationN()).isEqualTo(4);
    }

    @Test
    void backoffGrowsExponentially() {
        AggregationOptions options = new AggregationOptions(4, 100L, 2.0, 1000L, 4);

        assertThat(options.backoffMillis(1)).isEqualTo(100L);
        assertThat(options.backoffMillis(2)).isEqualTo(200L);
        assertThat(options.backoffMillis(3)).isEqualTo(400L);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new AggregationOptions(0, 100L, 2.0, 1000L, 4))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("max-attempts");
        assertThatThrownBy(() -> new AggregationOptions(3, -1L, 2.0, 1000L, 4))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AggregationOptions(3, 100L, 0.5, 1000L, 4))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AggregationOptions.fromConfig(ConfigFactory.parseString("min-correlation-n = 3")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("min-correlation-n");
    }
}
