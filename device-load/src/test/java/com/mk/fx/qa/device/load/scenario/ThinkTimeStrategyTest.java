package com.mk.fx.qa.device.load.scenario;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mk.fx.qa.device.load.dto.scenario.ThinkTimeConfig;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ThinkTimeStrategyTest {

  @Test
  void from_nullConfig_isDisabled() {
    var strategy = ThinkTimeStrategy.from(null);

    assertThat(strategy.isEnabled()).isFalse();
    assertThat(strategy.nextDelayMillis()).isZero();
  }

  @Test
  void from_fixedTakesPrecedence() {
    var config = new ThinkTimeConfig();
    config.setFixedMs(250L);
    config.setMinMs(1L);
    config.setMaxMs(2L);

    assertThat(ThinkTimeStrategy.from(config).nextDelayMillis()).isEqualTo(250);
  }

  @Test
  void between_staysWithinBounds() {
    var strategy = ThinkTimeStrategy.between(3_000, 5_000);

    for (int i = 0; i < 500; i++) {
      assertThat(strategy.nextDelayMillis()).isBetween(3_000L, 5_000L);
    }
  }

  @Test
  void from_minOnly_usesMinAsFixedUpperBound() {
    var config = new ThinkTimeConfig();
    config.setMinMs(400L);

    assertThat(ThinkTimeStrategy.from(config).nextDelayMillis()).isEqualTo(400);
  }

  @Test
  void sleep_returnsEarlyWhenStopped() throws Exception {
    var start = System.nanoTime();

    ThinkTimeStrategy.sleep(Duration.ofSeconds(30), () -> true);

    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
  }

  @Test
  void sleep_interruptedThread_throws() {
    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> ThinkTimeStrategy.sleep(Duration.ofSeconds(5), () -> false))
          .isInstanceOf(InterruptedException.class);
    } finally {
      Thread.interrupted();
    }
  }
}
