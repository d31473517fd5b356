package com.mk.fx.qa.device.load.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LoadUtilsTest {

  @ParameterizedTest
  @CsvSource({"250ms, 250", "30s, 30000", "5m, 300000", "1h, 3600000", "90, 90000", "' 2S ', 2000"})
  void parseDuration_supportedUnits(String value, long expectedMillis) {
    assertThat(LoadUtils.parseDuration(value)).isEqualTo(Duration.ofMillis(expectedMillis));
  }

  @Test
  void parseDuration_blank_isZero() {
    assertThat(LoadUtils.parseDuration("  ")).isZero();
    assertThat(LoadUtils.parseDuration(null)).isZero();
  }

  @Test
  void parseDuration_malformed_rejected() {
    assertThatThrownBy(() -> LoadUtils.parseDuration("10d"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> LoadUtils.parseDuration("abc"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> LoadUtils.parseDuration("-5s"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toDuration_null_isZero() {
    assertThat(LoadUtils.toDuration(null)).isZero();
  }
}
