package com.example.smart_proxy.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DecodeResultTest {

  @Test
  void resolveReturnsValueWhenPresent() {
    final String value =
        DecodeResult.present("v").resolve(() -> "fallback", r -> new IllegalStateException());

    assertThat(value).isEqualTo("v");
  }

  @Test
  void resolveUsesFallbackWhenAbsent() {
    final String value =
        DecodeResult.<String>absent().resolve(() -> "fallback", r -> new IllegalStateException());

    assertThat(value).isEqualTo("fallback");
  }

  @Test
  void resolveThrowsMappedExceptionWhenMalformed() {
    final DecodeResult<String> result = DecodeResult.malformed("bad json");

    assertThatThrownBy(
            () -> result.resolve(() -> "fallback", r -> new IllegalArgumentException(r.reason())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("bad json");
  }

  @Test
  void valueIsUnavailableUnlessPresent() {
    assertThatThrownBy(() -> DecodeResult.absent().value())
        .isInstanceOf(IllegalStateException.class);
    assertThat(DecodeResult.malformed("x").toString()).isEqualTo("MALFORMED(x)");
  }
}
