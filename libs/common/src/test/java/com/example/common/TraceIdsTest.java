package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void newTraceIdIsUuid() {
    final String traceId = TraceIds.newTraceId();
    assertThat(UUID.fromString(traceId).toString()).isEqualTo(traceId);
  }

  @Test
  void orNewTraceIdKeepsCallerValue() {
    assertThat(TraceIds.orNewTraceId(" req-1 ")).isEqualTo("req-1");
  }

  @Test
  void orNewTraceIdGeneratesWhenBlank() {
    assertThat(TraceIds.orNewTraceId(null)).isNotBlank();
    assertThat(TraceIds.orNewTraceId("  ")).isNotBlank().isNotEqualTo("  ");
  }
}
