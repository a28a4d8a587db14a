/*
 * どこで: Smart-Proxy サービス層
 * 何を: authorize/callback/token 各レッグの結果とデコード失敗、IdP token 呼び出し時間を記録する
 * なぜ: IdP 障害や不正な state/code の増加を Prometheus から直接観測できるようにするため
 */
package com.example.smart_proxy.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SmartProxyMetrics {

  private static final String METRIC_AUTHORIZE_TOTAL = "smart.proxy.authorize.total";
  private static final String METRIC_CALLBACK_TOTAL = "smart.proxy.callback.total";
  private static final String METRIC_TOKEN_TOTAL = "smart.proxy.token.total";
  private static final String METRIC_ERROR_TOTAL = "smart.proxy.error.total";
  private static final String METRIC_IDP_TOKEN_DURATION = "smart.proxy.idp.token.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> authorizeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> callbackCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> tokenCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> idpTokenTimers = new ConcurrentHashMap<>();

  public SmartProxyMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordAuthorize(String idpVersion) {
    authorizeCounters
        .computeIfAbsent(
            idpVersion,
            ignored ->
                Counter.builder(METRIC_AUTHORIZE_TOTAL)
                    .description("Authorize redirects issued to the IdP")
                    .tags(Tags.of("idp_version", idpVersion))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCallback(String result) {
    callbackCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CALLBACK_TOTAL)
                    .description("IdP callbacks redirected to the client")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordToken(String grant, String result) {
    final String key = grant + "|" + result;
    tokenCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_TOKEN_TOTAL)
                    .description("Token requests by grant handling and IdP outcome")
                    .tags(Tags.of("grant", grant, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordError(String code) {
    errorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_ERROR_TOTAL)
                    .description("Proxy request failures by error code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }

  public void recordIdpTokenDuration(String result, Duration duration) {
    idpTokenTimers
        .computeIfAbsent(
            result,
            ignored ->
                Timer.builder(METRIC_IDP_TOKEN_DURATION)
                    .description("IdP token endpoint call duration")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .record(duration);
  }
}
