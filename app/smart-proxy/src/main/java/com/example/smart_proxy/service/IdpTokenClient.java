package com.example.smart_proxy.service;

import com.example.smart_proxy.model.TokenResponse;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Posts form bodies to the IdP token endpoint and returns whatever the IdP answered.
 *
 * <p>Non-2xx answers are returned as data, not thrown, so that callers can pass them through
 * verbatim. Only transport failures raise {@link IdpIntegrationException}. Nothing is retried:
 * an authorization code is single-use.
 */
@Service
@RequiredArgsConstructor
public class IdpTokenClient {

  private static final Logger logger = LoggerFactory.getLogger(IdpTokenClient.class);

  private final RestClient idpRestClient;
  private final SmartProxyMetrics metrics;

  public TokenResponse postForm(
      URI tokenEndpoint, MultiValueMap<String, String> form, @Nullable String authorization) {
    final long startedAt = System.nanoTime();
    String result = "failure";
    try {
      final TokenResponse response =
          idpRestClient
              .post()
              .uri(tokenEndpoint)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .accept(MediaType.APPLICATION_JSON)
              .headers(
                  headers -> {
                    if (authorization != null && !authorization.isBlank()) {
                      headers.set(HttpHeaders.AUTHORIZATION, authorization);
                    }
                  })
              .body(form)
              .exchange(
                  (request, clientResponse) ->
                      new TokenResponse(
                          clientResponse.getStatusCode().value(),
                          StreamUtils.copyToString(
                              clientResponse.getBody(), StandardCharsets.UTF_8)));
      result = response.isSuccess() ? "success" : "upstream_error";
      if (!response.isSuccess()) {
        logger.warn("idp token endpoint answered status={}", response.status());
      }
      return response;
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("idp token request timed out");
        throw new IdpIntegrationException(
            IdpIntegrationException.Reason.TIMEOUT, "idp token request timeout", ex);
      }
      logger.warn("idp token request connection failed", ex);
      throw new IdpIntegrationException(
          IdpIntegrationException.Reason.BAD_GATEWAY, "idp token connection failed", ex);
    } finally {
      metrics.recordIdpTokenDuration(result, Duration.ofNanos(System.nanoTime() - startedAt));
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
