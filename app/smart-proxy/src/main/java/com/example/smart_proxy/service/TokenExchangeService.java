/*
 * どこで: Smart-Proxy サービス層
 * 何を: compound code を実 code に戻して IdP と token 交換し、応答へ launch context を差し込む
 * なぜ: launch を知らない IdP の token 応答を SMART クライアントが期待する形へ揃えるため
 */
package com.example.smart_proxy.service;

import static com.example.smart_proxy.service.ProxyRequests.requireAbsoluteUri;
import static com.example.smart_proxy.service.ProxyRequests.requireText;

import com.example.smart_proxy.codec.CompoundCodec;
import com.example.smart_proxy.config.ConditionalOnSmartProxyEnabled;
import com.example.smart_proxy.config.SmartProxyProperties;
import com.example.smart_proxy.model.CompoundCode;
import com.example.smart_proxy.model.IdpMetadata;
import com.example.smart_proxy.model.LaunchContext;
import com.example.smart_proxy.model.TokenResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

@Service
@ConditionalOnSmartProxyEnabled
@RequiredArgsConstructor
public class TokenExchangeService {

  private static final Logger logger = LoggerFactory.getLogger(TokenExchangeService.class);

  static final String AUTHORIZATION_CODE = "authorization_code";

  private final IdpMetadata idpMetadata;
  private final CompoundCodec codec;
  private final ScopeTranslator scopeTranslator;
  private final ProxyCallbackUrlFactory callbackUrlFactory;
  private final IdpTokenClient idpTokenClient;
  private final SmartProxyProperties properties;
  private final ObjectMapper objectMapper;
  private final SmartProxyMetrics metrics;

  public TokenResponse exchange(
      MultiValueMap<String, String> form, @Nullable String authorization, String requestBaseUrl) {
    final String grantType = requireText(form.getFirst("grant_type"), "grant_type");
    requireText(form.getFirst("client_id"), "client_id");

    if (!AUTHORIZATION_CODE.equals(grantType)) {
      return passThrough(form, authorization);
    }
    return exchangeAuthorizationCode(form, authorization, requestBaseUrl);
  }

  private TokenResponse passThrough(
      MultiValueMap<String, String> form, @Nullable String authorization) {
    // TODO: v2 IdP で aud を resource/scope へ変換するか未決定。現状はフォームを素通しする。
    final TokenResponse response =
        idpTokenClient.postForm(idpMetadata.tokenEndpoint(), form, authorization);
    metrics.recordToken("passthrough", outcome(response));
    return response;
  }

  private TokenResponse exchangeAuthorizationCode(
      MultiValueMap<String, String> form, @Nullable String authorization, String requestBaseUrl) {
    final String clientId = form.getFirst("client_id");
    final String encodedCode = requireText(form.getFirst("code"), "code");
    final String redirectUri = form.getFirst("redirect_uri");
    requireAbsoluteUri(redirectUri, "redirect_uri");

    final CompoundCode compoundCode =
        codec
            .decodeCode(encodedCode)
            .resolve(
                () -> {
                  throw new MissingParameterException("code");
                },
                result -> {
                  logger.error(
                      "failed to decode compound code: {}", result.reason(), result.cause());
                  return CompoundDecodeException.from(CompoundDecodeException.Kind.CODE, result);
                });

    final MultiValueMap<String, String> exchangeForm = new LinkedMultiValueMap<>();
    exchangeForm.add("grant_type", AUTHORIZATION_CODE);
    exchangeForm.add("code", compoundCode.code());
    exchangeForm.add("redirect_uri", callbackUrlFactory.callbackUrl(requestBaseUrl, redirectUri));
    exchangeForm.add("client_id", clientId);
    final String clientSecret = form.getFirst("client_secret");
    if (clientSecret != null) {
      exchangeForm.add("client_secret", clientSecret);
    }

    final TokenResponse response =
        idpTokenClient.postForm(idpMetadata.tokenEndpoint(), exchangeForm, authorization);
    metrics.recordToken(AUTHORIZATION_CODE, outcome(response));
    if (!response.isSuccess()) {
      return response;
    }
    return new TokenResponse(
        response.status(), rewrite(response.body(), compoundCode.launchContext(), clientId));
  }

  private String rewrite(String body, LaunchContext launchContext, String requestClientId) {
    final ObjectNode token = parseTokenObject(body);
    for (String field : properties.launchContextFields()) {
      if (!token.has(field)) {
        launchContext.get(field).ifPresent(value -> token.set(field, value));
      }
    }
    token.put(
        "client_id", properties.clientId() != null ? properties.clientId() : requestClientId);
    final JsonNode scope = token.get("scope");
    if (scope != null && scope.isTextual()) {
      token.put("scope", scopeTranslator.unqualify(scope.asText()));
    }
    try {
      return objectMapper.writeValueAsString(token);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize token response", ex);
    }
  }

  private ObjectNode parseTokenObject(String body) {
    final JsonNode node;
    try {
      node = objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      logger.warn("idp token response parse failed", ex);
      throw new IdpIntegrationException(
          IdpIntegrationException.Reason.INVALID_RESPONSE, "idp token response is not json", ex);
    }
    if (node == null || !node.isObject()) {
      logger.warn("idp token response is not a json object");
      throw new IdpIntegrationException(
          IdpIntegrationException.Reason.INVALID_RESPONSE, "idp token response is not an object");
    }
    return (ObjectNode) node;
  }

  private static String outcome(TokenResponse response) {
    return response.isSuccess() ? "success" : "upstream_error";
  }
}
