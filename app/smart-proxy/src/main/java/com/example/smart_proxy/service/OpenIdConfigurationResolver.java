/*
 * どこで: Smart-Proxy サービス層
 * 何を: IdP の openid-configuration から authorize/token エンドポイントと世代(v1/v2)を解決する
 * なぜ: 起動時に一度だけ IdP の構成を確定し、以降のリクエストで再取得しないため
 */
package com.example.smart_proxy.service;

import com.example.smart_proxy.config.ConditionalOnSmartProxyEnabled;
import com.example.smart_proxy.model.IdpMetadata;
import com.example.smart_proxy.service.dto.OpenIdConfigurationDocument;
import java.net.URI;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
@ConditionalOnSmartProxyEnabled
@RequiredArgsConstructor
public class OpenIdConfigurationResolver {

  private static final Logger logger = LoggerFactory.getLogger(OpenIdConfigurationResolver.class);

  static final String WELL_KNOWN_PATH = "/.well-known/openid-configuration";
  private static final String V2_SEGMENT = "v2.0";

  private final RestClient idpRestClient;

  public IdpMetadata resolve(String authority) {
    if (authority == null || authority.isBlank()) {
      throw new OpenIdConfigurationException("authority is required");
    }
    final String base =
        authority.endsWith("/") ? authority.substring(0, authority.length() - 1) : authority;
    final URI authorityUri = toAbsoluteUri(base, "authority");
    final String configurationUrl = base + WELL_KNOWN_PATH;
    final OpenIdConfigurationDocument document = fetch(configurationUrl);

    final URI authorizeEndpoint =
        requireEndpoint(
            document.authorizationEndpoint(), "authorization_endpoint", configurationUrl);
    final URI tokenEndpoint =
        requireEndpoint(document.tokenEndpoint(), "token_endpoint", configurationUrl);
    return new IdpMetadata(authorizeEndpoint, tokenEndpoint, isV2(authorityUri));
  }

  static boolean isV2(URI authority) {
    final String path = authority.getPath();
    if (path == null || path.isEmpty()) {
      return false;
    }
    return Arrays.asList(path.split("/")).contains(V2_SEGMENT);
  }

  private OpenIdConfigurationDocument fetch(String configurationUrl) {
    final OpenIdConfigurationDocument document;
    try {
      document =
          idpRestClient
              .get()
              .uri(toAbsoluteUri(configurationUrl, "openid configuration url"))
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .body(OpenIdConfigurationDocument.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "openid configuration request failed url={} status={}",
          configurationUrl,
          ex.getStatusCode().value());
      throw new OpenIdConfigurationException(
          "openid configuration request failed with status " + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      logger.warn("openid configuration connection failed url={}", configurationUrl, ex);
      throw new OpenIdConfigurationException("openid configuration connection failed", ex);
    } catch (RestClientException ex) {
      logger.warn("openid configuration parse failed url={}", configurationUrl, ex);
      throw new OpenIdConfigurationException("openid configuration parse failed", ex);
    }
    if (document == null) {
      logger.warn("openid configuration returned empty body url={}", configurationUrl);
      throw new OpenIdConfigurationException("openid configuration is empty");
    }
    return document;
  }

  private URI requireEndpoint(String value, String field, String configurationUrl) {
    if (value == null || value.isBlank()) {
      logger.warn("openid configuration has no {} url={}", field, configurationUrl);
      throw new OpenIdConfigurationException(field + " is missing from openid configuration");
    }
    return toAbsoluteUri(value, field);
  }

  private URI toAbsoluteUri(String value, String field) {
    try {
      final URI uri = URI.create(value);
      if (!uri.isAbsolute()) {
        throw new OpenIdConfigurationException(field + " is not an absolute url: " + value);
      }
      return uri;
    } catch (IllegalArgumentException ex) {
      throw new OpenIdConfigurationException(field + " is not a valid url: " + value, ex);
    }
  }
}
