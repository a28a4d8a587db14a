/*
 * どこで: Smart-Proxy 設定
 * 何を: IdP authority、client_id、公開パス、launch 項目、well-known scope を保持する
 * なぜ: 環境ごとに IdP や公開 URL を切り替え、起動時に妥当性を検証するため
 */
package com.example.smart_proxy.config;

import jakarta.validation.constraints.AssertTrue;
import java.net.URI;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "smart-proxy")
@Validated
public record SmartProxyProperties(
    boolean enabled,
    String authority,
    String clientId,
    String basePath,
    String publicBaseUrl,
    List<String> launchContextFields,
    List<String> wellKnownScopes) {

  public static final List<String> DEFAULT_LAUNCH_CONTEXT_FIELDS =
      List.of("patient", "encounter", "practitioner", "need_patient_banner", "smart_style_url");
  public static final List<String> DEFAULT_WELL_KNOWN_SCOPES =
      List.of("profile", "openid", "email", "offline_access");

  public SmartProxyProperties {
    authority = authority == null ? "" : stripTrailingSlash(authority.trim());
    clientId = clientId == null || clientId.isBlank() ? null : clientId;
    basePath = basePath == null || basePath.isBlank() ? "/AadProxy" : stripTrailingSlash(basePath);
    publicBaseUrl =
        publicBaseUrl == null || publicBaseUrl.isBlank()
            ? null
            : stripTrailingSlash(publicBaseUrl.trim());
    launchContextFields =
        launchContextFields == null || launchContextFields.isEmpty()
            ? DEFAULT_LAUNCH_CONTEXT_FIELDS
            : List.copyOf(launchContextFields);
    wellKnownScopes =
        wellKnownScopes == null || wellKnownScopes.isEmpty()
            ? DEFAULT_WELL_KNOWN_SCOPES
            : List.copyOf(wellKnownScopes);
  }

  @AssertTrue(message = "smart-proxy.authority must be an absolute URL when the proxy is enabled")
  public boolean isAuthorityValid() {
    if (!enabled) {
      return true;
    }
    return isAbsoluteUrl(authority);
  }

  @AssertTrue(message = "smart-proxy.base-path must start with '/'")
  public boolean isBasePathValid() {
    return basePath.startsWith("/");
  }

  @AssertTrue(message = "smart-proxy.public-base-url must be an absolute URL")
  public boolean isPublicBaseUrlValid() {
    // 未設定ならリクエストのホストから組み立てる。
    return publicBaseUrl == null || isAbsoluteUrl(publicBaseUrl);
  }

  private static boolean isAbsoluteUrl(String value) {
    if (value == null || value.isBlank()) {
      return false;
    }
    try {
      final URI uri = URI.create(value);
      return uri.isAbsolute() && uri.getHost() != null;
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }

  private static String stripTrailingSlash(String value) {
    String result = value;
    while (result.length() > 1 && result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
