/*
 * どこで: Smart-Proxy サービス層
 * 何を: scope を aud 付きの修飾形式と短縮形式の間で変換する
 * なぜ: v2 IdP は '/' を含む非修飾 scope を受け付けず、クライアントとリソースサーバーは短縮形式を期待するため
 */
package com.example.smart_proxy.service;

import com.example.smart_proxy.config.SmartProxyProperties;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Set;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

@Component
public class ScopeTranslator {

  private final Set<String> wellKnownScopes;

  public ScopeTranslator(SmartProxyProperties properties) {
    this.wellKnownScopes = Set.copyOf(properties.wellKnownScopes());
  }

  /**
   * Qualifies every non-well-known scope as {@code {aud}/{scope with '/' replaced by '$'}}.
   *
   * <p>{@code qualify("https://fhir.example", "openid patient/Patient.read")} yields {@code openid
   * https://fhir.example/patient$Patient.read}.
   */
  public String qualify(String audience, String scope) {
    final String prefix =
        audience.endsWith("/") ? audience.substring(0, audience.length() - 1) : audience;
    final StringJoiner joiner = new StringJoiner(" ");
    for (String token : scope.split(" ")) {
      if (token.isEmpty()) {
        continue;
      }
      if (wellKnownScopes.contains(token)) {
        joiner.add(token);
      } else {
        joiner.add(prefix + "/" + token.replace('/', '$'));
      }
    }
    return joiner.toString();
  }

  /** Reverses {@link #qualify}: absolute URLs lose everything but their last path segment. */
  public String unqualify(String scope) {
    final StringJoiner joiner = new StringJoiner(" ");
    for (String token : scope.split(" ")) {
      if (token.isEmpty()) {
        continue;
      }
      joiner.add(lastPathSegment(token).replace('$', '/'));
    }
    return joiner.toString();
  }

  public boolean isWellKnown(String scope) {
    return wellKnownScopes.contains(scope);
  }

  private static String lastPathSegment(String token) {
    final URI uri;
    try {
      uri = new URI(token);
    } catch (URISyntaxException ex) {
      return token;
    }
    if (!uri.isAbsolute() || uri.isOpaque()) {
      return token;
    }
    final String path = uri.getRawPath();
    if (path == null || path.isEmpty() || path.equals("/")) {
      return token;
    }
    final String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    return trimmed.substring(trimmed.lastIndexOf('/') + 1);
  }
}
