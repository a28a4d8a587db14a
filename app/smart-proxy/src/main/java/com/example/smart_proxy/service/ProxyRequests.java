package com.example.smart_proxy.service;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.springframework.web.util.UriUtils;

/** Parameter checks and encoding shared by the authorize, callback and token legs. */
final class ProxyRequests {

  private ProxyRequests() {}

  static String requireText(String value, String parameter) {
    if (value == null || value.isBlank()) {
      throw new MissingParameterException(parameter);
    }
    return value;
  }

  static URI requireAbsoluteUri(String value, String parameter) {
    requireText(value, parameter);
    final URI uri;
    try {
      uri = URI.create(value);
    } catch (IllegalArgumentException ex) {
      throw new InvalidProxyRequestException(parameter + " is not a valid url", ex);
    }
    if (!uri.isAbsolute()) {
      throw new InvalidProxyRequestException(parameter + " must be an absolute url");
    }
    return uri;
  }

  /** Percent-encodes everything outside the RFC 3986 unreserved set. */
  static String encodeQueryValue(String value) {
    return UriUtils.encode(value, StandardCharsets.UTF_8);
  }

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
