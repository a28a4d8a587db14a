package com.example.smart_proxy.service;

import com.example.smart_proxy.codec.CompoundCodec;
import com.example.smart_proxy.config.SmartProxyProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the proxy's own callback URL,
 * {@code {proxyBase}{basePath}/callback/{base64url(redirect)}}.
 *
 * <p>The authorize and token legs must produce the same string for the same client redirect URI,
 * because the IdP compares the {@code redirect_uri} of both requests.
 */
@Component
@RequiredArgsConstructor
public class ProxyCallbackUrlFactory {

  private final SmartProxyProperties properties;
  private final CompoundCodec codec;

  /**
   * @param requestBaseUrl scheme, host, port and context path of the current request; ignored
   *     when {@code smart-proxy.public-base-url} is configured
   */
  public String callbackUrl(String requestBaseUrl, String clientRedirectUri) {
    return resolveBase(requestBaseUrl)
        + properties.basePath()
        + "/callback/"
        + codec.encodeText(clientRedirectUri);
  }

  private String resolveBase(String requestBaseUrl) {
    if (properties.publicBaseUrl() != null) {
      return properties.publicBaseUrl();
    }
    if (requestBaseUrl == null || requestBaseUrl.isBlank()) {
      throw new IllegalStateException("request base url is required without public-base-url");
    }
    return requestBaseUrl.endsWith("/")
        ? requestBaseUrl.substring(0, requestBaseUrl.length() - 1)
        : requestBaseUrl;
  }
}
