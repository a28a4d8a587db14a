/*
 * どこで: Smart-Proxy サービス層
 * 何を: クライアントの authorize リクエストを実 IdP への authorize リダイレクトへ書き換える
 * なぜ: launch context とクライアント state を compound state に詰め、IdP からの callback をプロキシで受けるため
 */
package com.example.smart_proxy.service;

import static com.example.smart_proxy.service.ProxyRequests.encodeQueryValue;
import static com.example.smart_proxy.service.ProxyRequests.isBlank;
import static com.example.smart_proxy.service.ProxyRequests.requireAbsoluteUri;
import static com.example.smart_proxy.service.ProxyRequests.requireText;

import com.example.smart_proxy.api.request.AuthorizeRequest;
import com.example.smart_proxy.codec.CompoundCodec;
import com.example.smart_proxy.config.ConditionalOnSmartProxyEnabled;
import com.example.smart_proxy.model.CompoundState;
import com.example.smart_proxy.model.DecodeResult;
import com.example.smart_proxy.model.IdpMetadata;
import com.example.smart_proxy.model.LaunchContext;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

@Service
@ConditionalOnSmartProxyEnabled
@RequiredArgsConstructor
public class AuthorizeRedirectService {

  private static final Logger logger = LoggerFactory.getLogger(AuthorizeRedirectService.class);

  private final IdpMetadata idpMetadata;
  private final CompoundCodec codec;
  private final ScopeTranslator scopeTranslator;
  private final ProxyCallbackUrlFactory callbackUrlFactory;
  private final SmartProxyMetrics metrics;

  public URI buildAuthorizeRedirect(AuthorizeRequest request, String requestBaseUrl) {
    final String responseType = requireText(request.responseType(), "response_type");
    final String clientId = requireText(request.clientId(), "client_id");
    requireAbsoluteUri(request.redirectUri(), "redirect_uri");
    final String aud = requireText(request.aud(), "aud");

    final String launch = resolveLaunch(request.launch());
    final String newState = codec.encodeState(new CompoundState(request.state(), launch));
    final String callbackUrl =
        callbackUrlFactory.callbackUrl(requestBaseUrl, request.redirectUri());

    final UriComponentsBuilder builder =
        UriComponentsBuilder.fromUri(idpMetadata.authorizeEndpoint())
            .queryParam("response_type", encodeQueryValue(responseType))
            .queryParam("redirect_uri", encodeQueryValue(callbackUrl))
            .queryParam("client_id", encodeQueryValue(clientId));
    if (idpMetadata.v2()) {
      final String scope = requireText(request.scope(), "scope");
      builder.queryParam("scope", encodeQueryValue(scopeTranslator.qualify(aud, scope)));
    } else {
      builder.queryParam("resource", encodeQueryValue(aud));
    }
    builder.queryParam("state", encodeQueryValue(newState));

    metrics.recordAuthorize(idpMetadata.v2() ? "v2" : "v1");
    logger.debug("authorize redirect prepared clientId={} v2={}", clientId, idpMetadata.v2());
    return builder.build(true).toUri();
  }

  private String resolveLaunch(String launch) {
    if (isBlank(launch)) {
      return codec.encodeLaunch(LaunchContext.empty());
    }
    final DecodeResult<LaunchContext> decoded = codec.decodeLaunch(launch);
    if (decoded.isMalformed()) {
      logger.warn("authorize launch parameter rejected: {}", decoded.reason());
      throw new InvalidProxyRequestException("launch is malformed: " + decoded.reason());
    }
    // 検証のみ行い、state にはクライアントが送った文字列をそのまま載せる。
    return launch;
  }
}
