/*
 * どこで: Smart-Proxy サービス層
 * 何を: IdP からの callback をクライアントの redirect_uri へのリダイレクトに書き換える
 * なぜ: 実 code と launch context を compound code にまとめ、token 交換時に launch context を復元するため
 */
package com.example.smart_proxy.service;

import static com.example.smart_proxy.service.ProxyRequests.encodeQueryValue;
import static com.example.smart_proxy.service.ProxyRequests.isBlank;
import static com.example.smart_proxy.service.ProxyRequests.requireText;

import com.example.smart_proxy.api.request.CallbackRequest;
import com.example.smart_proxy.codec.CompoundCodec;
import com.example.smart_proxy.config.ConditionalOnSmartProxyEnabled;
import com.example.smart_proxy.model.ClientRedirect;
import com.example.smart_proxy.model.CompoundCode;
import com.example.smart_proxy.model.CompoundState;
import com.example.smart_proxy.model.DecodeResult;
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
public class CallbackRedirectService {

  private static final Logger logger = LoggerFactory.getLogger(CallbackRedirectService.class);

  private final CompoundCodec codec;
  private final SmartProxyMetrics metrics;

  /**
   * 役割:
   * - IdP の callback をクライアントへ転送する。
   *
   * 期待動作:
   * - error があれば state/launch に触れずに error と error_description をそのまま返す(302)。
   * - それ以外は compound code とクライアントの元 state を付けて返す(301)。
   * - state/launch が不正ならログを残して CompoundDecodeException を送出する。
   */
  public ClientRedirect buildClientRedirect(String encodedRedirect, CallbackRequest request) {
    final URI clientRedirect = decodeClientRedirect(encodedRedirect);

    if (!isBlank(request.error())) {
      final UriComponentsBuilder builder =
          UriComponentsBuilder.fromUri(clientRedirect)
              .queryParam("error", encodeQueryValue(request.error()));
      if (request.errorDescription() != null) {
        builder.queryParam("error_description", encodeQueryValue(request.errorDescription()));
      }
      metrics.recordCallback("error");
      logger.info("idp callback carried error={}", request.error());
      return new ClientRedirect(build(builder), false);
    }

    final String code = requireText(request.code(), "code");
    final CompoundState state =
        codec
            .decodeState(request.state())
            .resolve(
                () -> {
                  throw new MissingParameterException("state");
                },
                result -> decodeFailure(CompoundDecodeException.Kind.STATE, result));
    final LaunchContext launchContext =
        codec
            .decodeLaunch(state.launch())
            .resolve(
                LaunchContext::empty,
                result -> decodeFailure(CompoundDecodeException.Kind.LAUNCH, result));
    final String compoundCode = codec.encodeCode(new CompoundCode(code, launchContext));

    final UriComponentsBuilder builder =
        UriComponentsBuilder.fromUri(clientRedirect)
            .queryParam("code", encodeQueryValue(compoundCode));
    if (state.clientState() != null) {
      builder.queryParam("state", encodeQueryValue(state.clientState()));
    }
    if (request.sessionState() != null) {
      builder.queryParam("session_state", encodeQueryValue(request.sessionState()));
    }
    metrics.recordCallback("code");
    return new ClientRedirect(build(builder), true);
  }

  private URI decodeClientRedirect(String encodedRedirect) {
    final String redirect =
        codec
            .decodeText(encodedRedirect)
            .resolve(
                () -> {
                  throw new MissingParameterException("encodedRedirect");
                },
                result -> decodeFailure(CompoundDecodeException.Kind.REDIRECT, result));
    final URI uri;
    try {
      uri = URI.create(redirect);
    } catch (IllegalArgumentException ex) {
      logger.warn("callback redirect segment is not a valid url");
      throw new CompoundDecodeException(
          CompoundDecodeException.Kind.REDIRECT, "redirect is not a valid url", ex);
    }
    if (!uri.isAbsolute()) {
      logger.warn("callback redirect segment is not an absolute url");
      throw new CompoundDecodeException(
          CompoundDecodeException.Kind.REDIRECT, "redirect must be an absolute url");
    }
    return uri;
  }

  private URI build(UriComponentsBuilder builder) {
    try {
      return builder.build(true).toUri();
    } catch (IllegalArgumentException ex) {
      throw new CompoundDecodeException(
          CompoundDecodeException.Kind.REDIRECT, "redirect cannot carry callback parameters", ex);
    }
  }

  private CompoundDecodeException decodeFailure(
      CompoundDecodeException.Kind kind, DecodeResult<?> result) {
    logger.error("failed to decode {} on callback: {}", kind, result.reason(), result.cause());
    return CompoundDecodeException.from(kind, result);
  }
}
