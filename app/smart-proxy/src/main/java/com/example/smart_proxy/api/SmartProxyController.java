/*
 * どこで: Smart-Proxy API
 * 何を: authorize / callback / token の 3 レッグを受け付ける
 * なぜ: launch context 非対応の IdP と SMART クライアントの間で認可コードフローを中継するため
 */
package com.example.smart_proxy.api;

import com.example.smart_proxy.api.request.AuthorizeRequest;
import com.example.smart_proxy.api.request.CallbackRequest;
import com.example.smart_proxy.config.ConditionalOnSmartProxyEnabled;
import com.example.smart_proxy.model.ClientRedirect;
import com.example.smart_proxy.model.TokenResponse;
import com.example.smart_proxy.service.AuthorizeRedirectService;
import com.example.smart_proxy.service.CallbackRedirectService;
import com.example.smart_proxy.service.TokenExchangeService;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequestMapping("${smart-proxy.base-path:/AadProxy}")
@ConditionalOnSmartProxyEnabled
@RequiredArgsConstructor
public class SmartProxyController {

  private final AuthorizeRedirectService authorizeRedirectService;
  private final CallbackRedirectService callbackRedirectService;
  private final TokenExchangeService tokenExchangeService;

  /**
   * 役割:
   * - クライアントの authorize リクエストを実 IdP の authorize エンドポイントへ転送する。
   *
   * 期待動作:
   * - 302 で IdP へ遷移させる。redirect_uri はプロキシの /callback に差し替える。
   * - 必須パラメータ欠落時は 400 invalid_request を返す。
   */
  @GetMapping("/authorize")
  public ResponseEntity<Void> authorize(
      @RequestParam(name = "response_type", required = false) String responseType,
      @RequestParam(name = "client_id", required = false) String clientId,
      @RequestParam(name = "redirect_uri", required = false) String redirectUri,
      @RequestParam(name = "launch", required = false) String launch,
      @RequestParam(name = "scope", required = false) String scope,
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "aud", required = false) String aud) {
    final URI location =
        authorizeRedirectService.buildAuthorizeRedirect(
            new AuthorizeRequest(responseType, clientId, redirectUri, launch, scope, state, aud),
            currentBaseUrl());
    return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
  }

  /**
   * 役割:
   * - IdP からの callback を受け、クライアントの redirect_uri へ戻す。
   *
   * 期待動作:
   * - 成功時は compound code 付きで 301 を返す。
   * - IdP の error はそのまま 302 で返す。
   */
  @GetMapping("/callback/{encodedRedirect}")
  public ResponseEntity<Void> callback(
      @PathVariable("encodedRedirect") String encodedRedirect,
      @RequestParam(name = "code", required = false) String code,
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "session_state", required = false) String sessionState,
      @RequestParam(name = "error", required = false) String error,
      @RequestParam(name = "error_description", required = false) String errorDescription) {
    final ClientRedirect redirect =
        callbackRedirectService.buildClientRedirect(
            encodedRedirect,
            new CallbackRequest(code, state, sessionState, error, errorDescription));
    final HttpStatus status =
        redirect.permanent() ? HttpStatus.MOVED_PERMANENTLY : HttpStatus.FOUND;
    return ResponseEntity.status(status).location(redirect.location()).build();
  }

  /**
   * 役割:
   * - token リクエストを IdP の token エンドポイントへ中継する。
   *
   * 期待動作:
   * - フォームはリクエストボディのみから読む。クエリ文字列のパラメータは転送しない。
   * - authorization_code 以外の grant はフォームをそのまま転送し、応答もそのまま返す。
   * - authorization_code は compound code を展開して交換し、launch context を応答に差し込む。
   */
  @PostMapping(path = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<String> token(
      @RequestBody(required = false) MultiValueMap<String, String> form,
      @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    final TokenResponse response =
        tokenExchangeService.exchange(
            form != null ? form : new LinkedMultiValueMap<>(), authorization, currentBaseUrl());
    return ResponseEntity.status(response.status())
        .contentType(MediaType.APPLICATION_JSON)
        .body(response.body());
  }

  private String currentBaseUrl() {
    return ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString();
  }
}
