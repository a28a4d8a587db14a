/*
 * どこで: Smart-Proxy API 層テスト
 * 何を: 例外ハンドラが OAuth2 形式のエラー応答とエラーコード別メトリクスを返すことを検証する
 * なぜ: デコード失敗や IdP 障害の HTTP ステータスとカウントが退行しないことを保証するため
 */
package com.example.smart_proxy.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.example.smart_proxy.api.response.OAuthErrorResponse;
import com.example.smart_proxy.service.CompoundDecodeException;
import com.example.smart_proxy.service.IdpIntegrationException;
import com.example.smart_proxy.service.InvalidProxyRequestException;
import com.example.smart_proxy.service.SmartProxyMetrics;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class SmartProxyExceptionHandlerTest {

  private final SmartProxyMetrics metrics = Mockito.mock(SmartProxyMetrics.class);
  private final SmartProxyExceptionHandler handler = new SmartProxyExceptionHandler(metrics);

  @Test
  void invalidRequestMapsTo400() {
    final ResponseEntity<OAuthErrorResponse> response =
        handler.handleInvalidRequest(new InvalidProxyRequestException("aud is required"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(new OAuthErrorResponse("invalid_request", "aud is required"));
    verify(metrics).recordError("INVALID_REQUEST");
  }

  @Test
  void decodeFailuresRecordKindSpecificMetric() {
    final ResponseEntity<OAuthErrorResponse> state =
        handler.handleCompoundDecode(
            new CompoundDecodeException(CompoundDecodeException.Kind.STATE, "state"));
    final ResponseEntity<OAuthErrorResponse> launch =
        handler.handleCompoundDecode(
            new CompoundDecodeException(CompoundDecodeException.Kind.LAUNCH, "launch"));
    final ResponseEntity<OAuthErrorResponse> code =
        handler.handleCompoundDecode(
            new CompoundDecodeException(CompoundDecodeException.Kind.CODE, "code"));
    final ResponseEntity<OAuthErrorResponse> redirect =
        handler.handleCompoundDecode(
            new CompoundDecodeException(CompoundDecodeException.Kind.REDIRECT, "redirect"));

    assertThat(state.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(launch.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(code.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(code.getBody().error()).isEqualTo("server_error");
    assertThat(redirect.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(redirect.getBody().error()).isEqualTo("invalid_request");
    verify(metrics).recordError("STATE_DECODE_ERROR");
    verify(metrics).recordError("LAUNCH_DECODE_ERROR");
    verify(metrics).recordError("CODE_DECODE_ERROR");
    verify(metrics).recordError("REDIRECT_DECODE_ERROR");
  }

  @Test
  void idpIntegrationMapsReasonToGatewayStatus() {
    final ResponseEntity<OAuthErrorResponse> timeout =
        handler.handleIdpIntegration(
            new IdpIntegrationException(IdpIntegrationException.Reason.TIMEOUT, "timeout"));
    final ResponseEntity<OAuthErrorResponse> badGateway =
        handler.handleIdpIntegration(
            new IdpIntegrationException(IdpIntegrationException.Reason.BAD_GATEWAY, "refused"));
    final ResponseEntity<OAuthErrorResponse> invalid =
        handler.handleIdpIntegration(
            new IdpIntegrationException(
                IdpIntegrationException.Reason.INVALID_RESPONSE, "not json"));

    assertThat(timeout.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    assertThat(timeout.getBody().error()).isEqualTo("temporarily_unavailable");
    assertThat(badGateway.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(badGateway.getBody().error()).isEqualTo("temporarily_unavailable");
    assertThat(invalid.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(invalid.getBody().error()).isEqualTo("server_error");
    verify(metrics).recordError("IDP_TIMEOUT");
    verify(metrics).recordError("IDP_BAD_GATEWAY");
    verify(metrics).recordError("IDP_INVALID_RESPONSE");
  }
}
