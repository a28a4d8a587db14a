package com.example.smart_proxy.api;

import com.example.smart_proxy.api.response.OAuthErrorResponse;
import com.example.smart_proxy.service.CompoundDecodeException;
import com.example.smart_proxy.service.IdpIntegrationException;
import com.example.smart_proxy.service.InvalidProxyRequestException;
import com.example.smart_proxy.service.SmartProxyMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class SmartProxyExceptionHandler {

  static final String INVALID_REQUEST = "invalid_request";
  static final String SERVER_ERROR = "server_error";
  static final String TEMPORARILY_UNAVAILABLE = "temporarily_unavailable";

  private final SmartProxyMetrics metrics;

  @ExceptionHandler(InvalidProxyRequestException.class)
  public ResponseEntity<OAuthErrorResponse> handleInvalidRequest(InvalidProxyRequestException ex) {
    metrics.recordError("INVALID_REQUEST");
    return respond(HttpStatus.BAD_REQUEST, INVALID_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(CompoundDecodeException.class)
  public ResponseEntity<OAuthErrorResponse> handleCompoundDecode(CompoundDecodeException ex) {
    final String code =
        switch (ex.kind()) {
          case STATE -> "STATE_DECODE_ERROR";
          case LAUNCH -> "LAUNCH_DECODE_ERROR";
          case CODE -> "CODE_DECODE_ERROR";
          case REDIRECT -> "REDIRECT_DECODE_ERROR";
        };
    metrics.recordError(code);
    // REDIRECT は 400、STATE/LAUNCH/CODE は 500。
    if (ex.kind() == CompoundDecodeException.Kind.REDIRECT) {
      return respond(HttpStatus.BAD_REQUEST, INVALID_REQUEST, ex.getMessage());
    }
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, SERVER_ERROR, ex.getMessage());
  }

  @ExceptionHandler(IdpIntegrationException.class)
  public ResponseEntity<OAuthErrorResponse> handleIdpIntegration(IdpIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case TIMEOUT -> "IDP_TIMEOUT";
          case BAD_GATEWAY -> "IDP_BAD_GATEWAY";
          case INVALID_RESPONSE -> "IDP_INVALID_RESPONSE";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case BAD_GATEWAY, INVALID_RESPONSE -> HttpStatus.BAD_GATEWAY;
        };
    final String error =
        ex.reason() == IdpIntegrationException.Reason.INVALID_RESPONSE
            ? SERVER_ERROR
            : TEMPORARILY_UNAVAILABLE;
    metrics.recordError(code);
    return respond(status, error, ex.getMessage());
  }

  private ResponseEntity<OAuthErrorResponse> respond(
      HttpStatus status, String error, String description) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(new OAuthErrorResponse(error, description));
  }
}
