package com.example.smart_proxy.service;

public class IdpIntegrationException extends RuntimeException {

  public enum Reason {
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public IdpIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public IdpIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
