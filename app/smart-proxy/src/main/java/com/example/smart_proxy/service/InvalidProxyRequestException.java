package com.example.smart_proxy.service;

public class InvalidProxyRequestException extends RuntimeException {

  public InvalidProxyRequestException(String message) {
    super(message);
  }

  public InvalidProxyRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
