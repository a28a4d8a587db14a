package com.example.smart_proxy.service;

/** The IdP's OpenID configuration could not be fetched or lacks a usable endpoint. */
public class OpenIdConfigurationException extends RuntimeException {

  public OpenIdConfigurationException(String message) {
    super(message);
  }

  public OpenIdConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
