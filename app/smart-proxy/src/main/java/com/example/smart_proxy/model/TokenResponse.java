package com.example.smart_proxy.model;

/** Status and raw JSON body returned from the token endpoint, either verbatim or rewritten. */
public record TokenResponse(int status, String body) {

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }
}
