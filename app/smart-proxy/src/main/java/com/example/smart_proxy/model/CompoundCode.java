package com.example.smart_proxy.model;

import java.util.Objects;

/** Real IdP authorization code merged with the launch context handed to the client. */
public record CompoundCode(String code, LaunchContext launchContext) {

  public CompoundCode {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(launchContext, "launchContext");
  }
}
