package com.example.smart_proxy.service;

public class MissingParameterException extends InvalidProxyRequestException {

  private final String parameter;

  public MissingParameterException(String parameter) {
    super(parameter + " is required");
    this.parameter = parameter;
  }

  public String parameter() {
    return parameter;
  }
}
