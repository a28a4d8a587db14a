package com.example.smart_proxy.api.request;

public record AuthorizeRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String launch,
    String scope,
    String state,
    String aud) {}
