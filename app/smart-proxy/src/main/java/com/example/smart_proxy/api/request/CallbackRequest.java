package com.example.smart_proxy.api.request;

public record CallbackRequest(
    String code, String state, String sessionState, String error, String errorDescription) {}
