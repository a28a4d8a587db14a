/*
 * どこで: Smart-Proxy API
 * 何を: OAuth2 形式(error / error_description)のエラー応答を定義する
 * なぜ: プロキシ自身のエラーも IdP のエラーと同じ形でクライアントに解釈させるため
 */
package com.example.smart_proxy.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthErrorResponse(String error, String errorDescription) {}
