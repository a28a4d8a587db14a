/*
 * どこで: Smart-Proxy 下流 DTO
 * 何を: /.well-known/openid-configuration のうち利用する項目だけを表現する
 * なぜ: IdP ごとのメタデータ差分を無視して必要なエンドポイントだけ取り出すため
 */
package com.example.smart_proxy.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenIdConfigurationDocument(
    String issuer, String authorizationEndpoint, String tokenEndpoint) {}
