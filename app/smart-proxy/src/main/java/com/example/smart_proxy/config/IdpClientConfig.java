/*
 * どこで: Smart-Proxy 設定
 * 何を: IdP 呼び出し専用 RestClient を提供する
 * なぜ: openid-configuration 取得と token 交換でコネクションを共有するため
 */
package com.example.smart_proxy.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(SmartProxyProperties.class)
public class IdpClientConfig {

  @Bean
  RestClient idpRestClient(RestClient.Builder builder) {
    // IdP の URL はメタデータ由来の絶対 URL なので baseUrl は持たない。
    return builder.build();
  }
}
