/*
 * どこで: Smart-Proxy 設定
 * 何を: 起動時に一度だけ IdP メタデータを解決し Bean として公開する
 * なぜ: IdP を使えない状態ではプロキシを起動させない(fail fast)ため
 */
package com.example.smart_proxy.config;

import com.example.smart_proxy.model.IdpMetadata;
import com.example.smart_proxy.service.OpenIdConfigurationResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnSmartProxyEnabled
public class IdpMetadataConfig {

  private static final Logger logger = LoggerFactory.getLogger(IdpMetadataConfig.class);

  @Bean
  IdpMetadata idpMetadata(OpenIdConfigurationResolver resolver, SmartProxyProperties properties) {
    final IdpMetadata metadata = resolver.resolve(properties.authority());
    logger.info(
        "resolved idp metadata authorizeEndpoint={} tokenEndpoint={} v2={}",
        metadata.authorizeEndpoint(),
        metadata.tokenEndpoint(),
        metadata.v2());
    return metadata;
  }
}
