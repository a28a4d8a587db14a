/*
 * どこで: Smart-Proxy Web 設定
 * 何を: RequestMdcInterceptor を全リクエストへ適用する
 * なぜ: プロキシの各レッグのログへ request_id 等を安定して埋め込むため
 */
package com.example.smart_proxy.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
  }
}
