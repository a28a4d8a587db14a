package com.example.smart_proxy.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

@Configuration
public class SmartProxySecurityConfig {

  private final boolean csrfEnabled;
  private final String basePath;

  public SmartProxySecurityConfig(
      @Value("${app.security.csrf-enabled:true}") boolean csrfEnabled,
      @Value("${smart-proxy.base-path:/AadProxy}") String basePath) {
    this.csrfEnabled = csrfEnabled;
    this.basePath =
        basePath.endsWith("/") ? basePath.substring(0, basePath.length() - 1) : basePath;
  }

  @Bean
  SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    if (csrfEnabled) {
      // token エンドポイントはクライアントのバックエンドから直接 POST される。
      http.csrf(csrf -> csrf.ignoringRequestMatchers(basePath + "/token"));
    } else {
      http.csrf(csrf -> csrf.disable());
    }
    http.sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        basePath + "/authorize",
                        basePath + "/callback/**",
                        basePath + "/token",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .anyRequest()
                    .authenticated())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .logout(logout -> logout.disable())
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint()));

    return http.build();
  }

  @Bean
  AuthenticationEntryPoint authenticationEntryPoint() {
    return new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED);
  }
}
