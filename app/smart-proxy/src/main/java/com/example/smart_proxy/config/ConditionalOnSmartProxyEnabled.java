package com.example.smart_proxy.config;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;

/**
 * Registers the annotated component only when {@code smart-proxy.enabled=true}.
 *
 * <p>With the flag off, the proxy endpoints are not mapped (requests get 404) and the IdP
 * metadata is never fetched.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@ConditionalOnProperty(prefix = "smart-proxy", name = "enabled", havingValue = "true")
public @interface ConditionalOnSmartProxyEnabled {}
