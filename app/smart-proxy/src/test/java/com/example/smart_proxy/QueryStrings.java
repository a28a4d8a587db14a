package com.example.smart_proxy;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/** Decodes the query of a redirect location into first-value-per-key, preserving order. */
public final class QueryStrings {

  private QueryStrings() {}

  public static Map<String, String> of(URI uri) {
    final MultiValueMap<String, String> raw =
        UriComponentsBuilder.fromUri(uri).build(true).getQueryParams();
    final Map<String, String> decoded = new LinkedHashMap<>();
    raw.forEach(
        (key, values) -> decoded.put(key, UriUtils.decode(values.get(0), StandardCharsets.UTF_8)));
    return decoded;
  }

  public static Map<String, String> of(String location) {
    return of(URI.create(location));
  }
}
