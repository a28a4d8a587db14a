/*
 * どこで: Smart-Proxy モデル
 * 何を: SMART launch context(patient/encounter 等)を順序付きで保持する
 * なぜ: 未知のキーも含めて意味解釈せずにそのまま運搬するため
 */
package com.example.smart_proxy.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered mapping of launch-context keys to JSON values.
 *
 * <p>Values are usually strings; {@code need_patient_banner} is commonly a boolean. Keys keep the
 * order in which the client sent them. The key {@value #CODE_FIELD} is reserved for the compound
 * code and is rejected.
 */
public final class LaunchContext {

  public static final String CODE_FIELD = "code";

  private static final LaunchContext EMPTY = new LaunchContext(new LinkedHashMap<>());

  private final Map<String, JsonNode> fields;

  private LaunchContext(LinkedHashMap<String, JsonNode> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  public static LaunchContext empty() {
    return EMPTY;
  }

  public static LaunchContext of(Map<String, ? extends JsonNode> fields) {
    Objects.requireNonNull(fields, "fields");
    final LinkedHashMap<String, JsonNode> copy = new LinkedHashMap<>();
    fields.forEach(
        (key, value) -> {
          if (key == null) {
            throw new IllegalArgumentException("launch context key must not be null");
          }
          if (CODE_FIELD.equals(key)) {
            throw new IllegalArgumentException("launch context must not contain 'code'");
          }
          copy.put(key, value == null ? null : value.deepCopy());
        });
    return copy.isEmpty() ? EMPTY : new LaunchContext(copy);
  }

  public Optional<JsonNode> get(String key) {
    final JsonNode value = fields.get(key);
    return value == null ? Optional.empty() : Optional.of(value.deepCopy());
  }

  public boolean contains(String key) {
    return fields.containsKey(key);
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }

  public Map<String, JsonNode> fields() {
    return fields;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LaunchContext that)) {
      return false;
    }
    return fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  // 値は患者 ID 等を含むためキーのみ出力する。
  @Override
  public String toString() {
    return "LaunchContext" + fields.keySet();
  }
}
