/*
 * どこで: Smart-Proxy コーデック
 * 何を: launch context / compound state / compound code / redirect URI を base64url(JSON) で相互変換する
 * なぜ: IdP を経由しても埋め込んだ値をバイト単位で復元できるようにするため
 */
package com.example.smart_proxy.codec;

import com.example.smart_proxy.model.CompoundCode;
import com.example.smart_proxy.model.CompoundState;
import com.example.smart_proxy.model.DecodeResult;
import com.example.smart_proxy.model.LaunchContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Base64url(JSON) codec for every value this proxy smuggles through the IdP.
 *
 * <p>Encoding uses the URL-safe alphabet without padding. Decoding accepts padded and unpadded
 * input and reports absent input separately from malformed input.
 */
@Component
public class CompoundCodec {

  static final String STATE_CLIENT_STATE_FIELD = "s";
  static final String STATE_LAUNCH_FIELD = "l";

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private final ObjectMapper objectMapper;
  private final ObjectReader strictReader;

  public CompoundCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper.copy();
    this.strictReader =
        this.objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  public String encodeText(String value) {
    return ENCODER.encodeToString(value.getBytes(StandardCharsets.UTF_8));
  }

  public DecodeResult<String> decodeText(String encoded) {
    final DecodeResult<byte[]> bytes = decodeBytes(encoded);
    if (!bytes.isPresent()) {
      return propagate(bytes);
    }
    try {
      return DecodeResult.present(
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes.value()))
              .toString());
    } catch (CharacterCodingException ex) {
      return DecodeResult.malformed("value is not valid UTF-8", ex);
    }
  }

  public String encodeLaunch(LaunchContext launchContext) {
    return encodeJson(toObjectNode(launchContext));
  }

  public DecodeResult<LaunchContext> decodeLaunch(String encoded) {
    final DecodeResult<ObjectNode> object = decodeObject(encoded);
    if (!object.isPresent()) {
      return propagate(object);
    }
    final ObjectNode node = object.value();
    if (node.has(LaunchContext.CODE_FIELD)) {
      return DecodeResult.malformed("launch context must not contain 'code'");
    }
    return DecodeResult.present(toLaunchContext(node));
  }

  public String encodeState(CompoundState state) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put(STATE_CLIENT_STATE_FIELD, state.clientState());
    node.put(STATE_LAUNCH_FIELD, state.launch());
    return encodeJson(node);
  }

  public DecodeResult<CompoundState> decodeState(String encoded) {
    final DecodeResult<ObjectNode> object = decodeObject(encoded);
    if (!object.isPresent()) {
      return propagate(object);
    }
    final ObjectNode node = object.value();
    final JsonNode clientState = node.get(STATE_CLIENT_STATE_FIELD);
    final JsonNode launch = node.get(STATE_LAUNCH_FIELD);
    if (!isTextOrNull(clientState)) {
      return DecodeResult.malformed("state field 's' is not a string");
    }
    if (!isTextOrNull(launch)) {
      return DecodeResult.malformed("state field 'l' is not a string");
    }
    return DecodeResult.present(new CompoundState(textOrNull(clientState), textOrNull(launch)));
  }

  public String encodeCode(CompoundCode compoundCode) {
    final ObjectNode node = toObjectNode(compoundCode.launchContext());
    node.put(LaunchContext.CODE_FIELD, compoundCode.code());
    return encodeJson(node);
  }

  public DecodeResult<CompoundCode> decodeCode(String encoded) {
    final DecodeResult<ObjectNode> object = decodeObject(encoded);
    if (!object.isPresent()) {
      return propagate(object);
    }
    final ObjectNode node = object.value();
    final JsonNode code = node.remove(LaunchContext.CODE_FIELD);
    if (code == null || !code.isTextual() || code.asText().isBlank()) {
      return DecodeResult.malformed("compound code has no 'code' string");
    }
    return DecodeResult.present(new CompoundCode(code.asText(), toLaunchContext(node)));
  }

  private DecodeResult<byte[]> decodeBytes(String encoded) {
    if (isBlank(encoded)) {
      return DecodeResult.absent();
    }
    try {
      return DecodeResult.present(DECODER.decode(encoded));
    } catch (IllegalArgumentException ex) {
      return DecodeResult.malformed("value is not base64url", ex);
    }
  }

  private DecodeResult<ObjectNode> decodeObject(String encoded) {
    final DecodeResult<byte[]> bytes = decodeBytes(encoded);
    if (!bytes.isPresent()) {
      return propagate(bytes);
    }
    final JsonNode node;
    try {
      // バイト列のまま渡し、不正な UTF-8 は Jackson に拒否させる。
      node = strictReader.readTree(bytes.value());
    } catch (IOException ex) {
      return DecodeResult.malformed("value is not valid JSON", ex);
    }
    if (node == null || !node.isObject()) {
      return DecodeResult.malformed("value is not a JSON object");
    }
    return DecodeResult.present((ObjectNode) node);
  }

  private ObjectNode toObjectNode(LaunchContext launchContext) {
    final ObjectNode node = objectMapper.createObjectNode();
    launchContext.fields().forEach(node::set);
    return node;
  }

  private LaunchContext toLaunchContext(ObjectNode node) {
    final Map<String, JsonNode> fields = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
    while (iterator.hasNext()) {
      final Map.Entry<String, JsonNode> field = iterator.next();
      fields.put(field.getKey(), field.getValue());
    }
    return LaunchContext.of(fields);
  }

  private String encodeJson(JsonNode node) {
    try {
      return ENCODER.encodeToString(objectMapper.writeValueAsBytes(node));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize compound value", ex);
    }
  }

  private static <T> DecodeResult<T> propagate(DecodeResult<?> result) {
    return result.isAbsent()
        ? DecodeResult.absent()
        : DecodeResult.malformed(result.reason(), result.cause());
  }

  private static boolean isTextOrNull(JsonNode node) {
    return node == null || node.isNull() || node.isTextual();
  }

  private static String textOrNull(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
