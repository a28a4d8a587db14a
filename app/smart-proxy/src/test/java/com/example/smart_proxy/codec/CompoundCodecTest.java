package com.example.smart_proxy.codec;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.smart_proxy.model.CompoundCode;
import com.example.smart_proxy.model.CompoundState;
import com.example.smart_proxy.model.DecodeResult;
import com.example.smart_proxy.model.LaunchContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompoundCodecTest {

  private final CompoundCodec codec = new CompoundCodec(new ObjectMapper());

  @Test
  void stateRoundTripPreservesClientStateAndLaunchString() {
    final String launch = codec.encodeText("{\"patient\":\"123\"}");
    final CompoundState state = new CompoundState("af0ifjsldkj", launch);

    final DecodeResult<CompoundState> decoded = codec.decodeState(codec.encodeState(state));

    assertThat(decoded.isPresent()).isTrue();
    assertThat(decoded.value()).isEqualTo(state);
  }

  @Test
  void stateIsCompactJsonWithoutPadding() {
    final String encoded = codec.encodeState(new CompoundState("xyz", "e30"));

    assertThat(encoded).doesNotContain("=", "+", "/");
    assertThat(codec.decodeText(encoded).value()).isEqualTo("{\"s\":\"xyz\",\"l\":\"e30\"}");
  }

  @Test
  void stateWithoutClientStateRoundTripsAsNull() {
    final DecodeResult<CompoundState> decoded =
        codec.decodeState(codec.encodeState(new CompoundState(null, "e30")));

    assertThat(decoded.value().clientState()).isNull();
    assertThat(decoded.value().launch()).isEqualTo("e30");
  }

  @Test
  void stateWithNonStringFieldIsMalformed() {
    final String encoded = codec.encodeText("{\"s\":42,\"l\":\"e30\"}");

    assertThat(codec.decodeState(encoded).isMalformed()).isTrue();
  }

  @Test
  void codeRoundTripKeepsLaunchKeysInOrderAndAppendsCode() {
    final Map<String, JsonNode> fields = new LinkedHashMap<>();
    fields.put("patient", TextNode.valueOf("123"));
    fields.put("need_patient_banner", BooleanNode.TRUE);
    fields.put("tenant_hint", TextNode.valueOf("east"));
    final CompoundCode compoundCode = new CompoundCode("abc", LaunchContext.of(fields));

    final String encoded = codec.encodeCode(compoundCode);

    assertThat(codec.decodeText(encoded).value())
        .isEqualTo(
            "{\"patient\":\"123\",\"need_patient_banner\":true,"
                + "\"tenant_hint\":\"east\",\"code\":\"abc\"}");
    final CompoundCode decoded = codec.decodeCode(encoded).value();
    assertThat(decoded.code()).isEqualTo("abc");
    assertThat(decoded.launchContext()).isEqualTo(compoundCode.launchContext());
    assertThat(decoded.launchContext().fields().keySet())
        .containsExactly("patient", "need_patient_banner", "tenant_hint");
  }

  @Test
  void codeWithEmptyLaunchContextCarriesOnlyCode() {
    final String encoded = codec.encodeCode(new CompoundCode("abc", LaunchContext.empty()));

    assertThat(codec.decodeText(encoded).value()).isEqualTo("{\"code\":\"abc\"}");
    assertThat(codec.decodeCode(encoded).value().launchContext().isEmpty()).isTrue();
  }

  @Test
  void codeIsMalformedWhenNotBase64Url() {
    final DecodeResult<CompoundCode> decoded = codec.decodeCode("not*base64!");

    assertThat(decoded.isMalformed()).isTrue();
    assertThat(decoded.cause()).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void codeIsMalformedWhenNotJson() {
    assertThat(codec.decodeCode(codec.encodeText("not-json")).isMalformed()).isTrue();
  }

  @Test
  void codeIsMalformedWhenJsonIsNotAnObject() {
    assertThat(codec.decodeCode(codec.encodeText("[\"abc\"]")).isMalformed()).isTrue();
  }

  @Test
  void codeIsMalformedWhenTrailingContentFollowsObject() {
    assertThat(codec.decodeCode(codec.encodeText("{\"code\":\"abc\"} {}")).isMalformed()).isTrue();
  }

  @Test
  void codeIsMalformedWithoutCodeField() {
    final DecodeResult<CompoundCode> decoded =
        codec.decodeCode(codec.encodeText("{\"patient\":\"123\"}"));

    assertThat(decoded.isMalformed()).isTrue();
    assertThat(decoded.reason()).contains("'code'");
  }

  @Test
  void blankInputIsAbsentNotMalformed() {
    assertThat(codec.decodeCode(null).isAbsent()).isTrue();
    assertThat(codec.decodeState(" ").isAbsent()).isTrue();
    assertThat(codec.decodeLaunch("").isAbsent()).isTrue();
  }

  @Test
  void launchWithReservedCodeKeyIsMalformed() {
    assertThat(codec.decodeLaunch(codec.encodeText("{\"code\":\"x\"}")).isMalformed()).isTrue();
  }

  @Test
  void emptyLaunchEncodesToEmptyObject() {
    assertThat(codec.encodeLaunch(LaunchContext.empty())).isEqualTo("e30");
    assertThat(codec.decodeLaunch("e30").value().isEmpty()).isTrue();
  }

  @Test
  void decodeTextAcceptsPaddedInput() {
    assertThat(codec.decodeText("YQ==").value()).isEqualTo("a");
    assertThat(codec.decodeText("YQ").value()).isEqualTo("a");
  }

  @Test
  void textRoundTripPreservesNonAsciiCharacters() {
    final String redirect = "https://app.example/コールバック?x=1";

    assertThat(codec.decodeText(codec.encodeText(redirect)).value()).isEqualTo(redirect);
  }

  @Test
  void codeWithInvalidUtf8IsMalformed() {
    final String encoded =
        encodeRawBytes("{\"patient\":\"12", new byte[] {(byte) 0xC3}, "\",\"code\":\"abc\"}");

    final DecodeResult<CompoundCode> decoded = codec.decodeCode(encoded);

    assertThat(decoded.isMalformed()).isTrue();
    assertThat(decoded.reason()).isEqualTo("value is not valid JSON");
  }

  @Test
  void stateWithInvalidUtf8IsMalformed() {
    final String encoded =
        encodeRawBytes("{\"s\":\"x", new byte[] {(byte) 0xFF}, "\",\"l\":\"e30\"}");

    assertThat(codec.decodeState(encoded).isMalformed()).isTrue();
  }

  @Test
  void textWithInvalidUtf8IsMalformed() {
    final String encoded =
        encodeRawBytes("https://app.example/", new byte[] {(byte) 0xC3, (byte) 0x28}, "");

    final DecodeResult<String> decoded = codec.decodeText(encoded);

    assertThat(decoded.isMalformed()).isTrue();
    assertThat(decoded.reason()).isEqualTo("value is not valid UTF-8");
  }

  private static String encodeRawBytes(String prefix, byte[] raw, String suffix) {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    bytes.writeBytes(prefix.getBytes(StandardCharsets.UTF_8));
    bytes.writeBytes(raw);
    bytes.writeBytes(suffix.getBytes(StandardCharsets.UTF_8));
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes.toByteArray());
  }
}
