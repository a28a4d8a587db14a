/*
 * どこで: Smart-Proxy サービス層
 * 何を: compound state/code、launch context、callback の redirect セグメントのデコード失敗を表す
 * なぜ: 不正な値を空の launch context として黙って扱わず、リクエストを失敗させるため
 */
package com.example.smart_proxy.service;

import com.example.smart_proxy.model.DecodeResult;

public class CompoundDecodeException extends RuntimeException {

  public enum Kind {
    STATE,
    LAUNCH,
    CODE,
    REDIRECT
  }

  private final Kind kind;

  public CompoundDecodeException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public CompoundDecodeException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static CompoundDecodeException from(Kind kind, DecodeResult<?> result) {
    final String message = kind.name().toLowerCase() + " is malformed: " + result.reason();
    return new CompoundDecodeException(kind, message, result.cause());
  }

  public Kind kind() {
    return kind;
  }
}
