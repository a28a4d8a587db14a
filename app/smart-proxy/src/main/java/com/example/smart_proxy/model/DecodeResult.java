/*
 * どこで: Smart-Proxy モデル
 * 何を: state/launch/code 等のデコード結果(存在/欠落/不正)を表現する
 * なぜ: 「欠落なので既定値」と「不正なのでリクエスト失敗」を呼び出し側で明示的に分けるため
 */
package com.example.smart_proxy.model;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

public final class DecodeResult<T> {

  public enum Status {
    PRESENT,
    ABSENT,
    MALFORMED
  }

  private final Status status;
  private final T value;
  private final String reason;
  private final Throwable cause;

  private DecodeResult(Status status, T value, String reason, Throwable cause) {
    this.status = status;
    this.value = value;
    this.reason = reason;
    this.cause = cause;
  }

  public static <T> DecodeResult<T> present(T value) {
    return new DecodeResult<>(Status.PRESENT, Objects.requireNonNull(value, "value"), null, null);
  }

  public static <T> DecodeResult<T> absent() {
    return new DecodeResult<>(Status.ABSENT, null, null, null);
  }

  public static <T> DecodeResult<T> malformed(String reason) {
    return malformed(reason, null);
  }

  public static <T> DecodeResult<T> malformed(String reason, Throwable cause) {
    return new DecodeResult<>(
        Status.MALFORMED, null, Objects.requireNonNull(reason, "reason"), cause);
  }

  public Status status() {
    return status;
  }

  public boolean isPresent() {
    return status == Status.PRESENT;
  }

  public boolean isAbsent() {
    return status == Status.ABSENT;
  }

  public boolean isMalformed() {
    return status == Status.MALFORMED;
  }

  public T value() {
    if (status != Status.PRESENT) {
      throw new IllegalStateException("no value for decode result " + status);
    }
    return value;
  }

  public String reason() {
    return reason;
  }

  public Throwable cause() {
    return cause;
  }

  /**
   * Returns the decoded value, the fallback when absent, or throws the mapped exception when
   * malformed. {@code whenAbsent} may itself throw to make the value mandatory.
   */
  public T resolve(
      Supplier<? extends T> whenAbsent,
      Function<? super DecodeResult<T>, ? extends RuntimeException> whenMalformed) {
    return switch (status) {
      case PRESENT -> value;
      case ABSENT -> whenAbsent.get();
      case MALFORMED -> throw whenMalformed.apply(this);
    };
  }

  @Override
  public String toString() {
    return status == Status.MALFORMED ? "MALFORMED(" + reason + ")" : status.name();
  }
}
