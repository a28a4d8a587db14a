/*
 * どこで: Smart-Proxy モデル
 * 何を: 起動時に解決した IdP のエンドポイントと世代(v1/v2)を保持する
 * なぜ: プロセス存続期間中は不変の共有状態として全リクエストから参照するため
 */
package com.example.smart_proxy.model;

import java.net.URI;
import java.util.Objects;

public record IdpMetadata(URI authorizeEndpoint, URI tokenEndpoint, boolean v2) {

  public IdpMetadata {
    Objects.requireNonNull(authorizeEndpoint, "authorizeEndpoint");
    Objects.requireNonNull(tokenEndpoint, "tokenEndpoint");
  }
}
