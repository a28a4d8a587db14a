/*
 * どこで: Smart-Proxy モデル
 * 何を: IdP へ渡す state に詰め込むクライアント state(s) と launch 文字列(l)
 * なぜ: launch を知らない IdP に state 1 つだけを往復させて文脈を運ぶため
 */
package com.example.smart_proxy.model;

/**
 * Client state and raw launch string carried through the IdP inside {@code state}.
 *
 * @param clientState the client's original {@code state}, {@code null} when the client sent none
 * @param launch the base64url launch string exactly as received, {@code null} when absent
 */
public record CompoundState(String clientState, String launch) {}
