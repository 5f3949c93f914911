/*
 * どこで: userhub API 層
 * 何を: API エラー応答の共通 DTO
 * なぜ: エラー形式を統一し、呼び出し側で機械的に処理できるようにするため
 */
package com.example.userhub.api;

public record ApiErrorResponse(String code, String message) {}
