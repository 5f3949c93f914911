/*
 * どこで: userhub API 層テスト
 * 何を: 例外ハンドラが失敗種別ごとに HTTP ステータスとエラーコードを返すことを検証する
 * なぜ: 上流障害と入力不備の区別がクライアント契約から崩れないようにするため
 */
package com.example.userhub.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.userhub.service.DependencyUnavailableException;
import com.example.userhub.service.UpstreamDependency;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class DashboardApiExceptionHandlerTest {

  private final DashboardApiExceptionHandler handler = new DashboardApiExceptionHandler();

  @Test
  void dependencyUnavailableMapsTo503() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleDependencyUnavailable(
            new DependencyUnavailableException(
                UpstreamDependency.GAME_CAMPAIGNS, new IllegalStateException("down")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody())
        .isEqualTo(
            new ApiErrorResponse(
                "DEPENDENCY_UNAVAILABLE", "dashboard dependency unavailable: game.campaigns"));
  }

  @Test
  void illegalArgumentMapsTo400() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleIllegalArgument(new IllegalArgumentException("userId is required"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse("BAD_REQUEST", "userId is required"));
  }

  @Test
  void unexpectedFailureHidesDetails() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleUnexpected(new IllegalStateException("secret internals"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse("INTERNAL_ERROR", "dashboard request failed"));
  }
}
