/*
 * どこで: userhub API 層
 * 何を: ユーザー単位のダッシュボード集約 API を提供する
 * なぜ: クライアントからの多重呼び出しを減らし、一覧画面を 1 リクエストで描画できるようにするため
 */
package com.example.userhub.api;

import com.example.userhub.api.response.DashboardResponse;
import com.example.userhub.config.DashboardProperties;
import com.example.userhub.model.CallContext;
import com.example.userhub.model.DashboardRequest;
import com.example.userhub.service.DashboardService;
import java.time.Clock;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class DashboardController {

  static final String USER_ID_HEADER = "X-User-Id";
  static final String REQUEST_TIMEOUT_HEADER = "X-Request-Timeout-Ms";

  private final DashboardService dashboardService;
  private final DashboardProperties dashboardProperties;
  private final Clock clock;

  /**
   * 役割:
   * - X-User-Id の利用者について campaign/invite/profile/notification を統合して返す。
   *
   * 期待動作:
   * - 上流の一部失敗は metadata.degraded で表現し、200 を返す。
   * - campaign 取得失敗かつ stale キャッシュ無しのときだけ 503 を返す。
   */
  @GetMapping("/dashboard")
  public ResponseEntity<DashboardResponse> getDashboard(
      @RequestHeader(name = USER_ID_HEADER, required = false) String userId,
      @RequestHeader(name = REQUEST_TIMEOUT_HEADER, required = false) Long timeoutMillis,
      @RequestParam(name = "locale", required = false) String locale,
      @RequestParam(name = "campaignPreviewLimit", defaultValue = "0") int campaignPreviewLimit,
      @RequestParam(name = "invitePreviewLimit", defaultValue = "0") int invitePreviewLimit) {
    final CallContext context = CallContext.withTimeout(clock, resolveTimeout(timeoutMillis));
    final DashboardRequest request =
        new DashboardRequest(
            userId, normalizeLocale(locale), campaignPreviewLimit, invitePreviewLimit);
    return ResponseEntity.ok(
        DashboardResponse.from(dashboardService.getDashboard(context, request)));
  }

  private Duration resolveTimeout(Long timeoutMillis) {
    if (timeoutMillis != null && timeoutMillis > 0) {
      return Duration.ofMillis(timeoutMillis);
    }
    return dashboardProperties.requestTimeout();
  }

  private String normalizeLocale(String locale) {
    return locale == null ? "" : locale.trim();
  }
}
