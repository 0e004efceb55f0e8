package io.fantasymcp.mcp_gateway.service;

import java.util.function.Function;

/**
 * upstream 呼び出し 1 回の結果。
 *
 * <p>404・429・認証失敗はシーズン探索で想定内の分岐になるため、例外ではなく状態として返す。
 */
public record ProviderResult<T>(Status status, T value, int httpStatus, String message) {

  public enum Status {
    OK,
    NOT_FOUND,
    UNAUTHORIZED,
    // JSON の代わりに HTML が返った場合。cookie 失効時の典型的な挙動
    NON_JSON,
    RATE_LIMITED,
    TIMEOUT,
    SERVER_ERROR,
    FAILED,
    INVALID_RESPONSE
  }

  public static <T> ProviderResult<T> ok(T value) {
    return new ProviderResult<>(Status.OK, value, 200, null);
  }

  public static <T> ProviderResult<T> failure(Status status, int httpStatus, String message) {
    return new ProviderResult<>(status, null, httpStatus, message);
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  /** 値を変換する。失敗結果は状態をそのまま引き継ぐ。 */
  public <R> ProviderResult<R> map(Function<T, R> mapper) {
    if (!isOk()) {
      return new ProviderResult<>(status, null, httpStatus, message);
    }
    return ProviderResult.ok(mapper.apply(value));
  }
}
