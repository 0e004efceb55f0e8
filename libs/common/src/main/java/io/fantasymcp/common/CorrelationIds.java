package io.fantasymcp.common;

import java.util.UUID;
import java.util.regex.Pattern;

/** 下流サービスへ伝播する X-Correlation-ID の採番と検証。 */
public final class CorrelationIds {

  public static final String HEADER_NAME = "X-Correlation-ID";

  private static final int MAX_LENGTH = 128;
  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._:-]+");

  private CorrelationIds() {}

  public static String newCorrelationId() {
    return UUID.randomUUID().toString();
  }

  /**
   * 受信ヘッダ値を再利用できるなら返し、空・過長・不正文字を含む場合は新規採番する。
   *
   * <p>ログ注入を避けるため英数字と {@code . _ : -} 以外は受け付けない。
   */
  public static String resolve(String incoming) {
    if (incoming == null) {
      return newCorrelationId();
    }
    final String trimmed = incoming.trim();
    if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH || !ALLOWED.matcher(trimmed).matches()) {
      return newCorrelationId();
    }
    return trimmed;
  }
}
