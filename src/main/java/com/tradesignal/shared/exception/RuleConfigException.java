package com.tradesignal.shared.exception;

/**
 * 規則表設定錯誤（重複別名、負數距離、未知單位...）
 *
 * 啟動時拋出會讓 Spring context 啟動失敗，沒有降級模式。
 */
public class RuleConfigException extends RuntimeException {

    public RuleConfigException(String message) {
        super(message);
    }

    public RuleConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
