package com.tradesignal.shared.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 完整處理流程（解析 → 取價 → 計算）的輸出
 *
 * 這是交給格式化 / 發送端的中性資料，本身不含任何顯示格式。
 * 成功時 signal、levels 都有值；失敗時只有 error（解析成功但取價失敗時 signal 仍保留）。
 */
@Value
@Builder
public class SignalResult {

    boolean success;
    ParsedSignal signal;
    TradingLevels levels;
    SignalError error;
    PriceSource priceSource;
    LocalDateTime processedAt;

    public enum PriceSource {
        MESSAGE,        // 訊息中的 @價格
        DEFAULT_TABLE   // 設定檔的預設價格
    }
}
