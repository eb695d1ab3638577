package com.tradesignal.shared.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 解析後的交易指令
 *
 * 範例: "BUY ETH H1 @2450"
 *   方向: LONG
 *   幣種: ETHUSDT
 *   週期: H1
 *   入場價: 2450.0（訊息沒帶 @價格 時為 null）
 */
@Value
@Builder
public class ParsedSignal {

    Direction direction;
    String asset;            // 標準幣種代號, e.g. "BTCUSD"
    String timeframe;        // 標準週期, e.g. "M5"
    Double entryPrice;       // 訊息中明確給的入場價 (可選)
    String originalText;     // 原始訊息，保留稽核用
    LocalDateTime parsedAt;

    public boolean hasEntryPrice() {
        return entryPrice != null;
    }
}
