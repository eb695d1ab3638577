package com.tradesignal.shared.model;

import java.time.LocalDateTime;

/**
 * 處理統計快照
 *
 * @param signalsProcessed 成功產生的訊號數
 * @param failedSignals    未產生點位的訊息數（解析失敗、沒有價格、沒有規則）
 * @param lastSignalAt     最後一次成功的時間，尚未有成功訊號時為 null
 */
public record PipelineStats(long signalsProcessed, long failedSignals, LocalDateTime lastSignalAt) {
}
