package com.tradesignal.shared.model;

/**
 * 訊號處理失敗的類型（呼叫端可見，不會中斷程序）
 */
public enum ErrorKind {
    NO_DIRECTION,           // 前三個 token 找不到方向
    NO_ASSET,               // 找不到已知幣種
    NO_TIMEFRAME,           // 找不到週期
    UNSUPPORTED_TIMEFRAME,  // 幣種沒有設定這個週期
    UNKNOWN_RULE,           // 計算器找不到 (幣種, 週期) 規則
    PRICE_UNAVAILABLE       // 訊息沒帶價格，預設價格表也沒有
}
