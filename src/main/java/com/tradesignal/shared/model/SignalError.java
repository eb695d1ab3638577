package com.tradesignal.shared.model;

/**
 * 以值回傳的錯誤：類型 + 給人看的訊息
 */
public record SignalError(ErrorKind kind, String message) {
}
