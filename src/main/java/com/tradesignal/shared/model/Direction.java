package com.tradesignal.shared.model;

/**
 * 交易方向
 */
public enum Direction {
    LONG, SHORT
}
