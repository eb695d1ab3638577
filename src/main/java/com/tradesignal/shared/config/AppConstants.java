package com.tradesignal.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * 全域應用常數
 *
 * 透過 Spring 啟動時讀取 application.yml 設定，
 * 寫入 static 欄位供 ParsedSignal / SignalResult 的時間戳使用。
 *
 * 使用方式：{@code LocalDateTime.now(AppConstants.ZONE_ID)}
 */
@Component
public class AppConstants {

    /** 應用時區（ZoneId），未經 Spring 啟動（單元測試）時為 UTC */
    public static volatile ZoneId ZONE_ID = ZoneId.of("UTC");

    @Value("${app.timezone:UTC}")
    public void setTimezone(String tz) {
        ZONE_ID = ZoneId.of(tz);
    }
}
