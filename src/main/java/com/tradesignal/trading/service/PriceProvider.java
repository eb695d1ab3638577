package com.tradesignal.trading.service;

import com.tradesignal.shared.config.InstrumentConfig;
import com.tradesignal.shared.model.ParsedSignal;
import com.tradesignal.shared.model.SignalResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 入場價來源
 *
 * 1. 訊息中的 @價格（有限正數才採用）
 * 2. 設定檔的預設價格表
 *
 * 不查詢即時行情。
 */
@Component
@RequiredArgsConstructor
public class PriceProvider {

    private final InstrumentConfig instrumentConfig;

    public Optional<ResolvedPrice> resolve(ParsedSignal signal) {
        if (signal.hasEntryPrice() && isUsable(signal.getEntryPrice())) {
            return Optional.of(new ResolvedPrice(signal.getEntryPrice(), SignalResult.PriceSource.MESSAGE));
        }
        return instrumentConfig.defaultPriceFor(signal.getAsset())
                .filter(PriceProvider::isUsable)
                .map(price -> new ResolvedPrice(price, SignalResult.PriceSource.DEFAULT_TABLE));
    }

    private static boolean isUsable(double price) {
        return Double.isFinite(price) && price > 0;
    }

    public record ResolvedPrice(double price, SignalResult.PriceSource source) {}
}
