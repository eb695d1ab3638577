package com.tradesignal.trading.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradesignal.shared.config.InstrumentConfig;
import com.tradesignal.shared.config.RulesProperties;
import com.tradesignal.shared.model.RuleTable;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Map;

/**
 * 測試共用的規則表 / 商品設定（src/test/resources/rules-test.json）
 */
final class TestFixtures {

    static final String TEST_RULES = "classpath:rules-test.json";

    private TestFixtures() {
    }

    static RuleTableLoader loader() {
        return new RuleTableLoader(new ObjectMapper());
    }

    static RuleTableRegistry registry() {
        return registry(TEST_RULES);
    }

    static RuleTableRegistry registry(String location) {
        return new RuleTableRegistry(loader(), new DefaultResourceLoader(), new RulesProperties(location));
    }

    static RuleTable rules() {
        return registry().current();
    }

    static InstrumentConfig instruments() {
        return new InstrumentConfig(
                0.0001,
                1.0,
                Map.of("USDJPY", 0.01, "eurusd", 0.0001),
                Map.of("US30", 1.0, "SPX500", 0.1),
                Map.of("BTCUSD", 65000.0, "XAUUSD", 2350.0));
    }
}
