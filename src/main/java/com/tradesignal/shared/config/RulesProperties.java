package com.tradesignal.shared.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 規則表來源設定
 *
 * location 使用 Spring Resource 語法：classpath:rules.json、file:/etc/signal/rules.json ...
 */
@Getter
@ConfigurationProperties(prefix = "signal.rules")
public class RulesProperties {

    private final String location;

    public RulesProperties(@DefaultValue("classpath:rules.json") String location) {
        this.location = location;
    }
}
