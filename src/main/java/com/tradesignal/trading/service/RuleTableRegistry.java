package com.tradesignal.trading.service;

import com.tradesignal.shared.config.RulesProperties;
import com.tradesignal.shared.exception.RuleConfigException;
import com.tradesignal.shared.model.RuleTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 目前生效的規則表
 *
 * 啟動時載入一次，載入失敗直接讓 context 啟動失敗。
 * reload() 先完整建出新表再原子替換，讀取端拿到的永遠是完整的一張表。
 */
@Slf4j
@Component
public class RuleTableRegistry {

    private final RuleTableLoader loader;
    private final ResourceLoader resourceLoader;
    private final RulesProperties rulesProperties;
    private final AtomicReference<RuleTable> current;

    public RuleTableRegistry(RuleTableLoader loader, ResourceLoader resourceLoader,
                             RulesProperties rulesProperties) {
        this.loader = loader;
        this.resourceLoader = resourceLoader;
        this.rulesProperties = rulesProperties;
        this.current = new AtomicReference<>(loadConfigured());
    }

    public RuleTable current() {
        return current.get();
    }

    /**
     * 從設定的位置重新載入規則表
     *
     * @return 新的規則表
     * @throws RuleConfigException 新設定有誤時拋出，舊表維持生效
     */
    public RuleTable reload() {
        RuleTable fresh;
        try {
            fresh = loadConfigured();
        } catch (RuleConfigException e) {
            log.error("規則表重新載入失敗，維持舊設定: {}", e.getMessage());
            throw e;
        }
        current.set(fresh);
        log.info("規則表已重新載入: {} 個幣種", fresh.assetSymbols().size());
        return fresh;
    }

    private RuleTable loadConfigured() {
        String location = rulesProperties.getLocation();
        return loader.load(resourceLoader.getResource(location));
    }
}
