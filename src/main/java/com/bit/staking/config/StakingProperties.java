package com.bit.staking.config;

import com.bit.staking.common.Pubkey;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "staking")
public class StakingProperties {

    public static final long ONE_DAY = 24 * 60 * 60L;

    private String owner;//管理员公钥 hex
    private String custody;//托管账户公钥 hex，质押资产转入此账户
    private long cooldownSeconds = ONE_DAY;//同一账户两次质押的最小间隔

    /**
     * 启动时写入的初始档位，未配置时使用业务默认值 5%/7天 10%/14天 15%/30天
     */
    private List<TierDefinition> tiers = defaultTiers();

    private Asset asset = new Asset();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierDefinition {
        private int tierId;
        private int rewardRateBasisPoints;
        private long lockDuration;
    }

    @Data
    public static class Asset {
        //内存资产账本的初始余额 公钥hex -> 数量
        private Map<String, Long> initialBalances = new LinkedHashMap<>();
    }

    public static List<TierDefinition> defaultTiers() {
        List<TierDefinition> defaults = new ArrayList<>();
        defaults.add(new TierDefinition(1, 500, 7 * ONE_DAY));
        defaults.add(new TierDefinition(2, 1000, 14 * ONE_DAY));
        defaults.add(new TierDefinition(3, 1500, 30 * ONE_DAY));
        return defaults;
    }

    @PostConstruct
    public void init() {
        if (cooldownSeconds < 0) {
            throw new IllegalStateException("staking.cooldown-seconds 不能为负数: " + cooldownSeconds);
        }
        // 提前解析，格式错误时启动失败
        Pubkey ownerKey = ownerKey();
        Pubkey custodyKey = custodyKey();
        log.info("质押配置加载完成，管理员: {}, 托管账户: {}, 冷却期: {}s, 初始档位数: {}",
                ownerKey, custodyKey, cooldownSeconds, tiers.size());
    }

    public Pubkey ownerKey() {
        if (owner == null) {
            throw new IllegalStateException("未配置 staking.owner");
        }
        return Pubkey.fromHex(owner);
    }

    public Pubkey custodyKey() {
        if (custody == null) {
            throw new IllegalStateException("未配置 staking.custody");
        }
        return Pubkey.fromHex(custody);
    }
}
