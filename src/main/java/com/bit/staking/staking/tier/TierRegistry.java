package com.bit.staking.staking.tier;

import com.bit.staking.config.StakingProperties;
import com.bit.staking.result.Result;
import com.bit.staking.staking.StakingError;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 档位注册表：档位ID -> 奖励费率与锁定时长
 * 非线程安全，读写由 StakingEngine 的全局读写锁保护
 */
@Slf4j
@Component
public class TierRegistry {

    private final StakingProperties properties;

    private final Map<Integer, Tier> tiers = new HashMap<>();

    private boolean seeded;

    public TierRegistry(StakingProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        seed(properties.getTiers());
    }

    /**
     * 写入初始档位，只允许执行一次
     */
    void seed(List<StakingProperties.TierDefinition> definitions) {
        if (seeded) {
            throw new IllegalStateException("初始档位已写入，不可重复初始化");
        }
        for (StakingProperties.TierDefinition def : definitions) {
            Result<Tier> result = setTier(def.getTierId(), def.getRewardRateBasisPoints(), def.getLockDuration());
            if (!result.isSuccess()) {
                throw new IllegalStateException("初始档位配置无效: " + result.getMessage());
            }
        }
        seeded = true;
        log.info("初始档位写入完成: {}", tiers.values());
    }

    /**
     * 覆盖写入档位（不合并旧值），调用方负责管理员校验
     */
    public Result<Tier> setTier(int tierId, int rewardRateBasisPoints, long lockDuration) {
        if (tierId <= 0) {
            return Result.error(StakingError.INVALID_TIER, "档位ID必须大于0: " + tierId);
        }
        if (rewardRateBasisPoints < 0 || lockDuration < 0) {
            return Result.error(StakingError.INVALID_TIER,
                    "费率与锁定时长不能为负数: rate=" + rewardRateBasisPoints + ", lock=" + lockDuration);
        }
        Tier tier = new Tier(tierId, rewardRateBasisPoints, lockDuration);
        tiers.put(tierId, tier);
        return Result.ok(tier);
    }

    /**
     * 未设置过的档位返回零值档位
     */
    public Tier getTier(int tierId) {
        Tier tier = tiers.get(tierId);
        return tier != null ? tier : Tier.unset(tierId);
    }

    public boolean isSeeded() {
        return seeded;
    }
}
