package com.bit.staking.staking.tier;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 质押档位：奖励费率（基点，10000 = 100%）与锁定时长（秒）
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class Tier {

    public static final int BASIS_POINTS = 10000;

    private final int tierId;

    private final int rewardRateBasisPoints;

    private final long lockDuration;

    /**
     * 从未设置过的档位：费率0，锁定0
     */
    public static Tier unset(int tierId) {
        return new Tier(tierId, 0, 0L);
    }

    /**
     * lockDuration 为0视为档位未配置
     */
    public boolean isConfigured() {
        return lockDuration != 0;
    }
}
