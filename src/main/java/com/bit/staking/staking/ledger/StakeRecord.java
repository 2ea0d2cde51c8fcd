package com.bit.staking.staking.ledger;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 质押记录，按 (账户, 档位) 唯一
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class StakeRecord {

    public static final StakeRecord EMPTY = new StakeRecord(0L, 0L, 0L, false);

    /**
     * 当前锁定的本金（累计）
     */
    private final long stakedAmount;

    /**
     * 应付奖励（质押时计算并累加，之后不再重算）
     */
    private final long accruedReward;

    /**
     * 最早可领取时间（秒）
     */
    private final long unlockTimestamp;

    /**
     * 是否已领取并清零
     */
    private final boolean claimed;

    public boolean isActive() {
        return stakedAmount != 0;
    }
}
