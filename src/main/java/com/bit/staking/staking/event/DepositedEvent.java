package com.bit.staking.staking.event;

import com.bit.staking.common.Pubkey;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 质押成功通知，unlockTimestamp 为累加后的解锁时间
 */
@Getter
@ToString
@AllArgsConstructor
public class DepositedEvent {
    private final Pubkey principal;
    private final int tierId;
    private final long amount;
    private final long reward;
    private final long unlockTimestamp;
}
