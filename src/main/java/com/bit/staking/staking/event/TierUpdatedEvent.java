package com.bit.staking.staking.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 档位更新通知
 */
@Getter
@ToString
@AllArgsConstructor
public class TierUpdatedEvent {
    private final int tierId;
    private final int rewardRateBasisPoints;
    private final long lockDuration;
}
