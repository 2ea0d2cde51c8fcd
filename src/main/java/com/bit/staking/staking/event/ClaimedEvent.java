package com.bit.staking.staking.event;

import com.bit.staking.common.Pubkey;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ClaimedEvent {
    private final Pubkey principal;
    private final int tierId;
    private final long payout;
}
