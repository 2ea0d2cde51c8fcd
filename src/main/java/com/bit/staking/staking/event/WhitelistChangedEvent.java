package com.bit.staking.staking.event;

import com.bit.staking.common.Pubkey;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 白名单变更通知，无论状态是否变化都会发出
 */
@Getter
@ToString
@AllArgsConstructor
public class WhitelistChangedEvent {
    private final Pubkey principal;
    private final boolean approved;
}
