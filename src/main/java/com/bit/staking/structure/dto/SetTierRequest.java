package com.bit.staking.structure.dto;

import lombok.Data;

@Data
public class SetTierRequest {
    private int tierId;
    private int rewardRateBasisPoints;
    private long lockDuration;//秒
}
