package com.bit.staking.structure.dto;

import lombok.Data;

@Data
public class DepositRequest {
    private int tierId;
    private long amount;
}
