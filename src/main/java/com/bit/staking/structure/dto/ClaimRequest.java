package com.bit.staking.structure.dto;

import lombok.Data;

@Data
public class ClaimRequest {
    private int tierId;
}
