package com.bit.staking.structure.dto;

import lombok.Data;

@Data
public class ApprovalRequest {
    private String principal;//公钥hex
    private boolean approved;
}
