package com.bit.staking.structure.dto;

import lombok.Data;

/**
 * 账户级状态：白名单、全局已领取标志、最后质押时间
 */
@Data
public class PrincipalDTO {
    private String principal;
    private boolean approved;
    private boolean claimed;
    private long lastDepositTime;
}
