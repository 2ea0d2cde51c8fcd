package com.bit.staking.structure.dto;

import com.bit.staking.staking.ledger.StakeRecord;
import lombok.Data;

@Data
public class StakeDetailsDTO {
    private String principal;
    private int tierId;
    private long stakedAmount;
    private long accruedReward;
    private long unlockTimestamp;
    private boolean claimed;

    public static StakeDetailsDTO of(String principal, int tierId, StakeRecord record) {
        StakeDetailsDTO dto = new StakeDetailsDTO();
        dto.setPrincipal(principal);
        dto.setTierId(tierId);
        dto.setStakedAmount(record.getStakedAmount());
        dto.setAccruedReward(record.getAccruedReward());
        dto.setUnlockTimestamp(record.getUnlockTimestamp());
        dto.setClaimed(record.isClaimed());
        return dto;
    }
}
