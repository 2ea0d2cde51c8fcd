package com.bit.staking.staking.claim;

import com.bit.staking.common.Pubkey;
import com.bit.staking.result.Result;
import com.bit.staking.staking.StakingError;
import com.bit.staking.staking.ledger.StakeLedger;
import com.bit.staking.staking.ledger.StakeRecord;
import com.bit.staking.transfer.AssetTransfer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 领取处理：校验锁定期与领取状态，计算支付额，修改账本，最后调用转出
 * 转出失败时账本记录与全局已领取标志恢复原状
 */
@Slf4j
@Component
public class ClaimProcessor {

    private final StakeLedger stakeLedger;

    private final AssetTransfer assetTransfer;

    public ClaimProcessor(StakeLedger stakeLedger, AssetTransfer assetTransfer) {
        this.stakeLedger = stakeLedger;
        this.assetTransfer = assetTransfer;
    }

    public Result<Long> claim(Pubkey principal, int tierId, long now) {
        StakeRecord previous = stakeLedger.getRecord(principal, tierId);
        boolean previouslyClaimed = stakeLedger.hasClaimed(principal);

        Result<Long> applied = stakeLedger.applyClaim(principal, tierId, now);
        if (!applied.isSuccess()) {
            return applied;
        }
        long payout = applied.getData();

        if (!transferOut(principal, payout)) {
            stakeLedger.restore(principal, tierId, previous, previouslyClaimed);
            return Result.error(StakingError.TRANSFER_FAILED, "转出失败 to=" + principal + ", amount=" + payout);
        }
        return Result.ok(payout);
    }

    private boolean transferOut(Pubkey to, long amount) {
        try {
            return assetTransfer.transferOut(to, amount);
        } catch (RuntimeException e) {
            log.error("资产转出异常 to={}, amount={}", to, amount, e);
            return false;
        }
    }
}
