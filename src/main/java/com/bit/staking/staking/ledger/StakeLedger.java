package com.bit.staking.staking.ledger;

import com.bit.staking.common.Pubkey;
import com.bit.staking.result.Result;
import com.bit.staking.staking.StakingError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 质押账本：账户 -> 档位 -> 质押记录，以及按账户的全局"已领取"标志
 * 非线程安全，读写由 StakingEngine 的全局读写锁保护
 */
@Slf4j
@Component
public class StakeLedger {

    private final Map<Pubkey, Map<Integer, StakeRecord>> records = new HashMap<>();

    // 领取过任意档位的账户（按账户，不按档位）
    private final Set<Pubkey> claimedPrincipals = new HashSet<>();

    /**
     * 不存在时返回零值记录
     */
    public StakeRecord getRecord(Pubkey principal, int tierId) {
        Map<Integer, StakeRecord> byTier = records.get(principal);
        if (byTier == null) {
            return StakeRecord.EMPTY;
        }
        return byTier.getOrDefault(tierId, StakeRecord.EMPTY);
    }

    /**
     * 累加写入：本金、奖励、解锁时间三项都与旧记录相加
     * 注意 unlockTimestamp' = unlockTimestamp + now + lockDuration，旧解锁时间也被累加
     */
    public Result<StakeRecord> applyDeposit(Pubkey principal, int tierId, long amount, long reward,
                                           long now, long lockDuration) {
        StakeRecord current = getRecord(principal, tierId);
        StakeRecord updated;
        try {
            updated = new StakeRecord(
                    Math.addExact(current.getStakedAmount(), amount),
                    Math.addExact(current.getAccruedReward(), reward),
                    Math.addExact(current.getUnlockTimestamp(), Math.addExact(now, lockDuration)),
                    false);
        } catch (ArithmeticException e) {
            return Result.error(StakingError.ARITHMETIC_OVERFLOW,
                    "质押记录累加溢出 principal=" + principal + ", tier=" + tierId);
        }
        put(principal, tierId, updated);
        return Result.ok(updated);
    }

    /**
     * 校验并领取：成功后记录清零并标记已领取，设置账户全局已领取标志
     * @return 应支付数量 = 本金 + 奖励
     */
    public Result<Long> applyClaim(Pubkey principal, int tierId, long now) {
        StakeRecord current = getRecord(principal, tierId);
        if (!current.isActive()) {
            return Result.error(StakingError.NO_ACTIVE_STAKE, "principal=" + principal + ", tier=" + tierId);
        }
        if (claimedPrincipals.contains(principal)) {
            return Result.error(StakingError.STAKE_ALREADY_CLAIMED, "principal=" + principal);
        }
        if (now <= current.getUnlockTimestamp()) {
            return Result.error(StakingError.STAKE_STILL_LOCKED,
                    "解锁时间 " + current.getUnlockTimestamp() + ", now=" + now);
        }
        long payout;
        try {
            payout = Math.addExact(current.getStakedAmount(), current.getAccruedReward());
        } catch (ArithmeticException e) {
            return Result.error(StakingError.ARITHMETIC_OVERFLOW, "本金+奖励溢出 principal=" + principal);
        }
        put(principal, tierId, new StakeRecord(0L, 0L, 0L, true));
        claimedPrincipals.add(principal);
        return Result.ok(payout);
    }

    public boolean hasClaimed(Pubkey principal) {
        return claimedPrincipals.contains(principal);
    }

    /**
     * 回滚：恢复记录与全局已领取标志到操作前的状态
     */
    public void restore(Pubkey principal, int tierId, StakeRecord previous, boolean previouslyClaimed) {
        if (StakeRecord.EMPTY.equals(previous)) {
            Map<Integer, StakeRecord> byTier = records.get(principal);
            if (byTier != null) {
                byTier.remove(tierId);
                if (byTier.isEmpty()) {
                    records.remove(principal);
                }
            }
        } else {
            put(principal, tierId, previous);
        }
        if (previouslyClaimed) {
            claimedPrincipals.add(principal);
        } else {
            claimedPrincipals.remove(principal);
        }
        log.debug("质押记录已回滚 principal={}, tier={}, record={}", principal, tierId, previous);
    }

    private void put(Pubkey principal, int tierId, StakeRecord record) {
        records.computeIfAbsent(principal, k -> new HashMap<>()).put(tierId, record);
    }
}
