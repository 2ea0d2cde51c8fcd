package com.bit.staking.staking.impl;

import com.bit.staking.common.Pubkey;
import com.bit.staking.config.StakingProperties;
import com.bit.staking.result.Result;
import com.bit.staking.staking.StakingEngine;
import com.bit.staking.staking.StakingError;
import com.bit.staking.staking.access.AccessControl;
import com.bit.staking.staking.claim.ClaimProcessor;
import com.bit.staking.staking.cooldown.CooldownGuard;
import com.bit.staking.staking.event.ClaimedEvent;
import com.bit.staking.staking.event.DepositedEvent;
import com.bit.staking.staking.event.TierUpdatedEvent;
import com.bit.staking.staking.event.WhitelistChangedEvent;
import com.bit.staking.staking.ledger.StakeLedger;
import com.bit.staking.staking.ledger.StakeRecord;
import com.bit.staking.staking.reward.RewardCalculator;
import com.bit.staking.staking.tier.Tier;
import com.bit.staking.staking.tier.TierRegistry;
import com.bit.staking.transfer.AssetTransfer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 质押引擎：唯一对外入口，按 权限 -> 冷却 -> 档位 -> 奖励 -> 账本 -> 转账 的顺序编排
 * 写操作持有全局写锁，查询持有读锁，查询不会看到写了一半的状态
 */
@Slf4j
@Service
public class StakingEngineImpl implements StakingEngine {

    private final TierRegistry tierRegistry;
    private final AccessControl accessControl;
    private final CooldownGuard cooldownGuard;
    private final StakeLedger stakeLedger;
    private final RewardCalculator rewardCalculator;
    private final ClaimProcessor claimProcessor;
    private final AssetTransfer assetTransfer;
    private final ApplicationEventPublisher eventPublisher;
    private final Pubkey custody;

    // 全局串行点
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    @Autowired
    public StakingEngineImpl(TierRegistry tierRegistry,
                             AccessControl accessControl,
                             CooldownGuard cooldownGuard,
                             StakeLedger stakeLedger,
                             RewardCalculator rewardCalculator,
                             ClaimProcessor claimProcessor,
                             AssetTransfer assetTransfer,
                             ApplicationEventPublisher eventPublisher,
                             StakingProperties properties) {
        this(tierRegistry, accessControl, cooldownGuard, stakeLedger, rewardCalculator, claimProcessor,
                assetTransfer, eventPublisher, properties.custodyKey());
    }

    public StakingEngineImpl(TierRegistry tierRegistry,
                             AccessControl accessControl,
                             CooldownGuard cooldownGuard,
                             StakeLedger stakeLedger,
                             RewardCalculator rewardCalculator,
                             ClaimProcessor claimProcessor,
                             AssetTransfer assetTransfer,
                             ApplicationEventPublisher eventPublisher,
                             Pubkey custody) {
        this.tierRegistry = tierRegistry;
        this.accessControl = accessControl;
        this.cooldownGuard = cooldownGuard;
        this.stakeLedger = stakeLedger;
        this.rewardCalculator = rewardCalculator;
        this.claimProcessor = claimProcessor;
        this.assetTransfer = assetTransfer;
        this.eventPublisher = eventPublisher;
        this.custody = custody;
    }

    @Override
    public Result<Tier> setTier(Pubkey caller, int tierId, int rewardRateBasisPoints, long lockDuration) {
        rwLock.writeLock().lock();
        try {
            Result<Void> owner = accessControl.requireOwner(caller);
            if (!owner.isSuccess()) {
                return rejected("setTier", owner);
            }
            Result<Tier> result = tierRegistry.setTier(tierId, rewardRateBasisPoints, lockDuration);
            if (!result.isSuccess()) {
                return rejected("setTier", result);
            }
            Tier tier = result.getData();
            publish(new TierUpdatedEvent(tier.getTierId(),
                    tier.getRewardRateBasisPoints(), tier.getLockDuration()));
            log.info("档位已更新: {}", tier);
            return result;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public Result<Boolean> setApproval(Pubkey caller, Pubkey principal, boolean approved) {
        rwLock.writeLock().lock();
        try {
            Result<Void> owner = accessControl.requireOwner(caller);
            if (!owner.isSuccess()) {
                return rejected("setApproval", owner);
            }
            accessControl.setApproval(principal, approved);
            publish(new WhitelistChangedEvent(principal, approved));
            log.info("白名单已更新: {} -> {}", principal, approved);
            return Result.ok(approved);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public Result<StakeRecord> deposit(Pubkey caller, int tierId, long amount, long now) {
        rwLock.writeLock().lock();
        try {
            Result<Void> approved = accessControl.requireApproved(caller);
            if (!approved.isSuccess()) {
                return rejected("deposit", approved);
            }
            Result<Void> cooldown = cooldownGuard.check(caller, now);
            if (!cooldown.isSuccess()) {
                return rejected("deposit", cooldown);
            }
            Tier tier = tierRegistry.getTier(tierId);
            if (!tier.isConfigured()) {
                return rejected("deposit", Result.error(StakingError.INVALID_TIER, "档位未配置: " + tierId));
            }
            if (amount <= 0) {
                return rejected("deposit", Result.error(StakingError.ZERO_AMOUNT, "amount=" + amount));
            }
            long reward;
            try {
                reward = rewardCalculator.computeReward(amount, tier);
            } catch (ArithmeticException e) {
                return rejected("deposit", Result.error(StakingError.ARITHMETIC_OVERFLOW,
                        "奖励计算溢出 amount=" + amount + ", rate=" + tier.getRewardRateBasisPoints()));
            }

            // 先写账本和冷却，转账失败时整体回滚
            StakeRecord previous = stakeLedger.getRecord(caller, tierId);
            boolean previouslyClaimed = stakeLedger.hasClaimed(caller);
            Result<StakeRecord> applied = stakeLedger.applyDeposit(caller, tierId, amount, reward, now,
                    tier.getLockDuration());
            if (!applied.isSuccess()) {
                return rejected("deposit", applied);
            }
            Long previousDepositTime = cooldownGuard.record(caller, now);

            if (!transferIn(caller, amount)) {
                stakeLedger.restore(caller, tierId, previous, previouslyClaimed);
                cooldownGuard.restore(caller, previousDepositTime);
                return rejected("deposit", Result.error(StakingError.TRANSFER_FAILED,
                        "转入失败 from=" + caller + ", amount=" + amount));
            }

            StakeRecord record = applied.getData();
            publish(new DepositedEvent(caller, tierId, amount, reward, record.getUnlockTimestamp()));
            log.info("质押成功: principal={}, tier={}, amount={}, reward={}, record={}",
                    caller, tierId, amount, reward, record);
            return applied;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public Result<Long> claim(Pubkey caller, int tierId, long now) {
        rwLock.writeLock().lock();
        try {
            Result<Void> approved = accessControl.requireApproved(caller);
            if (!approved.isSuccess()) {
                return rejected("claim", approved);
            }
            Result<Long> result = claimProcessor.claim(caller, tierId, now);
            if (!result.isSuccess()) {
                return rejected("claim", result);
            }
            publish(new ClaimedEvent(caller, tierId, result.getData()));
            log.info("领取成功: principal={}, tier={}, payout={}", caller, tierId, result.getData());
            return result;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public StakeRecord getStakeDetails(Pubkey principal, int tierId) {
        rwLock.readLock().lock();
        try {
            return stakeLedger.getRecord(principal, tierId);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public Tier getTier(int tierId) {
        rwLock.readLock().lock();
        try {
            return tierRegistry.getTier(tierId);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public boolean isApproved(Pubkey principal) {
        rwLock.readLock().lock();
        try {
            return accessControl.isApproved(principal);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public boolean hasClaimed(Pubkey principal) {
        rwLock.readLock().lock();
        try {
            return stakeLedger.hasClaimed(principal);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public long getLastDepositTime(Pubkey principal) {
        rwLock.readLock().lock();
        try {
            return cooldownGuard.getLastDepositTime(principal);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public Pubkey getOwner() {
        return accessControl.getOwner();
    }

    private boolean transferIn(Pubkey from, long amount) {
        try {
            return assetTransfer.transferIn(from, custody, amount);
        } catch (RuntimeException e) {
            log.error("资产转入异常 from={}, amount={}", from, amount, e);
            return false;
        }
    }

    /**
     * 事件在状态提交之后发布，监听器异常只记录日志，不回传给已经生效的操作
     */
    private void publish(Object event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("事件监听器处理失败，操作已生效: {}", event, e);
        }
    }

    private <T> Result<T> rejected(String operation, Result<?> failure) {
        log.warn("{} 被拒绝: {}", operation, failure.getMessage());
        return failure.propagate();
    }
}
