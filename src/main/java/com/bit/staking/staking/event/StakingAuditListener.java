package com.bit.staking.staking.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 审计日志：记录质押引擎发出的所有通知
 */
@Slf4j
@Component
public class StakingAuditListener {

    @EventListener
    public void onTierUpdated(TierUpdatedEvent event) {
        log.info("[审计] 档位更新 | tier: {} | 费率: {}bps | 锁定: {}s",
                event.getTierId(), event.getRewardRateBasisPoints(), event.getLockDuration());
    }

    @EventListener
    public void onWhitelistChanged(WhitelistChangedEvent event) {
        log.info("[审计] 白名单变更 | 账户: {} | 状态: {}", event.getPrincipal(), event.isApproved());
    }

    @EventListener
    public void onDeposited(DepositedEvent event) {
        log.info("[审计] 质押 | 账户: {} | tier: {} | 数量: {} | 奖励: {} | 解锁: {}",
                event.getPrincipal(), event.getTierId(), event.getAmount(), event.getReward(),
                event.getUnlockTimestamp());
    }

    @EventListener
    public void onClaimed(ClaimedEvent event) {
        log.info("[审计] 领取 | 账户: {} | tier: {} | 支付: {}",
                event.getPrincipal(), event.getTierId(), event.getPayout());
    }
}
