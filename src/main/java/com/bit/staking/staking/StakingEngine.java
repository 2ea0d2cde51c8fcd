package com.bit.staking.staking;

import com.bit.staking.common.Pubkey;
import com.bit.staking.result.Result;
import com.bit.staking.staking.ledger.StakeRecord;
import com.bit.staking.staking.tier.Tier;

/**
 * 核心类：StakingEngine（接口） + StakingEngineImpl（实现）
 * 职责：
 * 管理员设置档位 / 白名单；
 * 白名单账户按档位质押、到期领取本金与奖励；
 * 对外提供质押记录与档位查询。
 * 所有写操作全局串行执行，失败时不留下任何状态变化；
 * 时间 now 由调用方提供（秒），引擎自身不取时间。
 */
public interface StakingEngine {

    /**
     * 设置档位（仅管理员），覆盖旧值
     * @param caller 调用者
     * @param tierId 档位ID，0无效
     * @param rewardRateBasisPoints 奖励费率（基点）
     * @param lockDuration 锁定时长（秒）
     * @return 写入后的档位
     */
    Result<Tier> setTier(Pubkey caller, int tierId, int rewardRateBasisPoints, long lockDuration);

    /**
     * 设置白名单状态（仅管理员），幂等
     * @return 设置后的状态
     */
    Result<Boolean> setApproval(Pubkey caller, Pubkey principal, boolean approved);

    /**
     * 质押
     * @return 累加后的质押记录
     */
    Result<StakeRecord> deposit(Pubkey caller, int tierId, long amount, long now);

    /**
     * 领取本金+奖励
     * @return 支付数量
     */
    Result<Long> claim(Pubkey caller, int tierId, long now);

    StakeRecord getStakeDetails(Pubkey principal, int tierId);

    Tier getTier(int tierId);

    boolean isApproved(Pubkey principal);

    boolean hasClaimed(Pubkey principal);

    /**
     * 从未质押返回0
     */
    long getLastDepositTime(Pubkey principal);

    Pubkey getOwner();
}
