package com.bit.staking.staking.reward;

import com.bit.staking.staking.tier.Tier;
import org.springframework.stereotype.Component;

/**
 * 奖励计算：reward = amount * rate / 10000，向下取整
 * 乘积超出 long 范围时抛出 ArithmeticException，不做加宽
 */
@Component
public class RewardCalculator {

    public long computeReward(long amount, Tier tier) {
        return Math.multiplyExact(amount, (long) tier.getRewardRateBasisPoints()) / Tier.BASIS_POINTS;
    }
}
