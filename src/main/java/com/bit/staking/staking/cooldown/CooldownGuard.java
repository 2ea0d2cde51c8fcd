package com.bit.staking.staking.cooldown;

import com.bit.staking.common.Pubkey;
import com.bit.staking.config.StakingProperties;
import com.bit.staking.result.Result;
import com.bit.staking.staking.StakingError;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * 质押冷却：按账户记录最后一次质押时间，跨所有档位共享
 */
@Component
public class CooldownGuard {

    private final long cooldownPeriod;

    // 公钥 -> 最后质押时间（秒），从未质押的账户不在表中
    private final Map<Pubkey, Long> lastDepositTime = new HashMap<>();

    @Autowired
    public CooldownGuard(StakingProperties properties) {
        this(properties.getCooldownSeconds());
    }

    public CooldownGuard(long cooldownPeriod) {
        this.cooldownPeriod = cooldownPeriod;
    }

    /**
     * 仅校验，不写入；质押完成后由调用方执行 record
     */
    public Result<Void> check(Pubkey principal, long now) {
        Long last = lastDepositTime.get(principal);
        if (last != null && inCooldown(last, now)) {
            return Result.error(StakingError.COOLDOWN_ACTIVE,
                    "上次质押 " + last + ", 冷却期 " + cooldownPeriod + "s, now=" + now);
        }
        return Result.ok();
    }

    // 用差值比较，last 接近 Long.MAX_VALUE 时 last + cooldownPeriod 会溢出
    private boolean inCooldown(long last, long now) {
        if (now < last) {
            return true;
        }
        long elapsed = now - last;
        // 差值溢出为负说明间隔已超出 long 范围，必然超过冷却期
        return elapsed >= 0 && elapsed < cooldownPeriod;
    }

    /**
     * @return 写入前的时间，从未质押为null（用于回滚）
     */
    public Long record(Pubkey principal, long now) {
        return lastDepositTime.put(principal, now);
    }

    /**
     * 回滚 record 的写入
     */
    public void restore(Pubkey principal, Long previous) {
        if (previous == null) {
            lastDepositTime.remove(principal);
        } else {
            lastDepositTime.put(principal, previous);
        }
    }

    /**
     * 从未质押返回0
     */
    public long getLastDepositTime(Pubkey principal) {
        Long last = lastDepositTime.get(principal);
        return last == null ? 0L : last;
    }
}
