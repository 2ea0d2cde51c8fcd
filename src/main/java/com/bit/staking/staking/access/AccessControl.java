package com.bit.staking.staking.access;

import com.bit.staking.common.Pubkey;
import com.bit.staking.config.StakingProperties;
import com.bit.staking.result.Result;
import com.bit.staking.staking.StakingError;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * 权限控制：单一管理员 + 白名单，无角色层级
 * 管理员在构造时确定，之后不可变更
 */
@Component
public class AccessControl {

    private final Pubkey owner;

    private final Set<Pubkey> approved = new HashSet<>();

    @Autowired
    public AccessControl(StakingProperties properties) {
        this(properties.ownerKey());
    }

    public AccessControl(Pubkey owner) {
        if (owner == null) {
            throw new IllegalArgumentException("管理员不能为空");
        }
        this.owner = owner;
    }

    public Result<Void> requireOwner(Pubkey caller) {
        if (!owner.equals(caller)) {
            return Result.error(StakingError.NOT_OWNER, "caller=" + caller);
        }
        return Result.ok();
    }

    public Result<Void> requireApproved(Pubkey caller) {
        if (!isApproved(caller)) {
            return Result.error(StakingError.NOT_APPROVED, "caller=" + caller);
        }
        return Result.ok();
    }

    /**
     * 幂等：重复设置同一状态不报错
     */
    public void setApproval(Pubkey principal, boolean status) {
        if (status) {
            approved.add(principal);
        } else {
            approved.remove(principal);
        }
    }

    public boolean isApproved(Pubkey principal) {
        return principal != null && approved.contains(principal);
    }

    public Pubkey getOwner() {
        return owner;
    }
}
