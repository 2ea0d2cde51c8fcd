package com.bit.staking.staking;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * 质押层错误类型（封闭枚举），每种类型对应唯一错误码
 */
public enum StakingError {
    NOT_OWNER(4001, "调用者不是管理员"),
    NOT_APPROVED(4002, "调用者不在白名单"),
    INVALID_TIER(4003, "无效档位（档位ID为0或档位未配置）"),
    ZERO_AMOUNT(4004, "质押数量必须大于0"),
    COOLDOWN_ACTIVE(4005, "质押冷却期未结束"),
    NO_ACTIVE_STAKE(4006, "没有有效质押记录"),
    STAKE_ALREADY_CLAIMED(4007, "该账户已领取过质押"),
    STAKE_STILL_LOCKED(4008, "质押仍在锁定期"),
    TRANSFER_FAILED(4009, "资产转账失败"),
    ARITHMETIC_OVERFLOW(4010, "数值溢出");

    @Getter
    private final int code;

    @Getter
    private final String desc;

    StakingError(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    // 缓存：错误码 -> 枚举实例
    private static final Map<Integer, StakingError> CODE_TO_ENUM = new HashMap<>();

    static {
        for (StakingError error : values()) {
            CODE_TO_ENUM.put(error.code, error);
        }
    }

    /**
     * 根据错误码获取枚举实例，未知错误码返回null
     */
    public static StakingError getByCode(Integer code) {
        return code == null ? null : CODE_TO_ENUM.get(code);
    }
}
