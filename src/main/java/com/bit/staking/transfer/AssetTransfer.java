package com.bit.staking.transfer;

import com.bit.staking.common.Pubkey;

/**
 * 外部资产转账能力，质押引擎只调用转入/转出，不做代币记账
 * 返回 false 或抛出运行时异常均视为转账失败
 */
public interface AssetTransfer {

    /**
     * 从 from 转入 to（托管账户）
     */
    boolean transferIn(Pubkey from, Pubkey to, long amount);

    /**
     * 从托管账户转出给 to
     */
    boolean transferOut(Pubkey to, long amount);
}
