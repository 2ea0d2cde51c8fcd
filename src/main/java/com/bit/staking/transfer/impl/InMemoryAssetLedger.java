package com.bit.staking.transfer.impl;

import com.bit.staking.common.Pubkey;
import com.bit.staking.config.StakingProperties;
import com.bit.staking.transfer.AssetTransfer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存资产账本：默认的 AssetTransfer 实现
 * 余额不足时转账返回 false，不抛异常
 */
@Slf4j
@Component
public class InMemoryAssetLedger implements AssetTransfer {

    private final Pubkey custody;

    private final Map<Pubkey, Long> balances = new ConcurrentHashMap<>();

    private StakingProperties properties;

    @Autowired
    public InMemoryAssetLedger(StakingProperties properties) {
        this(properties.custodyKey());
        this.properties = properties;
    }

    public InMemoryAssetLedger(Pubkey custody) {
        this.custody = custody;
    }

    @PostConstruct
    public void init() {
        if (properties == null) {
            return;
        }
        for (Map.Entry<String, Long> entry : properties.getAsset().getInitialBalances().entrySet()) {
            credit(Pubkey.fromHex(entry.getKey()), entry.getValue());
        }
        log.info("资产账本初始化完成，账户数: {}, 托管余额: {}", balances.size(), balanceOf(custody));
    }

    /**
     * 注资入口（代币发行由外部负责，这里只增加余额）
     * 与转账共用对象锁，move 的读后写期间不能插入注资
     */
    public synchronized void credit(Pubkey account, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("注资数量不能为负数: " + amount);
        }
        balances.merge(account, amount, Math::addExact);
    }

    public long balanceOf(Pubkey account) {
        return balances.getOrDefault(account, 0L);
    }

    public Pubkey getCustody() {
        return custody;
    }

    @Override
    public synchronized boolean transferIn(Pubkey from, Pubkey to, long amount) {
        return move(from, to, amount);
    }

    @Override
    public synchronized boolean transferOut(Pubkey to, long amount) {
        return move(custody, to, amount);
    }

    private boolean move(Pubkey from, Pubkey to, long amount) {
        if (amount < 0) {
            return false;
        }
        long fromBalance = balanceOf(from);
        if (fromBalance < amount) {
            log.warn("余额不足，转账失败: from={}, balance={}, amount={}", from, fromBalance, amount);
            return false;
        }
        if (from.equals(to)) {
            return true;
        }
        long toBalance = balanceOf(to);
        if (toBalance > Long.MAX_VALUE - amount) {
            log.warn("收款账户余额溢出，转账失败: to={}, amount={}", to, amount);
            return false;
        }
        balances.put(from, fromBalance - amount);
        balances.put(to, toBalance + amount);
        return true;
    }
}
