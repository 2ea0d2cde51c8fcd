package com.bit.staking.api;

import com.bit.staking.common.Pubkey;
import com.bit.staking.result.Result;
import com.bit.staking.staking.StakingEngine;
import com.bit.staking.staking.ledger.StakeRecord;
import com.bit.staking.staking.tier.Tier;
import com.bit.staking.structure.dto.ApprovalRequest;
import com.bit.staking.structure.dto.ClaimRequest;
import com.bit.staking.structure.dto.DepositRequest;
import com.bit.staking.structure.dto.PrincipalDTO;
import com.bit.staking.structure.dto.SetTierRequest;
import com.bit.staking.structure.dto.StakeDetailsDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;

/**
 * 质押接口，调用者身份取自请求头 X-Principal（公钥hex），不做签名校验
 */
@Slf4j
@RestController
@RequestMapping("/staking")
public class StakingApi {

    public static final String PRINCIPAL_HEADER = "X-Principal";

    @Autowired
    private StakingEngine stakingEngine;

    @Autowired
    private Clock clock;

    // 设置档位（管理员）
    @PostMapping("/admin/tier")
    public Result<Tier> setTier(@RequestHeader(PRINCIPAL_HEADER) String caller,
                                @RequestBody SetTierRequest request) {
        return stakingEngine.setTier(Pubkey.fromHex(caller), request.getTierId(),
                request.getRewardRateBasisPoints(), request.getLockDuration());
    }

    // 设置白名单（管理员）
    @PostMapping("/admin/approval")
    public Result<Boolean> setApproval(@RequestHeader(PRINCIPAL_HEADER) String caller,
                                       @RequestBody ApprovalRequest request) {
        return stakingEngine.setApproval(Pubkey.fromHex(caller), Pubkey.fromHex(request.getPrincipal()),
                request.isApproved());
    }

    // 质押
    @PostMapping("/deposit")
    public Result<StakeRecord> deposit(@RequestHeader(PRINCIPAL_HEADER) String caller,
                                       @RequestBody DepositRequest request) {
        return stakingEngine.deposit(Pubkey.fromHex(caller), request.getTierId(), request.getAmount(), now());
    }

    // 领取本金+奖励
    @PostMapping("/claim")
    public Result<Long> claim(@RequestHeader(PRINCIPAL_HEADER) String caller,
                              @RequestBody ClaimRequest request) {
        return stakingEngine.claim(Pubkey.fromHex(caller), request.getTierId(), now());
    }

    // 查询质押记录
    @GetMapping("/stake")
    public Result<StakeDetailsDTO> getStakeDetails(@RequestParam String principal, @RequestParam int tierId) {
        StakeRecord record = stakingEngine.getStakeDetails(Pubkey.fromHex(principal), tierId);
        return Result.ok(StakeDetailsDTO.of(principal, tierId, record));
    }

    // 查询档位
    @GetMapping("/tier")
    public Result<Tier> getTier(@RequestParam int tierId) {
        return Result.ok(stakingEngine.getTier(tierId));
    }

    // 查询账户状态
    @GetMapping("/principal")
    public Result<PrincipalDTO> getPrincipal(@RequestParam String principal) {
        Pubkey key = Pubkey.fromHex(principal);
        PrincipalDTO dto = new PrincipalDTO();
        dto.setPrincipal(key.toHex());
        dto.setApproved(stakingEngine.isApproved(key));
        dto.setClaimed(stakingEngine.hasClaimed(key));
        dto.setLastDepositTime(stakingEngine.getLastDepositTime(key));
        return Result.ok(dto);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
