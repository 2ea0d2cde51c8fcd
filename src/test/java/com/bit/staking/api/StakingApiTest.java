package com.bit.staking.api;

import com.bit.staking.common.Pubkey;
import com.bit.staking.staking.StakingError;
import com.bit.staking.support.MutableClock;
import com.bit.staking.transfer.impl.InMemoryAssetLedger;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 走完整Spring容器：配置加载、默认档位、内存资产账本、接口层
 * 容器在测试间共享，每个用例使用不同的账户
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
public class StakingApiTest {

    private static final long DAY = 86400L;
    private static final long START = 1_700_000_000L;
    private static final String OWNER = "11".repeat(Pubkey.LENGTH);

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        public MutableClock testClock() {
            return new MutableClock(START);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MutableClock clock;

    @Autowired
    private InMemoryAssetLedger assetLedger;

    @Test
    void testDepositAndClaimOverHttp() throws Exception {
        String alice = "a1".repeat(Pubkey.LENGTH);
        clock.setEpochSecond(START);
        assetLedger.credit(Pubkey.fromHex(alice), 5000L);

        approve(alice).andExpect(jsonPath("$.success").value(true));

        postJson("/staking/deposit", alice, "{\"tierId\":1,\"amount\":1000}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.stakedAmount").value(1000))
                .andExpect(jsonPath("$.data.accruedReward").value(50))
                .andExpect(jsonPath("$.data.unlockTimestamp").value(START + 7 * DAY));
        assertEquals(4000L, assetLedger.balanceOf(Pubkey.fromHex(alice)));

        clock.setEpochSecond(START + 7 * DAY);
        postJson("/staking/claim", alice, "{\"tierId\":1}")
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(StakingError.STAKE_STILL_LOCKED.getCode()));

        clock.advanceSeconds(1);
        postJson("/staking/claim", alice, "{\"tierId\":1}")
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").value(1050));
        assertEquals(5050L, assetLedger.balanceOf(Pubkey.fromHex(alice)));

        mockMvc.perform(get("/staking/stake").param("principal", alice).param("tierId", "1"))
                .andExpect(jsonPath("$.data.stakedAmount").value(0))
                .andExpect(jsonPath("$.data.claimed").value(true));

        mockMvc.perform(get("/staking/principal").param("principal", alice))
                .andExpect(jsonPath("$.data.approved").value(true))
                .andExpect(jsonPath("$.data.claimed").value(true))
                .andExpect(jsonPath("$.data.lastDepositTime").value(START));
        log.info("HTTP 质押领取流程完成: {}", alice);
    }

    @Test
    void testDepositWithoutFundsFailsAtomically() throws Exception {
        String bob = "b2".repeat(Pubkey.LENGTH);
        clock.setEpochSecond(START);
        approve(bob);

        postJson("/staking/deposit", bob, "{\"tierId\":2,\"amount\":1000}")
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(StakingError.TRANSFER_FAILED.getCode()));

        mockMvc.perform(get("/staking/stake").param("principal", bob).param("tierId", "2"))
                .andExpect(jsonPath("$.data.stakedAmount").value(0))
                .andExpect(jsonPath("$.data.unlockTimestamp").value(0));
        mockMvc.perform(get("/staking/principal").param("principal", bob))
                .andExpect(jsonPath("$.data.lastDepositTime").value(0));
    }

    @Test
    void testAdminEndpointsRequireOwner() throws Exception {
        String carol = "c3".repeat(Pubkey.LENGTH);
        postJson("/staking/admin/tier", carol, "{\"tierId\":5,\"rewardRateBasisPoints\":2000,\"lockDuration\":86400}")
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(StakingError.NOT_OWNER.getCode()));

        postJson("/staking/admin/tier", OWNER, "{\"tierId\":0,\"rewardRateBasisPoints\":2000,\"lockDuration\":86400}")
                .andExpect(jsonPath("$.code").value(StakingError.INVALID_TIER.getCode()));

        postJson("/staking/admin/tier", OWNER, "{\"tierId\":6,\"rewardRateBasisPoints\":2000,\"lockDuration\":172800}")
                .andExpect(jsonPath("$.success").value(true));
        mockMvc.perform(get("/staking/tier").param("tierId", "6"))
                .andExpect(jsonPath("$.data.rewardRateBasisPoints").value(2000))
                .andExpect(jsonPath("$.data.lockDuration").value(172800));
    }

    @Test
    void testDefaultTiersLoadedFromConfiguration() throws Exception {
        mockMvc.perform(get("/staking/tier").param("tierId", "3"))
                .andExpect(jsonPath("$.data.rewardRateBasisPoints").value(1500))
                .andExpect(jsonPath("$.data.lockDuration").value(30 * DAY));
    }

    @Test
    void testNotApprovedDeposit() throws Exception {
        String dave = "d4".repeat(Pubkey.LENGTH);
        postJson("/staking/deposit", dave, "{\"tierId\":1,\"amount\":1000}")
                .andExpect(jsonPath("$.code").value(StakingError.NOT_APPROVED.getCode()));
    }

    @Test
    void testMalformedPrincipalRejected() throws Exception {
        postJson("/staking/deposit", "not-a-key", "{\"tierId\":1,\"amount\":1000}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
        mockMvc.perform(post("/staking/deposit").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tierId\":1,\"amount\":1000}"))
                .andExpect(status().isBadRequest());
    }

    private ResultActions approve(String principal) throws Exception {
        return postJson("/staking/admin/approval", OWNER,
                "{\"principal\":\"" + principal + "\",\"approved\":true}");
    }

    private ResultActions postJson(String path, String caller, String body) throws Exception {
        return mockMvc.perform(post(path)
                .header(StakingApi.PRINCIPAL_HEADER, caller)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }
}
