package com.bit.staking.staking.tier;

import com.bit.staking.config.StakingProperties;
import com.bit.staking.result.Result;
import com.bit.staking.staking.StakingError;
import com.bit.staking.support.StakingFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TierRegistryTest {

    private static final long DAY = StakingProperties.ONE_DAY;

    private TierRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TierRegistry(StakingFixture.properties());
        registry.init();
    }

    @Test
    void testDefaultTiersSeeded() {
        assertTrue(registry.isSeeded());
        assertEquals(new Tier(1, 500, 7 * DAY), registry.getTier(1));
        assertEquals(new Tier(2, 1000, 14 * DAY), registry.getTier(2));
        assertEquals(new Tier(3, 1500, 30 * DAY), registry.getTier(3));
    }

    @Test
    void testSeedIsNotRerunnable() {
        assertThrows(IllegalStateException.class, registry::init);
    }

    @Test
    void testInvalidSeedFailsStartup() {
        TierRegistry fresh = new TierRegistry(StakingFixture.properties());
        assertThrows(IllegalStateException.class,
                () -> fresh.seed(List.of(new StakingProperties.TierDefinition(0, 100, DAY))));
        assertFalse(fresh.isSeeded());
    }

    @Test
    void testUnsetTierIsZeroValue() {
        Tier tier = registry.getTier(42);
        assertEquals(0, tier.getRewardRateBasisPoints());
        assertEquals(0L, tier.getLockDuration());
        assertFalse(tier.isConfigured());
    }

    @Test
    void testLastWriterWins() {
        registry.setTier(7, 100, DAY);
        registry.setTier(7, 250, 3 * DAY);
        Result<Tier> last = registry.setTier(7, 300, 2 * DAY);
        assertTrue(last.isSuccess());
        assertEquals(new Tier(7, 300, 2 * DAY), registry.getTier(7));

        registry.setTier(1, 0, 0L);
        assertEquals(new Tier(1, 0, 0L), registry.getTier(1), "覆盖写入，不与旧值合并");
        assertFalse(registry.getTier(1).isConfigured());
    }

    @Test
    void testTierZeroRejected() {
        Result<Tier> result = registry.setTier(0, 500, DAY);
        assertFalse(result.isSuccess());
        assertEquals(StakingError.INVALID_TIER, result.getError());
        assertEquals(Tier.unset(0), registry.getTier(0));
    }

    @Test
    void testNegativeParametersRejected() {
        assertEquals(StakingError.INVALID_TIER, registry.setTier(-1, 500, DAY).getError());
        assertEquals(StakingError.INVALID_TIER, registry.setTier(5, -1, DAY).getError());
        assertEquals(StakingError.INVALID_TIER, registry.setTier(5, 500, -DAY).getError());
        assertFalse(registry.getTier(5).isConfigured());
    }
}
