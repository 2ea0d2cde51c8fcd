package com.bit.staking.staking.cooldown;

import com.bit.staking.common.Pubkey;
import com.bit.staking.staking.StakingError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CooldownGuardTest {

    private static final long DAY = 86400L;
    private static final Pubkey USER = Pubkey.filled((byte) 0x05);

    private final CooldownGuard guard = new CooldownGuard(DAY);

    @Test
    void testNeverDepositedHasNoCooldown() {
        assertTrue(guard.check(USER, 0L).isSuccess());
        assertEquals(0L, guard.getLastDepositTime(USER));
    }

    @Test
    void testCooldownWindow() {
        guard.record(USER, 1000L);
        assertEquals(StakingError.COOLDOWN_ACTIVE, guard.check(USER, 1000L).getError());
        assertEquals(StakingError.COOLDOWN_ACTIVE, guard.check(USER, 1000L + DAY - 1).getError());
        assertTrue(guard.check(USER, 1000L + DAY).isSuccess(), "恰好满一个冷却期即可再次质押");
    }

    @Test
    void testCheckDoesNotRecord() {
        guard.check(USER, 500L);
        assertEquals(0L, guard.getLastDepositTime(USER));
    }

    @Test
    void testRestore() {
        assertNull(guard.record(USER, 10L));
        guard.restore(USER, null);
        assertTrue(guard.check(USER, 11L).isSuccess());

        guard.record(USER, 10L);
        Long previous = guard.record(USER, 10L + DAY);
        assertEquals(10L, previous);
        guard.restore(USER, previous);
        assertEquals(10L, guard.getLastDepositTime(USER));
    }

    @Test
    void testCooldownNearLongMaxValue() {
        long last = Long.MAX_VALUE - 10;
        guard.record(USER, last);
        assertEquals(StakingError.COOLDOWN_ACTIVE, guard.check(USER, last + 1).getError());
        assertEquals(StakingError.COOLDOWN_ACTIVE, guard.check(USER, Long.MAX_VALUE).getError());
    }

    @Test
    void testElapsedBeyondLongRangePasses() {
        guard.record(USER, Long.MIN_VALUE);
        assertTrue(guard.check(USER, Long.MAX_VALUE).isSuccess());
        assertEquals(StakingError.COOLDOWN_ACTIVE, guard.check(USER, Long.MIN_VALUE + DAY - 1).getError());
    }

    @Test
    void testClockGoingBackwardsStaysInCooldown() {
        guard.record(USER, 10 * DAY);
        assertEquals(StakingError.COOLDOWN_ACTIVE, guard.check(USER, 5 * DAY).getError());
    }
}
