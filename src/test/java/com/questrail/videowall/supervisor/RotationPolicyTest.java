package com.questrail.videowall.supervisor;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RotationPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        RotationPolicy p = RotationPolicy.defaults();
        assertEquals(Duration.ofSeconds(1), p.tickInterval());
        assertEquals(300, p.refreshPeriodTicks());
        assertEquals(Duration.ofSeconds(15), p.playingTimeout());
        assertEquals(Duration.ofSeconds(30), p.joinTimeout());
        assertEquals(Duration.ofSeconds(1), p.pollInterval());
    }

    @Test
    void joinTimeoutMustExceedPlayingTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new RotationPolicy(
                Duration.ofSeconds(1), 300, Duration.ofSeconds(15), Duration.ofSeconds(15), Duration.ofSeconds(1)));
    }

    @Test
    void refreshPeriodMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> RotationPolicy.defaults().withRefreshPeriodTicks(0));
        assertEquals(60, RotationPolicy.defaults().withRefreshPeriodTicks(60).refreshPeriodTicks());
    }
}
