package net.gpumeter.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {

    @Test
    void terminal_states_are_absorbing() {
        for (JobStatus from : JobStatus.values()) {
            if (!from.isTerminal()) continue;
            for (JobStatus to : JobStatus.values()) {
                assertFalse(from.canTransitionTo(to), from + " -> " + to);
            }
        }
    }

    @Test
    void allowed_edges() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.PREPARING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED));
        assertTrue(JobStatus.PREPARING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.KILLED_NO_CREDITS));

        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertFalse(JobStatus.PREPARING.canTransitionTo(JobStatus.KILLED_NO_CREDITS));
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.PREPARING));
    }

    @Test
    void illegal_transition_cannot_be_constructed() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        assertThrows(IllegalStateException.class,
                () -> JobTransition.of("job-1", JobStatus.COMPLETED, JobStatus.RUNNING, now));
    }

    @Test
    void codes_round_trip_and_unknown_falls_back() {
        assertEquals("killed_no_credits", JobStatus.KILLED_NO_CREDITS.code());
        assertEquals(JobStatus.KILLED_NO_CREDITS, JobStatus.from("killed_no_credits"));
        assertEquals(JobStatus.UNKNOWN, JobStatus.from("exploded"));
        assertEquals(JobStatus.UNKNOWN, JobStatus.from(null));
    }

    @Test
    void tick_cost_uses_banker_rounding_at_two_decimals() {
        assertEquals(Money.of("1.00"), Money.tickCost(Money.of("1.00"), 60));
        assertEquals(Money.of("0.50"), Money.tickCost(Money.of("1.00"), 30));
        // 0.125 → 0.12
        assertEquals(Money.of("0.12"), Money.tickCost(Money.of("0.25"), 30));
        assertEquals(new BigDecimal("0.02"), Money.tickCost(Money.of("0.10"), 10));
    }

    @Test
    void memory_limit_is_parsed_in_docker_notation() {
        assertEquals(512L * 1024 * 1024, new ResourceConfig("512m", 1, 60).memoryBytes());
        assertEquals(4L * 1024 * 1024 * 1024, new ResourceConfig("4G", 1, 60).memoryBytes());
        assertThrows(IllegalArgumentException.class, () -> new ResourceConfig("lots", 1, 60).memoryBytes());
        assertThrows(IllegalArgumentException.class, () -> new ResourceConfig("4g", 0, 60));
    }
}
