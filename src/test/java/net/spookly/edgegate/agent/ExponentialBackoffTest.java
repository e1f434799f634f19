package net.spookly.edgegate.agent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ExponentialBackoffTest {

    @Test
    void doublesUntilCapped() {
        ExponentialBackoff backoff = new ExponentialBackoff(500, 3_000, 2.0);

        assertEquals(500, backoff.nextBackoff());
        assertEquals(1_000, backoff.nextBackoff());
        assertEquals(2_000, backoff.nextBackoff());
        assertEquals(3_000, backoff.nextBackoff());
        assertEquals(3_000, backoff.nextBackoff());
    }

    @Test
    void resetReturnsToMinimum() {
        ExponentialBackoff backoff = new ExponentialBackoff(500, 3_000, 2.0);
        backoff.nextBackoff();
        backoff.nextBackoff();

        backoff.reset();

        assertEquals(500, backoff.currentInterval());
        assertEquals(500, backoff.nextBackoff());
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(0, 1_000, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(2_000, 1_000, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(500, 1_000, 0.5));
    }
}
