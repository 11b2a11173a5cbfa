package io.tasks4j.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class OnceTriggerTest {

    private static final Instant AT = Instant.parse("2026-05-01T09:00:00Z");

    @Test
    void firesAtTargetWhileInFuture() {
        assertEquals(AT, new OnceTrigger(AT).nextFireAfter(AT.minusSeconds(60)));
    }

    @Test
    void exhaustedOnceTargetReached() {
        OnceTrigger trigger = new OnceTrigger(AT);

        assertNull(trigger.nextFireAfter(AT));
        assertNull(trigger.nextFireAfter(AT.plusSeconds(1)));
    }

    @Test
    void isNotRecurring() {
        OnceTrigger trigger = new OnceTrigger(AT);

        assertEquals(TriggerType.ONCE, trigger.type());
        assertFalse(trigger.type().isRecurring());
        assertEquals("2026-05-01T09:00:00Z", trigger.describe().get("at"));
    }
}
