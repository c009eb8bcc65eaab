package io.taskvault.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryTest {
    @Test
    void transientFailureShouldBeRetriedWithDoublingBackoff() throws Exception {
        List<Long> sleeps = new ArrayList<>();
        Retry retry = new Retry(3, 50L, 1_000L, sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        String result = retry.call("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("device busy");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(50L, 100L), sleeps);
    }

    @Test
    void lastFailureShouldPropagateWhenAttemptsRunOut() {
        Retry retry = new Retry(2, 10L, 1_000L, millis -> {
        });
        AtomicInteger calls = new AtomicInteger();
        IOException last = new IOException("second");

        IOException thrown = assertThrows(IOException.class, () -> retry.run("always failing", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("first");
            }
            throw last;
        }));

        assertSame(last, thrown);
        assertEquals(2, calls.get());
    }

    @Test
    void permanentFailuresShouldNotBeRetried() {
        Retry retry = new Retry(5, 10L, 1_000L, millis -> {
            throw new AssertionError("should not back off");
        });
        AtomicInteger calls = new AtomicInteger();

        assertThrows(AccessDeniedException.class, () -> retry.run("denied", () -> {
            calls.incrementAndGet();
            throw new AccessDeniedException("/locked");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void backoffShouldBeCappedAtMaximum() {
        Retry retry = new Retry(10, 50L, 300L, millis -> {
        });

        assertEquals(50L, retry.backoffMs(1));
        assertEquals(100L, retry.backoffMs(2));
        assertEquals(200L, retry.backoffMs(3));
        assertEquals(300L, retry.backoffMs(4));
        assertEquals(300L, retry.backoffMs(9));
    }

    @Test
    void readOnlyFilesystemShouldBeClassifiedPermanent() {
        assertFalse(Retry.isRetryable(new FileSystemException("/data", null, "Read-only file system")));
        assertTrue(Retry.isRetryable(new FileSystemException("/data", null, "Device or resource busy")));
    }
}
