/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.steady.driver;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class RetryTest {

    Retry retry = new Retry(Duration.ofMillis(500), Duration.ofMillis(50), Duration.ofMillis(10));

    @Test
    void testReturnsOnThirdAttempt() {
        AtomicInteger calls = new AtomicInteger();
        Boolean result = retry.until("third time lucky", () -> calls.incrementAndGet() == 3);
        assertTrue(result);
        assertEquals(3, calls.get());
    }

    @Test
    void testReturnsValueWithinDeadline() {
        long start = System.nanoTime();
        String value = retry.until("immediate", () -> "ready");
        assertEquals("ready", value);
        long elapsed = (System.nanoTime() - start) / 1_000_000;
        assertTrue(elapsed < 500 + 50, "elapsed: " + elapsed);
    }

    @Test
    void testTimeoutMessageEmbedsDescription() {
        Supplier<Boolean> neverVisible = () -> false;
        long start = System.nanoTime();
        WaitTimeoutException e = assertThrows(WaitTimeoutException.class,
                () -> retry.until("(visible? save-button)", neverVisible, Duration.ofMillis(200)));
        long elapsed = (System.nanoTime() - start) / 1_000_000;
        assertTrue(e.getMessage().contains("(visible? save-button)"));
        assertEquals("(visible? save-button)", e.getDescription());
        assertEquals(false, e.getLastValue());
        assertTrue(elapsed >= 200, "elapsed: " + elapsed);
        assertTrue(elapsed < 200 + 50 + 200, "elapsed: " + elapsed);
        assertFalse(e.isRetryable());
    }

    @Test
    void testFatalErrorPropagatesImmediately() {
        AtomicInteger calls = new AtomicInteger();
        long start = System.nanoTime();
        ProtocolException e = assertThrows(ProtocolException.class, () -> retry.until("bad selector", () -> {
            calls.incrementAndGet();
            throw new ProtocolException(-32000, "DOM Error while querying", "DOM.querySelector");
        }));
        assertEquals(1, calls.get());
        assertTrue((System.nanoTime() - start) / 1_000_000 < 250);
        assertEquals("DOM.querySelector", e.getMethod());
    }

    @Test
    void testNonDriverExceptionPropagates() {
        assertThrows(IllegalStateException.class, () -> retry.until("boom", () -> {
            throw new IllegalStateException("boom");
        }));
    }

    @Test
    void testRetryableErrorIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        String value = retry.until("node comes back", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new StaleHandleException("gone");
            }
            return "node";
        });
        assertEquals("node", value);
    }

    @Test
    void testLastRetryableErrorIsCause() {
        WaitTimeoutException e = assertThrows(WaitTimeoutException.class, () -> retry.until("always stale", () -> {
            throw new StaleHandleException("still gone");
        }, Duration.ofMillis(100)));
        assertInstanceOf(StaleHandleException.class, e.getCause());
        assertTrue(e.getMessage().contains("still gone"));
    }

    @Test
    void testFalsyValues() {
        assertFalse(Retry.isTruthy(null));
        assertFalse(Retry.isTruthy(false));
        assertFalse(Retry.isTruthy(Optional.empty()));
        assertTrue(Retry.isTruthy(Optional.of("x")));
        assertTrue(Retry.isTruthy(0));
        assertTrue(Retry.isTruthy(""));
        assertTrue(Retry.isTruthy(List.of()));
    }

    @Test
    void testOptionalUnwrapsByCaller() {
        AtomicInteger calls = new AtomicInteger();
        Optional<String> value = retry.until("optional", () -> calls.incrementAndGet() < 2 ? Optional.empty() : Optional.of("found"));
        assertEquals("found", value.get());
    }

    @Test
    void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new Retry(Duration.ofSeconds(1), Duration.ZERO));
    }

    @Test
    void testSettleWaitsForNewActivities() {
        List<String> activities = new ArrayList<>(List.of("long-poll"));
        AtomicInteger polls = new AtomicInteger();
        retry.settle("click", () -> {
            // new request finishes after a few polls
            if (activities.contains("xhr-1") && polls.incrementAndGet() > 3) {
                activities.remove("xhr-1");
            }
            return new ArrayList<>(activities);
        }, () -> activities.add("xhr-1"));
        assertEquals(List.of("long-poll"), activities);
        assertTrue(polls.get() > 3);
    }

    @Test
    void testSettleTimeoutListsOutstanding() {
        Retry fast = new Retry(Duration.ofMillis(150), Duration.ofMillis(20), Duration.ZERO);
        List<String> activities = new ArrayList<>();
        WaitTimeoutException e = assertThrows(WaitTimeoutException.class,
                () -> fast.settle("submit form", () -> new ArrayList<>(activities), () -> activities.add("POST /submit")));
        assertTrue(e.getMessage().contains("submit form"));
        assertTrue(e.getMessage().contains("POST /submit"));
    }

}
