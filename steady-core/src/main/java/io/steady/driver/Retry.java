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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Polling primitive that turns asynchronous browser state into a blocking call.
 * <p>
 * {@link #until} re-evaluates a supplier until it yields a truthy value, sleeping a fixed
 * interval after falsy results and retryable {@link DriverException}s. Fatal errors propagate
 * on the attempt that raised them.
 */
public class Retry {

    private static final Logger logger = LoggerFactory.getLogger(Retry.class);

    private final Duration timeout;
    private final Duration interval;
    private final Duration grace;

    public Retry(Duration timeout, Duration interval) {
        this(timeout, interval, interval);
    }

    public Retry(Duration timeout, Duration interval, Duration grace) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("poll interval must be positive: " + interval);
        }
        this.timeout = timeout;
        this.interval = interval;
        this.grace = grace;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getGrace() {
        return grace;
    }

    public <T> T until(String description, Supplier<T> condition) {
        return until(description, condition, timeout);
    }

    public <T> T until(String description, Supplier<T> condition, Duration timeout) {
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        T lastValue = null;
        DriverException lastError = null;
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                lastValue = condition.get();
                lastError = null;
                if (isTruthy(lastValue)) {
                    if (attempt > 1) {
                        logger.debug("wait succeeded after {} attempt(s): {}", attempt, description);
                    }
                    return lastValue;
                }
            } catch (DriverException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastError = e;
                logger.debug("retryable error on attempt {} for {}: {}", attempt, description, e.getMessage());
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                logger.debug("wait timed out after {} attempt(s): {}", attempt, description);
                throw new WaitTimeoutException(description, timeout, lastValue, lastError);
            }
            sleep(Math.min(interval.toNanos(), remaining), description);
        }
    }

    /**
     * Runs an action that may trigger page activity and blocks until every activity the
     * action started has finished. Activities already in flight before the action do not
     * count.
     */
    public void settle(String description, Supplier<? extends Collection<?>> activities, Runnable action) {
        Set<Object> before = new HashSet<>(activities.get());
        action.run();
        if (!grace.isZero() && !grace.isNegative()) {
            sleep(grace.toNanos(), description);
        }
        Set<Object> outstanding = new HashSet<>();
        try {
            until(description, () -> {
                outstanding.clear();
                for (Object activity : activities.get()) {
                    if (!before.contains(activity)) {
                        outstanding.add(activity);
                    }
                }
                return outstanding.isEmpty();
            });
        } catch (WaitTimeoutException e) {
            throw new WaitTimeoutException(description + " | outstanding activities: " + outstanding,
                    timeout, outstanding, null);
        }
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Optional<?> o) {
            return o.isPresent();
        }
        return true;
    }

    private static void sleep(long nanos, String description) {
        try {
            Thread.sleep(nanos / 1_000_000, (int) (nanos % 1_000_000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException("interrupted while waiting for: " + description, e);
        }
    }

}
