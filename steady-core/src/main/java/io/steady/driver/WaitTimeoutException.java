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

import java.time.Duration;

/**
 * A wait ran past its deadline. The last retryable error, if any, is the cause.
 */
public class WaitTimeoutException extends DriverException {

    private final String description;
    private final transient Object lastValue;

    public WaitTimeoutException(String description, Duration timeout, Object lastValue, Throwable lastError) {
        super(message(description, timeout, lastValue, lastError), lastError, false);
        this.description = description;
        this.lastValue = lastValue;
    }

    private static String message(String description, Duration timeout, Object lastValue, Throwable lastError) {
        StringBuilder sb = new StringBuilder("timed out after ");
        sb.append(timeout.toMillis()).append("ms waiting for: ").append(description);
        if (lastError != null) {
            sb.append(" | last error: ").append(lastError.getMessage());
        } else {
            sb.append(" | last value: ").append(lastValue);
        }
        return sb.toString();
    }

    public String getDescription() {
        return description;
    }

    public Object getLastValue() {
        return lastValue;
    }

}
