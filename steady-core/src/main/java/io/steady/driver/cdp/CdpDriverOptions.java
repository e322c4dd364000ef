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
package io.steady.driver.cdp;

import io.steady.http.WsClientOptions;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Timeouts and limits for a CDP session.
 * Built with the builder, from a map (as read from a config file) or from system properties
 * prefixed with {@code steady.}. Durations are given in milliseconds.
 */
public class CdpDriverOptions {

    public static final String PROPERTY_PREFIX = "steady.";

    private final int connectTimeout;
    private final int callTimeout;
    private final int timeout;
    private final int pollInterval;
    private final int settleGrace;
    private final int maxPayloadSize;

    private CdpDriverOptions(Builder builder) {
        this.connectTimeout = builder.connectTimeout;
        this.callTimeout = builder.callTimeout;
        this.timeout = builder.timeout;
        this.pollInterval = builder.pollInterval;
        this.settleGrace = builder.settleGrace;
        this.maxPayloadSize = builder.maxPayloadSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CdpDriverOptions defaults() {
        return builder().build();
    }

    public static CdpDriverOptions fromMap(Map<String, Object> map) {
        Builder builder = builder();
        if (map == null) {
            return builder.build();
        }
        if (map.containsKey("connectTimeout")) {
            builder.connectTimeout(toInt(map.get("connectTimeout")));
        }
        if (map.containsKey("callTimeout")) {
            builder.callTimeout(toInt(map.get("callTimeout")));
        }
        if (map.containsKey("timeout")) {
            builder.timeout(toInt(map.get("timeout")));
        }
        if (map.containsKey("pollInterval")) {
            builder.pollInterval(toInt(map.get("pollInterval")));
        }
        if (map.containsKey("settleGrace")) {
            builder.settleGrace(toInt(map.get("settleGrace")));
        }
        if (map.containsKey("maxPayloadSize")) {
            builder.maxPayloadSize(toInt(map.get("maxPayloadSize")));
        }
        return builder.build();
    }

    public static CdpDriverOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    static CdpDriverOptions fromProperties(Properties props) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(PROPERTY_PREFIX)) {
                map.put(name.substring(PROPERTY_PREFIX.length()), props.getProperty(name).trim());
            }
        }
        return fromMap(map);
    }

    private static int toInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + value, e);
        }
    }

    // Getters

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public int getCallTimeout() {
        return callTimeout;
    }

    public int getTimeout() {
        return timeout;
    }

    public int getPollInterval() {
        return pollInterval;
    }

    public int getSettleGrace() {
        return settleGrace;
    }

    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    public Duration getConnectTimeoutDuration() {
        return Duration.ofMillis(connectTimeout);
    }

    public Duration getCallTimeoutDuration() {
        return Duration.ofMillis(callTimeout);
    }

    public Duration getTimeoutDuration() {
        return Duration.ofMillis(timeout);
    }

    public Duration getPollIntervalDuration() {
        return Duration.ofMillis(pollInterval);
    }

    public Duration getSettleGraceDuration() {
        return Duration.ofMillis(settleGrace);
    }

    @Override
    public String toString() {
        return "CdpDriverOptions[connectTimeout=" + connectTimeout + ", callTimeout=" + callTimeout
                + ", timeout=" + timeout + ", pollInterval=" + pollInterval
                + ", settleGrace=" + settleGrace + ", maxPayloadSize=" + maxPayloadSize + "]";
    }

    public static class Builder {
        private int connectTimeout = 10000;
        private int callTimeout = 10000;
        private int timeout = 5000;
        private int pollInterval = 50;
        private int settleGrace = 50;
        private int maxPayloadSize = WsClientOptions.MEGABYTE * 16;

        public Builder connectTimeout(int millis) {
            this.connectTimeout = millis;
            return this;
        }

        public Builder callTimeout(int millis) {
            this.callTimeout = millis;
            return this;
        }

        public Builder callTimeout(Duration duration) {
            this.callTimeout = (int) duration.toMillis();
            return this;
        }

        public Builder timeout(int millis) {
            this.timeout = millis;
            return this;
        }

        public Builder timeout(Duration duration) {
            this.timeout = (int) duration.toMillis();
            return this;
        }

        public Builder pollInterval(int millis) {
            this.pollInterval = millis;
            return this;
        }

        public Builder settleGrace(int millis) {
            this.settleGrace = millis;
            return this;
        }

        public Builder maxPayloadSize(int bytes) {
            this.maxPayloadSize = bytes;
            return this;
        }

        public CdpDriverOptions build() {
            if (pollInterval <= 0) {
                throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
            }
            if (connectTimeout < 0 || callTimeout < 0 || timeout < 0 || settleGrace < 0) {
                throw new IllegalArgumentException("timeouts must not be negative");
            }
            return new CdpDriverOptions(this);
        }
    }

}
