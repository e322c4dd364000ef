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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fluent builder for one protocol command. The id is assigned by the client when the command
 * goes out, so ids on the wire are strictly increasing.
 */
public class CdpMessage {

    private final CdpClient client;
    private final String method;
    private final Map<String, Object> params = new LinkedHashMap<>();
    private Duration timeout;

    CdpMessage(CdpClient client, String method) {
        this.client = client;
        this.method = method;
    }

    public CdpMessage param(String key, Object value) {
        params.put(key, value);
        return this;
    }

    public CdpMessage params(Map<String, Object> values) {
        if (values != null) {
            params.putAll(values);
        }
        return this;
    }

    /**
     * Overrides the client's call timeout for this command only.
     */
    public CdpMessage timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    /**
     * Blocks until the correlated response arrives.
     *
     * @throws io.steady.driver.ProtocolException if the browser answers with an error
     * @throws io.steady.driver.ConnectionException on timeout or a closed socket
     */
    public CdpResponse send() {
        return client.send(this);
    }

    public CompletableFuture<CdpResponse> sendAsync() {
        return client.sendAsync(this);
    }

    public String getMethod() {
        return method;
    }

    public Map<String, Object> getParams() {
        return Collections.unmodifiableMap(params);
    }

    public Duration getTimeout() {
        return timeout;
    }

    String toJson(int id) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("id", id);
        wire.put("method", method);
        wire.put("params", params);
        return Wire.stringify(wire);
    }

    @Override
    public String toString() {
        return params.isEmpty() ? method : method + " " + params.keySet();
    }

}
