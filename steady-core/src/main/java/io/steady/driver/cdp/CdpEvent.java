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

import java.util.Map;

/**
 * An unsolicited protocol message.
 *
 * @param method event name such as {@code Page.frameNavigated}
 * @param params never null
 */
public record CdpEvent(String method, Map<String, Object> params) {

    public CdpEvent {
        params = params == null ? Map.of() : params;
    }

    @SuppressWarnings("unchecked")
    static CdpEvent fromWire(Map<String, Object> wire) {
        Object params = wire.get("params");
        return new CdpEvent((String) wire.get("method"), params instanceof Map ? (Map<String, Object>) params : null);
    }

    /**
     * Reads a param by dot path, e.g. {@code get("frame.id")}.
     */
    public <T> T get(String path) {
        return Wire.read(params, path);
    }

    public String getString(String path) {
        return Wire.asString(get(path));
    }

    public Integer getInt(String path) {
        return Wire.asInt(get(path));
    }

    @Override
    public String toString() {
        return "CdpEvent[" + method + "]";
    }

}
