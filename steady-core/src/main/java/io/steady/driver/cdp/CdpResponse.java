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

import io.steady.driver.ProtocolException;

import java.util.Map;

/**
 * The reply to one command, carrying either a result object or an error.
 */
public class CdpResponse {

    private final int id;
    private final Map<String, Object> result;
    private final Integer errorCode;
    private final String errorMessage;

    @SuppressWarnings("unchecked")
    CdpResponse(Map<String, Object> wire) {
        id = wire.get("id") instanceof Number n ? n.intValue() : -1;
        if (wire.get("error") instanceof Map<?, ?> error) {
            result = null;
            errorCode = Wire.asInt(error.get("code"));
            errorMessage = Wire.asString(error.get("message"));
        } else {
            Object value = wire.get("result");
            result = value instanceof Map ? (Map<String, Object>) value : Map.of();
            errorCode = null;
            errorMessage = null;
        }
    }

    public int getId() {
        return id;
    }

    public boolean isError() {
        return result == null;
    }

    public Integer getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    ProtocolException toException(String method) {
        return new ProtocolException(errorCode == null ? 0 : errorCode, errorMessage, method);
    }

    /**
     * Null for an error reply, an empty map for a command with no return values.
     */
    public Map<String, Object> getResult() {
        return result;
    }

    /**
     * Reads by dot path ({@code frameTree.frame.id}) or JSONPath ({@code nodeIds[0]}).
     */
    public <T> T getResult(String path) {
        return Wire.read(result, path);
    }

    public String getResultAsString(String path) {
        return Wire.asString(getResult(path));
    }

    public Integer getResultAsInt(String path) {
        return Wire.asInt(getResult(path));
    }

    public Boolean getResultAsBoolean(String path) {
        return Wire.asBoolean(getResult(path));
    }

    @Override
    public String toString() {
        return isError() ? "CdpResponse[" + id + " ERROR: " + errorMessage + "]" : "CdpResponse[" + id + "]";
    }

}
