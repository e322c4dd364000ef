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

/**
 * How to find a DOM node when creating a handle: by DOM agent node id, by backend node id,
 * or by an already resolved remote object id. Exactly one is set.
 */
public record Lookup(Integer nodeId, Integer backendNodeId, String objectId) {

    public Lookup {
        int set = (nodeId != null ? 1 : 0) + (backendNodeId != null ? 1 : 0) + (objectId != null ? 1 : 0);
        if (set != 1) {
            throw new IllegalArgumentException("exactly one of nodeId, backendNodeId, objectId is required");
        }
    }

    public static Lookup nodeId(int nodeId) {
        return new Lookup(nodeId, null, null);
    }

    public static Lookup backendNodeId(int backendNodeId) {
        return new Lookup(null, backendNodeId, null);
    }

    public static Lookup objectId(String objectId) {
        return new Lookup(null, null, objectId);
    }

}
