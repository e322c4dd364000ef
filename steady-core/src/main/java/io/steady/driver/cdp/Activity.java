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
 * An in-flight document load or XHR/fetch request.
 */
public record Activity(String requestId, Kind kind, String url, String method, String frameId) {

    public enum Kind {
        DOCUMENT, XHR, OTHER;

        /**
         * Maps the protocol's resource type. Fetch requests count as XHR.
         */
        public static Kind fromResourceType(String type) {
            if ("Document".equals(type)) {
                return DOCUMENT;
            }
            if ("XHR".equals(type) || "Fetch".equals(type)) {
                return XHR;
            }
            return OTHER;
        }
    }

    @Override
    public String toString() {
        return kind + "[" + requestId + "] " + method + " " + url;
    }

}
