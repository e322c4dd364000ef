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

import java.util.Set;
import java.util.function.Consumer;

/**
 * A registered event callback. Closing it stops delivery at once, including when
 * called from inside the callback itself.
 */
public class CdpSubscription implements AutoCloseable {

    private final CdpClient client;
    private final Set<String> methods;
    private final Consumer<CdpEvent> callback;
    private volatile boolean active = true;

    CdpSubscription(CdpClient client, Set<String> methods, Consumer<CdpEvent> callback) {
        this.client = client;
        this.methods = Set.copyOf(methods);
        this.callback = callback;
    }

    public Set<String> getMethods() {
        return methods;
    }

    public boolean isActive() {
        return active;
    }

    void deliver(CdpEvent event) {
        if (active) {
            callback.accept(event);
        }
    }

    // returns true only for the call that actually deactivated
    synchronized boolean deactivate() {
        if (!active) {
            return false;
        }
        active = false;
        return true;
    }

    @Override
    public void close() {
        client.unsubscribe(this);
    }

    @Override
    public String toString() {
        return "CdpSubscription" + methods + (active ? "" : " (closed)");
    }

}
