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

import java.util.Objects;

/**
 * Client-side reference to a browser-side DOM node or JS object.
 * <p>
 * Immutable. The referenced object may disappear at any time, in which case every operation
 * through {@link HandleRegistry} raises {@link io.steady.driver.StaleHandleException}.
 * {@link #toString()} never touches the network; use {@link HandleRegistry#describe(Handle)}.
 */
public final class Handle {

    public enum Kind {
        NODE, OBJECT
    }

    private final HandleRegistry registry;
    private final String objectId;
    private final Kind kind;
    private final String displayName;
    private final String selector;

    Handle(HandleRegistry registry, String objectId, Kind kind, String displayName, String selector) {
        this.registry = Objects.requireNonNull(registry);
        this.objectId = Objects.requireNonNull(objectId);
        this.kind = kind;
        this.displayName = displayName;
        this.selector = selector;
    }

    HandleRegistry getRegistry() {
        return registry;
    }

    // unchecked, use HandleRegistry.getObjectId for a validated id
    String objectId() {
        return objectId;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNode() {
        return kind == Kind.NODE;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getSelector() {
        return selector;
    }

    /**
     * Display name if set, else the selector breadcrumb, else null.
     */
    public String getName() {
        return displayName != null ? displayName : selector;
    }

    public Handle withName(String name) {
        return new Handle(registry, objectId, kind, name, selector);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Handle other)) {
            return false;
        }
        return registry == other.registry && objectId.equals(other.objectId);
    }

    @Override
    public int hashCode() {
        return objectId.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Handle[").append(kind == Kind.NODE ? "node" : "object");
        if (displayName != null) {
            sb.append(" name=").append(displayName);
        }
        if (selector != null) {
            sb.append(" selector=").append(selector);
        }
        return sb.append("]").toString();
    }

}
