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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HandleTest {

    HandleRegistry registry = new HandleRegistry(null);

    @Test
    void testNaming() {
        Handle handle = new Handle(registry, "obj-1", Handle.Kind.NODE, null, "form input");
        assertEquals("form input", handle.getName());
        Handle named = handle.withName("Username");
        assertNotSame(handle, named);
        assertEquals("Username", named.getName());
        assertEquals("form input", named.getSelector());
        assertNull(handle.getDisplayName());
        assertEquals(handle, named);
    }

    @Test
    void testToString() {
        Handle handle = new Handle(registry, "obj-1", Handle.Kind.NODE, "Save", "#save");
        assertEquals("Handle[node name=Save selector=#save]", handle.toString());
        assertEquals("Handle[object]", registry.wrapObject("obj-2", Handle.Kind.OBJECT).toString());
    }

    @Test
    void testSelectorJoin() {
        Handle form = new Handle(registry, "obj-1", Handle.Kind.NODE, null, "form");
        assertEquals("form input", HandleRegistry.joinSelector(form, "input"));
        assertEquals("input", HandleRegistry.joinSelector(null, "input"));
        assertEquals("form", HandleRegistry.joinSelector(form, null));
    }

    @Test
    void testLookupRequiresExactlyOne() {
        assertThrows(IllegalArgumentException.class, () -> new Lookup(null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new Lookup(1, 2, null));
        assertEquals(5, Lookup.backendNodeId(5).backendNodeId());
    }

    @Test
    void testFormatNode() {
        assertEquals("button#save.primary.large",
                HandleRegistry.formatNode("BUTTON", List.of("id", "save", "class", " primary  large ")));
        assertEquals("div", HandleRegistry.formatNode("DIV", null));
    }

}
