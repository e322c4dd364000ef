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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HandleCodecTest {

    HandleRegistry registry = new HandleRegistry(null);

    @Test
    void testPrimitivesOnly() {
        HandleCodec.Marshaled marshaled = HandleCodec.marshal(Arrays.asList("a", 1, true, null), registry);
        assertFalse(marshaled.hasHandles());
        assertEquals(Arrays.asList("a", 1, true, null), marshaled.skeleton());
        assertTrue(marshaled.paths().isEmpty());
    }

    @Test
    void testNestedHandlesRoundTrip() {
        Handle button = registry.wrapObject("obj-1", Handle.Kind.NODE);
        Handle input = registry.wrapObject("obj-2", Handle.Kind.NODE);
        List<Object> args = List.of(
                button,
                Map.of("target", input, "options", Map.of("delay", 10)),
                List.of("x", List.of(button, "y")));
        HandleCodec.Marshaled marshaled = HandleCodec.marshal(args, registry);
        assertEquals(3, marshaled.handles().size());
        assertEquals(List.of(
                List.of(0),
                List.of(1, "target"),
                List.of(2, 1, 0)), marshaled.paths());
        assertNull(marshaled.skeleton().get(0));
        Object restored = HandleCodec.unmarshal(marshaled.skeleton(), marshaled.paths(), marshaled.handles());
        assertEquals(args, restored);
    }

    @Test
    void testUnmarshalWholeValueIsRef() {
        Handle node = registry.wrapObject("obj-1", Handle.Kind.NODE);
        assertSame(node, HandleCodec.unmarshal(null, List.of(List.of()), List.of(node)));
    }

    @Test
    void testUnmarshalDoesNotModifyInput() {
        List<Object> json = new ArrayList<>(Arrays.asList(1, null));
        Object restored = HandleCodec.unmarshal(json, List.of(List.of(1)), List.of("ref"));
        assertEquals(List.of(1, "ref"), restored);
        assertNull(json.get(1));
    }

    @Test
    void testRejectsNonJsonValues() {
        assertThrows(IllegalArgumentException.class, () -> HandleCodec.marshal(List.of(new Object()), registry));
        assertThrows(IllegalArgumentException.class, () -> HandleCodec.marshal(List.of(Map.of(1, "x")), registry));
    }

    @Test
    void testRejectsForeignHandle() {
        Handle foreign = new HandleRegistry(null).wrapObject("obj-9", Handle.Kind.OBJECT);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> HandleCodec.marshal(List.of(Map.of("el", foreign)), registry));
        assertTrue(e.getMessage().contains("another connection"));
    }

    @Test
    void testMismatchedRefs() {
        assertThrows(IllegalArgumentException.class, () -> HandleCodec.unmarshal(List.of(), List.of(List.of(0)), List.of()));
    }

}
