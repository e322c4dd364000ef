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

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CdpMessageTest {

    @Test
    void testParamsAccumulate() {
        CdpMessage message = new CdpMessage(null, "DOM.querySelector")
                .param("nodeId", 1)
                .params(Map.of("selector", "#save"))
                .params(null);

        assertEquals("DOM.querySelector", message.getMethod());
        assertEquals(Map.of("nodeId", 1, "selector", "#save"), message.getParams());
        assertNull(message.getTimeout());
        assertThrows(UnsupportedOperationException.class, () -> message.getParams().put("x", 1));
    }

    @Test
    void testTimeoutOverride() {
        CdpMessage message = new CdpMessage(null, "Page.navigate").timeout(Duration.ofSeconds(60));
        assertEquals(Duration.ofSeconds(60), message.getTimeout());
    }

    @Test
    void testWireFormatCarriesAssignedId() {
        String json = new CdpMessage(null, "Page.navigate")
                .param("url", "https://example.com/a")
                .toJson(5);

        assertEquals("{\"id\":5,\"method\":\"Page.navigate\",\"params\":{\"url\":\"https://example.com/a\"}}", json);
    }

    @Test
    void testEmptyParamsStillSent() {
        assertEquals("{\"id\":4,\"method\":\"Network.enable\",\"params\":{}}",
                new CdpMessage(null, "Network.enable").toJson(4));
    }

    @Test
    void testToString() {
        assertEquals("Page.enable", new CdpMessage(null, "Page.enable").toString());
        assertEquals("DOM.describeNode [objectId]", new CdpMessage(null, "DOM.describeNode").param("objectId", "o1").toString());
    }

}
