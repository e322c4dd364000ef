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
import io.steady.driver.WaitTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CdpDriverTest {

    FakeBrowser browser;
    CdpDriver driver;
    ScheduledExecutorService scheduler;

    @BeforeEach
    void beforeEach() {
        browser = FakeBrowser.start();
        browser.respond("DOM.resolveNode", params -> {
            int nodeId = ((Number) params.get("nodeId")).intValue();
            if (nodeId == 404) {
                throw new FakeBrowser.Failure(-32000, "No node with given id found");
            }
            return Map.of("object", Map.of("type", "object", "objectId", "obj-" + nodeId));
        });
        browser.respond("Runtime.callFunctionOn", params -> {
            String fn = (String) params.get("functionDeclaration");
            if (fn.contains("isConnected") || fn.contains("return true;")) {
                return Map.of("result", Map.of("type", "boolean", "value", true));
            }
            return Map.of("result", Map.of("type", "string", "value", "42"));
        });
        browser.respond("Runtime.evaluate", params -> Map.of("result", Map.of("type", "object", "className", "Window", "objectId", "win-1")));
        CdpDriverOptions options = CdpDriverOptions.builder()
                .timeout(500)
                .pollInterval(20)
                .settleGrace(20)
                .build();
        driver = CdpDriver.connect(browser.getUrl(), options);
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void afterEach() {
        scheduler.shutdownNow();
        driver.close();
        browser.close();
    }

    @Test
    void testConnectSetsUpSession() {
        List<String> methods = browser.getReceivedMethods();
        assertTrue(methods.contains("Network.enable"));
        assertTrue(methods.contains("Page.getFrameTree"));
        assertTrue(methods.contains("Page.setLifecycleEventsEnabled"));
        assertEquals("MAIN", driver.getNavigator().getMainFrameId());
        assertEquals(500, driver.getRetry().getTimeout().toMillis());
    }

    @Test
    void testFindWaitsUntilPresent() {
        AtomicInteger attempts = new AtomicInteger();
        browser.respond("DOM.querySelector", params -> Map.of("nodeId", attempts.incrementAndGet() < 3 ? 0 : 7));
        Handle handle = driver.find("#save");
        assertEquals(3, attempts.get());
        assertEquals("#save", handle.getSelector());
        assertEquals("obj-7", handle.objectId());
    }

    @Test
    void testFindInContextComposesSelector() {
        browser.respond("DOM.querySelector", params -> Map.of("nodeId", ((Number) params.get("nodeId")).intValue() == 1 ? 8 : 9));
        browser.respond("DOM.requestNode", params -> Map.of("nodeId", 8));
        Handle form = driver.find("form");
        Handle input = driver.find(form, "input[name=q]");
        assertEquals("form input[name=q]", input.getSelector());
        assertEquals("obj-9", input.objectId());
    }

    @Test
    void testFindInvalidSelectorFailsFast() {
        browser.respondError("DOM.querySelector", -32000, "DOM Error while querying");
        long start = System.currentTimeMillis();
        assertThrows(ProtocolException.class, () -> driver.find("div[["));
        assertTrue(System.currentTimeMillis() - start < 400);
        assertEquals(1, browser.count("DOM.querySelector"));
    }

    @Test
    void testFindTimesOut() {
        browser.respond("DOM.querySelector", params -> Map.of("nodeId", 0));
        WaitTimeoutException e = assertThrows(WaitTimeoutException.class, () -> driver.find("#missing"));
        assertTrue(e.getMessage().contains("#missing"));
    }

    @Test
    void testFindAllSkipsStaleMatches() {
        browser.respond("DOM.querySelectorAll", params -> Map.of("nodeIds", List.of(3, 404, 5)));
        List<Handle> handles = driver.findAll("li");
        assertEquals(2, handles.size());
        assertEquals("obj-3", handles.get(0).objectId());
        assertEquals("obj-5", handles.get(1).objectId());
    }

    @Test
    void testDocumentAndWindow() {
        Handle document = driver.document();
        assertEquals("document", document.getName());
        assertEquals("obj-1", document.objectId());
        Handle window = driver.window();
        assertEquals("window", window.getName());
        assertEquals(Handle.Kind.OBJECT, window.getKind());
    }

    @Test
    void testScriptRunsOnWindowAndReleasesIt() {
        assertEquals(42, driver.script("function() { return 42; }"));
        Map<String, Object> release = FakeBrowser.paramsOf(browser.awaitCommand("Runtime.releaseObject"));
        assertEquals("win-1", release.get("objectId"));
    }

    @Test
    void testMutateWaitsForNewActivity() {
        browser.respond("Input.dispatchMouseEvent", params -> {
            browser.emit("Network.requestWillBeSent", Map.of("requestId", "x1", "type", "XHR", "frameId", "MAIN",
                    "request", Map.of("url", "http://localhost/save", "method", "POST")));
            scheduler.schedule(() -> browser.emit("Network.responseReceived", Map.of("requestId", "x1")),
                    250, TimeUnit.MILLISECONDS);
            return Map.of();
        });
        long start = System.currentTimeMillis();
        driver.mutate("click save", () -> driver.invoke("Input.dispatchMouseEvent", Map.of("type", "mousePressed")));
        assertTrue(System.currentTimeMillis() - start >= 200);
        assertTrue(driver.getActivities().isEmpty());
    }

    @Test
    void testMutateIgnoresActivityAlreadyInFlight() {
        browser.emit("Network.requestWillBeSent", Map.of("requestId", "poll", "type", "XHR", "frameId", "MAIN",
                "request", Map.of("url", "http://localhost/poll", "method", "GET")));
        driver.waitUntil("long poll tracked", () -> driver.getActivities().size() == 1);
        driver.mutate("no-op", () -> driver.invoke("Runtime.enable", Map.of()));
        assertEquals(1, driver.getActivities().size());
    }

    @Test
    void testMutateTimesOutListingOutstanding() {
        browser.respond("Input.dispatchKeyEvent", params -> {
            browser.emit("Network.requestWillBeSent", Map.of("requestId", "hang", "type", "Fetch", "frameId", "MAIN",
                    "request", Map.of("url", "http://localhost/hang", "method", "GET")));
            return Map.of();
        });
        WaitTimeoutException e = assertThrows(WaitTimeoutException.class,
                () -> driver.mutate("press enter", () -> driver.invoke("Input.dispatchKeyEvent", Map.of())));
        assertTrue(e.getMessage().contains("http://localhost/hang"));
    }

    @Test
    void testBackWithoutHistory() {
        assertFalse(driver.back());
    }

    @Test
    void testDescribeDelegates() {
        browser.respond("DOM.describeNode", params -> Map.of("node", Map.of("nodeName", "INPUT", "attributes", List.of("id", "q"))));
        assertEquals("input#q", driver.describe(driver.document()));
    }

    @Test
    void testCloseReleasesObjectGroup() {
        driver.close();
        assertEquals(1, browser.count("Runtime.releaseObjectGroup"));
        assertFalse(driver.getCdp().isOpen());
    }

}
