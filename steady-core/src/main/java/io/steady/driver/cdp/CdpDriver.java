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
import io.steady.driver.Retry;
import io.steady.driver.StaleHandleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * One browser session: the connection plus the activity tracker, navigator, handle registry
 * and retry policy built on it. Every operation goes through this value; there is no
 * global "current driver".
 */
public class CdpDriver implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CdpDriver.class);

    private final CdpClient cdp;
    private final CdpDriverOptions options;
    private final ActivityTracker activities;
    private final Navigator navigator;
    private final HandleRegistry handles;
    private final Retry retry;

    private CdpDriver(CdpClient cdp, CdpDriverOptions options, ActivityTracker activities, Navigator navigator) {
        this.cdp = cdp;
        this.options = options;
        this.activities = activities;
        this.navigator = navigator;
        this.handles = new HandleRegistry(cdp);
        this.retry = new Retry(options.getTimeoutDuration(), options.getPollIntervalDuration(),
                options.getSettleGraceDuration());
    }

    public static CdpDriver connect(String webSocketUrl) {
        return connect(webSocketUrl, CdpDriverOptions.fromSystemProperties());
    }

    public static CdpDriver connect(String webSocketUrl, CdpDriverOptions options) {
        logger.debug("connecting to {} with {}", webSocketUrl, options);
        CdpClient cdp = CdpClient.connect(webSocketUrl, options);
        ActivityTracker activities = null;
        try {
            activities = ActivityTracker.start(cdp);
            Navigator navigator = Navigator.attach(cdp);
            return new CdpDriver(cdp, options, activities, navigator);
        } catch (RuntimeException e) {
            if (activities != null) {
                activities.close();
            }
            cdp.close();
            throw e;
        }
    }

    public CdpClient getCdp() {
        return cdp;
    }

    public CdpDriverOptions getOptions() {
        return options;
    }

    public Retry getRetry() {
        return retry;
    }

    public Navigator getNavigator() {
        return navigator;
    }

    public HandleRegistry getHandles() {
        return handles;
    }

    // Navigation

    public void goTo(String url) {
        goTo(url, options.getTimeoutDuration());
    }

    public void goTo(String url, Duration timeout) {
        logger.debug("goto: {}", url);
        navigator.goTo(url, timeout);
    }

    public void reload() {
        navigator.reload(options.getTimeoutDuration());
    }

    public boolean back() {
        return navigator.back(options.getTimeoutDuration());
    }

    public boolean forward() {
        return navigator.forward(options.getTimeoutDuration());
    }

    // Waiting

    public <T> T waitUntil(String description, Supplier<T> condition) {
        return retry.until(description, condition);
    }

    public <T> T waitUntil(String description, Supplier<T> condition, Duration timeout) {
        return retry.until(description, condition, timeout);
    }

    /**
     * Runs a page mutation (a click, a key press) and waits until the document loads and
     * XHR/fetch requests it started have finished.
     */
    public void mutate(String description, Runnable action) {
        retry.settle(description, activities::getActivities, action);
    }

    public List<Activity> getActivities() {
        return activities.getActivities();
    }

    // Scripting

    public Handle window() {
        String objectId = cdp.method("Runtime.evaluate")
                .param("expression", "window")
                .param("objectGroup", handles.getObjectGroup())
                .send()
                .getResultAsString("result.objectId");
        if (objectId == null) {
            throw new StaleHandleException("window is not available");
        }
        return handles.wrapObject(objectId, Handle.Kind.OBJECT).withName("window");
    }

    public Handle document() {
        return handles.wrap(Lookup.nodeId(documentNodeId()), null, "document", null);
    }

    private int documentNodeId() {
        Integer nodeId = cdp.method("DOM.getDocument")
                .param("depth", 0)
                .send()
                .getResultAsInt("root.nodeId");
        if (nodeId == null) {
            throw new StaleHandleException("document is not available");
        }
        return nodeId;
    }

    /**
     * Calls a function such as {@code function(a, b) { return a + b; }} with {@code this} set
     * to the window.
     */
    public Object script(String functionDeclaration, Object... args) {
        Handle window = window();
        try {
            return callOn(window, functionDeclaration, args);
        } finally {
            handles.release(window);
        }
    }

    public Object callOn(Handle handle, String functionDeclaration, Object... args) {
        return handles.callFunction(handle, functionDeclaration, Arrays.asList(args));
    }

    // Queries

    public Handle find(String selector) {
        return find(null, selector);
    }

    /**
     * Waits until {@code selector} matches under {@code context} (the document when null).
     * An invalid selector fails on the first attempt.
     */
    public Handle find(Handle context, String selector) {
        String description = context == null ? selector : context.getName() + " " + selector;
        return retry.until("element: " + description, () -> query(context, selector));
    }

    private Handle query(Handle context, String selector) {
        int root = context == null ? documentNodeId() : handles.getNodeId(context);
        Integer nodeId;
        try {
            nodeId = cdp.method("DOM.querySelector")
                    .param("nodeId", root)
                    .param("selector", selector)
                    .send()
                    .getResultAsInt("nodeId");
        } catch (ProtocolException e) {
            // the document was replaced between the two calls
            if (HandleRegistry.isStale(e)) {
                throw new StaleHandleException("query root went stale: " + e.getMessage(), e);
            }
            throw e;
        }
        if (nodeId == null || nodeId == 0) {
            return null;
        }
        return handles.wrap(Lookup.nodeId(nodeId), context, null, selector);
    }

    /**
     * Every current match, without waiting. Nodes that vanish while being resolved are skipped.
     */
    public List<Handle> findAll(Handle context, String selector) {
        int root = context == null ? documentNodeId() : handles.getNodeId(context);
        List<Object> nodeIds = cdp.method("DOM.querySelectorAll")
                .param("nodeId", root)
                .param("selector", selector)
                .send()
                .getResult("nodeIds");
        List<Handle> result = new ArrayList<>();
        if (nodeIds == null) {
            return result;
        }
        for (Object nodeId : nodeIds) {
            try {
                result.add(handles.wrap(Lookup.nodeId(((Number) nodeId).intValue()), context, null, selector));
            } catch (StaleHandleException e) {
                logger.debug("skipping stale match for {}: {}", selector, e.getMessage());
            }
        }
        return result;
    }

    public List<Handle> findAll(String selector) {
        return findAll(null, selector);
    }

    public String describe(Handle handle) {
        return handles.describe(handle);
    }

    /**
     * Raw protocol call, for helpers this class does not cover (input, screenshots).
     */
    public Map<String, Object> invoke(String method, Map<String, Object> params) {
        return cdp.invoke(method, params);
    }

    @Override
    public void close() {
        handles.close();
        navigator.close();
        activities.close();
        cdp.close();
        logger.debug("driver closed");
    }

}
