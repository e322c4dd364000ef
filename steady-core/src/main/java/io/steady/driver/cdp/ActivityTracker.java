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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the set of document loads and XHR/fetch requests currently in flight, as seen
 * from network and page events. Used as the quiescence signal after a page mutation.
 */
public class ActivityTracker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ActivityTracker.class);

    static final String REQUEST_WILL_BE_SENT = "Network.requestWillBeSent";
    static final String RESPONSE_RECEIVED = "Network.responseReceived";
    static final String LOADING_FAILED = "Network.loadingFailed";
    static final String FRAME_STARTED_LOADING = "Page.frameStartedLoading";

    private final ConcurrentHashMap<String, Activity> activities = new ConcurrentHashMap<>();
    private final CdpSubscription subscription;

    private ActivityTracker(CdpClient cdp) {
        this.subscription = cdp.subscribe(
                Set.of(REQUEST_WILL_BE_SENT, RESPONSE_RECEIVED, LOADING_FAILED, FRAME_STARTED_LOADING),
                this::onEvent);
    }

    /**
     * Subscribes before enabling the domains so no early event is missed.
     */
    public static ActivityTracker start(CdpClient cdp) {
        ActivityTracker tracker = new ActivityTracker(cdp);
        try {
            cdp.method("Page.enable").send();
            cdp.method("Network.enable").send();
        } catch (RuntimeException e) {
            tracker.close();
            throw e;
        }
        return tracker;
    }

    void onEvent(CdpEvent event) {
        switch (event.method()) {
            case REQUEST_WILL_BE_SENT -> {
                Activity.Kind kind = Activity.Kind.fromResourceType(event.getString("type"));
                if (kind == Activity.Kind.OTHER) {
                    return;
                }
                String requestId = event.getString("requestId");
                if (requestId == null) {
                    return;
                }
                Activity activity = new Activity(requestId, kind, event.getString("request.url"),
                        event.getString("request.method"), event.getString("frameId"));
                activities.put(requestId, activity);
                logger.trace("activity started: {}", activity);
            }
            case RESPONSE_RECEIVED, LOADING_FAILED -> {
                String requestId = event.getString("requestId");
                if (requestId != null && activities.remove(requestId) != null) {
                    logger.trace("activity finished: {}", requestId);
                }
            }
            case FRAME_STARTED_LOADING -> {
                String frameId = event.getString("frameId");
                if (frameId != null) {
                    activities.values().removeIf(a -> frameId.equals(a.frameId()));
                }
            }
            default -> {
            }
        }
    }

    /**
     * Snapshot of the activities in flight right now.
     */
    public List<Activity> getActivities() {
        return Collections.unmodifiableList(new ArrayList<>(activities.values()));
    }

    @Override
    public void close() {
        try {
            subscription.close();
        } catch (Exception e) {
            logger.warn("activity tracker close failed: {}", e.getMessage());
        }
    }

}
