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

import io.steady.driver.ConnectionException;
import io.steady.driver.DriverException;
import io.steady.driver.WaitTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking page navigation. Each navigation runs its triggering command and then waits for
 * the main frame to fire its {@code load} lifecycle event, or for a same-document navigation.
 */
public class Navigator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Navigator.class);

    static final String LIFECYCLE_EVENT = "Page.lifecycleEvent";
    static final String FRAME_NAVIGATED = "Page.frameNavigated";
    static final String NAVIGATED_WITHIN_DOCUMENT = "Page.navigatedWithinDocument";

    private final CdpClient cdp;
    private final CdpSubscription subscription;
    private final List<String> lifecycleEvents = new CopyOnWriteArrayList<>();
    private volatile String mainFrameId;

    private Navigator(CdpClient cdp) {
        this.cdp = cdp;
        this.subscription = cdp.subscribe(Set.of(LIFECYCLE_EVENT, FRAME_NAVIGATED), this::onEvent);
    }

    public static Navigator attach(CdpClient cdp) {
        Navigator navigator = new Navigator(cdp);
        try {
            CdpResponse tree = cdp.method("Page.getFrameTree").send();
            navigator.mainFrameId = tree.getResultAsString("frameTree.frame.id");
            cdp.method("Page.enable").send();
            cdp.method("Page.setLifecycleEventsEnabled").param("enabled", true).send();
        } catch (RuntimeException e) {
            navigator.close();
            throw e;
        }
        logger.debug("navigator attached, main frame: {}", navigator.mainFrameId);
        return navigator;
    }

    private void onEvent(CdpEvent event) {
        if (FRAME_NAVIGATED.equals(event.method())) {
            if (event.get("frame.parentId") == null) {
                String frameId = event.getString("frame.id");
                if (frameId != null && !frameId.equals(mainFrameId)) {
                    logger.debug("main frame changed: {} -> {}", mainFrameId, frameId);
                    mainFrameId = frameId;
                }
            }
        } else if (isMainFrame(event)) {
            String name = event.getString("name");
            if ("init".equals(name)) {
                lifecycleEvents.clear();
            }
            lifecycleEvents.add(name);
        }
    }

    private boolean isMainFrame(CdpEvent event) {
        String frameId = event.getString("frameId");
        return frameId != null && frameId.equals(mainFrameId);
    }

    public String getMainFrameId() {
        return mainFrameId;
    }

    /**
     * Lifecycle event names seen for the current main frame document, oldest first.
     */
    public List<String> getLifecycleEvents() {
        return new ArrayList<>(lifecycleEvents);
    }

    /**
     * Runs {@code op} and blocks until the main frame has loaded. The listener is in place
     * before {@code op} runs. A zero timeout returns as soon as {@code op} does.
     *
     * @throws WaitTimeoutException if no load arrives in time
     */
    public void navigate(Runnable op, Duration timeout) {
        if (timeout.isZero()) {
            op.run();
            return;
        }
        CompletableFuture<String> loaded = cdp.awaitable();
        CdpSubscription watch = cdp.subscribe(Set.of(LIFECYCLE_EVENT, NAVIGATED_WITHIN_DOCUMENT), event -> {
            if (!isMainFrame(event)) {
                return;
            }
            if (NAVIGATED_WITHIN_DOCUMENT.equals(event.method())) {
                loaded.complete(event.method());
            } else if ("load".equals(event.getString("name"))) {
                loaded.complete("load");
            }
        });
        try {
            op.run();
            String trigger = loaded.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.debug("navigation complete ({}) for frame {}", trigger, mainFrameId);
        } catch (TimeoutException e) {
            throw new WaitTimeoutException("page load of frame " + mainFrameId, timeout, getLifecycleEvents(), null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DriverException) {
                throw (DriverException) cause;
            }
            throw new ConnectionException("navigation failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException("interrupted while waiting for page load", e);
        } finally {
            watch.close();
            loaded.cancel(false);
        }
    }

    public void goTo(String url, Duration timeout) {
        navigate(() -> {
            CdpResponse response = cdp.method("Page.navigate").param("url", url).send();
            String errorText = response.getResultAsString("errorText");
            if (errorText != null && !errorText.isEmpty()) {
                throw new DriverException("navigation to " + url + " failed: " + errorText);
            }
        }, timeout);
    }

    public void reload(Duration timeout) {
        navigate(() -> cdp.method("Page.reload").send(), timeout);
    }

    /**
     * @return false without waiting when there is no earlier history entry
     */
    public boolean back(Duration timeout) {
        return history(-1, timeout);
    }

    /**
     * @return false without waiting when there is no later history entry
     */
    public boolean forward(Duration timeout) {
        return history(1, timeout);
    }

    private boolean history(int delta, Duration timeout) {
        CdpResponse response = cdp.method("Page.getNavigationHistory").send();
        Integer currentIndex = response.getResultAsInt("currentIndex");
        List<Map<String, Object>> entries = response.getResult("entries");
        if (currentIndex == null || entries == null) {
            return false;
        }
        int target = currentIndex + delta;
        if (target < 0 || target >= entries.size()) {
            return false;
        }
        Object entryId = entries.get(target).get("id");
        navigate(() -> cdp.method("Page.navigateToHistoryEntry").param("entryId", entryId).send(), timeout);
        return true;
    }

    @Override
    public void close() {
        subscription.close();
    }

}
