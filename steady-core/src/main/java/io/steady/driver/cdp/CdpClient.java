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
import io.steady.driver.ProtocolException;
import io.steady.http.WsClient;
import io.steady.http.WsClientOptions;
import io.steady.http.WsException;
import io.steady.http.WsListener;
import net.minidev.json.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Chrome DevTools Protocol connection over one WebSocket.
 * <p>
 * Responses are matched to pending calls by id on the socket reader thread. Events are
 * handed to one dispatch thread per connection and delivered in wire order, so a callback
 * may itself make blocking calls without stalling response handling.
 */
public class CdpClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CdpClient.class);

    private static final AtomicInteger DISPATCHER_COUNTER = new AtomicInteger();

    private final Duration callTimeout;
    private final AtomicInteger idGenerator = new AtomicInteger();
    private final Map<Integer, CompletableFuture<CdpResponse>> pending = new ConcurrentHashMap<>();
    private final Map<String, List<CdpSubscription>> listeners = new ConcurrentHashMap<>();
    private final Set<CompletableFuture<?>> awaitables = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final ExecutorService dispatcher = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "cdp-events-" + DISPATCHER_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private final WsClient ws;

    public static CdpClient connect(String webSocketUrl) {
        return connect(webSocketUrl, CdpDriverOptions.defaults());
    }

    /**
     * Opens the socket and makes one round trip before returning.
     *
     * @throws ConnectionException if the browser cannot be reached or does not answer in time
     */
    public static CdpClient connect(String webSocketUrl, CdpDriverOptions options) {
        CdpClient client = new CdpClient(webSocketUrl, options);
        client.waitForReady(options.getConnectTimeoutDuration());
        return client;
    }

    private CdpClient(String webSocketUrl, CdpDriverOptions options) {
        this.callTimeout = options.getCallTimeoutDuration();
        WsClientOptions wsOptions;
        try {
            wsOptions = new WsClientOptions(webSocketUrl, options.getMaxPayloadSize(), options.getConnectTimeoutDuration());
        } catch (IllegalArgumentException e) {
            dispatcher.shutdownNow();
            throw new ConnectionException("invalid devtools url: " + e.getMessage(), e);
        }
        try {
            this.ws = WsClient.connect(wsOptions, new SocketListener());
        } catch (WsException e) {
            dispatcher.shutdownNow();
            throw new ConnectionException("cannot connect to " + webSocketUrl + ": " + e.getMessage(), e);
        }
    }

    private void waitForReady(Duration timeout) {
        try {
            CdpResponse response = method("Browser.getVersion").timeout(timeout).send();
            logger.debug("CDP ready, browser: {}", response.getResultAsString("product"));
        } catch (ProtocolException e) {
            // page endpoints may not expose the Browser domain, any reply proves liveness
            logger.debug("CDP ready, version unavailable: {}", e.getMessage());
        } catch (DriverException e) {
            close();
            throw new ConnectionException("CDP connection failed readiness check: " + e.getMessage(), e);
        }
    }

    private class SocketListener implements WsListener {

        @Override
        public void onText(String text) {
            handleMessage(text);
        }

        @Override
        public void onClose(String reason) {
            shutdown("connection closed by remote: " + reason);
        }

    }

    @SuppressWarnings("unchecked")
    private void handleMessage(String json) {
        Object parsed;
        try {
            parsed = Wire.parse(json);
        } catch (ParseException e) {
            logger.error("ignoring malformed CDP message: {}", e.getMessage());
            return;
        }
        if (!(parsed instanceof Map)) {
            logger.error("ignoring CDP message that is not an object: {}", json);
            return;
        }
        Map<String, Object> map = (Map<String, Object>) parsed;
        if (map.get("id") instanceof Number id) {
            CompletableFuture<CdpResponse> future = pending.remove(id.intValue());
            if (future != null) {
                future.complete(new CdpResponse(map));
            } else {
                logger.debug("dropping response for unknown or timed out request id: {}", id);
            }
        } else if (map.get("method") instanceof String) {
            CdpEvent event = CdpEvent.fromWire(map);
            try {
                dispatcher.execute(() -> dispatchEvent(event));
            } catch (RejectedExecutionException e) {
                logger.debug("dropping event after close: {}", event.method());
            }
        }
    }

    private void dispatchEvent(CdpEvent event) {
        List<CdpSubscription> subscriptions = listeners.get(event.method());
        if (subscriptions == null) {
            return;
        }
        for (CdpSubscription subscription : subscriptions) {
            try {
                subscription.deliver(event);
            } catch (Exception e) {
                logger.error("event handler error for {}: {}", event.method(), e.getMessage(), e);
            }
        }
    }

    // Commands

    public CdpMessage method(String method) {
        return new CdpMessage(this, method);
    }

    /**
     * Sends a command and returns its result object.
     */
    public Map<String, Object> invoke(String method, Map<String, Object> params) {
        return method(method).params(params).send().getResult();
    }

    public Map<String, Object> invoke(String method, Map<String, Object> params, Duration timeout) {
        return method(method).params(params).timeout(timeout).send().getResult();
    }

    CdpResponse send(CdpMessage message) {
        CdpResponse response;
        try {
            response = sendAsync(message).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TimeoutException) {
                throw new ConnectionException("CDP timeout after " + timeoutOf(message).toMillis() + "ms for: " + message.getMethod());
            }
            if (cause instanceof DriverException de) {
                throw de;
            }
            throw new ConnectionException("CDP error for " + message.getMethod() + ": " + cause.getMessage(), cause);
        }
        if (response.isError()) {
            throw response.toException(message.getMethod());
        }
        return response;
    }

    /**
     * The future completes with the raw response, error replies included. It fails with a
     * {@link TimeoutException} once the call timeout passes, and with a
     * {@link ConnectionException} if the connection closes first.
     */
    CompletableFuture<CdpResponse> sendAsync(CdpMessage message) {
        if (closed.get() || !ws.isOpen()) {
            return CompletableFuture.failedFuture(new ConnectionException("connection closed"));
        }
        int id = idGenerator.incrementAndGet();
        CompletableFuture<CdpResponse> future = new CompletableFuture<>();
        pending.put(id, future);
        String json = message.toJson(id);
        logger.trace(">>> {}", json);
        try {
            ws.send(json);
        } catch (WsException e) {
            pending.remove(id);
            return CompletableFuture.failedFuture(new ConnectionException("send failed: " + e.getMessage(), e));
        }
        if (closed.get() && pending.remove(id) != null) {
            future.completeExceptionally(new ConnectionException("connection closed"));
        }
        return future.orTimeout(timeoutOf(message).toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, ex) -> {
                    if (ex instanceof TimeoutException && pending.remove(id) != null) {
                        logger.debug("CDP request {} ({}) timed out", id, message.getMethod());
                    }
                });
    }

    private Duration timeoutOf(CdpMessage message) {
        return message.getTimeout() != null ? message.getTimeout() : callTimeout;
    }

    // Events

    public CdpSubscription subscribe(String method, Consumer<CdpEvent> callback) {
        return subscribe(Set.of(method), callback);
    }

    /**
     * Registers a callback for every event whose method is in the given set.
     * Callbacks run on the dispatch thread, in registration order per event.
     *
     * @throws ConnectionException if the connection is already closed
     */
    public CdpSubscription subscribe(Set<String> methods, Consumer<CdpEvent> callback) {
        if (closed.get()) {
            throw new ConnectionException("cannot subscribe to " + methods + ": connection closed");
        }
        CdpSubscription subscription = new CdpSubscription(this, methods, callback);
        for (String method : subscription.getMethods()) {
            listeners.computeIfAbsent(method, k -> new CopyOnWriteArrayList<>()).add(subscription);
        }
        if (closed.get()) {
            // shutdown may have cleared the listeners after the first check
            unsubscribe(subscription);
            throw new ConnectionException("cannot subscribe to " + methods + ": connection closed");
        }
        return subscription;
    }

    public void unsubscribe(CdpSubscription subscription) {
        if (!subscription.deactivate()) {
            return;
        }
        for (String method : subscription.getMethods()) {
            List<CdpSubscription> subscriptions = listeners.get(method);
            if (subscriptions != null) {
                subscriptions.remove(subscription);
            }
        }
    }

    /**
     * A future that fails with a {@link ConnectionException} if the connection closes
     * before someone completes it.
     */
    public <T> CompletableFuture<T> awaitable() {
        CompletableFuture<T> future = new CompletableFuture<>();
        awaitables.add(future);
        future.whenComplete((r, e) -> awaitables.remove(future));
        if (closed.get()) {
            future.completeExceptionally(new ConnectionException("connection closed"));
        }
        return future;
    }

    // Lifecycle

    public boolean isOpen() {
        return !closed.get() && ws.isOpen();
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    /**
     * Fails every pending call and awaitable, drops all subscriptions and closes the socket.
     * Safe to call more than once.
     */
    @Override
    public void close() {
        shutdown("connection closed");
        ws.close();
    }

    private void shutdown(String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.debug("CDP shutdown: {}", reason);
        ConnectionException signal = new ConnectionException(reason);
        for (Integer id : pending.keySet()) {
            CompletableFuture<CdpResponse> future = pending.remove(id);
            if (future != null) {
                future.completeExceptionally(signal);
            }
        }
        for (CompletableFuture<?> future : awaitables) {
            future.completeExceptionally(signal);
        }
        for (List<CdpSubscription> subscriptions : listeners.values()) {
            subscriptions.forEach(CdpSubscription::deactivate);
        }
        listeners.clear();
        dispatcher.shutdownNow();
    }

}
