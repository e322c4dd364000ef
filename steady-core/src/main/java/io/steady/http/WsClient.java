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
package io.steady.http;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A text-only WebSocket client on a single Netty event loop.
 * <p>
 * The event loop thread is the socket reader: the {@link WsListener} sees frames in wire order
 * on that thread and must hand off anything that blocks.
 */
public class WsClient {

    private static final Logger logger = LoggerFactory.getLogger(WsClient.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ThreadFactory THREAD_FACTORY = r -> {
        Thread t = new Thread(r, "ws-client-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    };

    /**
     * Opens the socket and completes the handshake within the connect timeout.
     *
     * @throws WsException of type {@code CONNECT_FAILED} if either step fails
     */
    public static WsClient connect(WsClientOptions options, WsListener listener) {
        WsClient client = new WsClient(options, listener);
        try {
            client.open();
        } catch (WsException e) {
            client.close();
            throw e;
        }
        return client;
    }

    private final WsClientOptions options;
    private final WsListener listener;
    private final EventLoopGroup group = new MultiThreadIoEventLoopGroup(1, THREAD_FACTORY, NioIoHandler.newFactory());
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean closeNotified = new AtomicBoolean();

    private volatile Channel channel;
    private volatile boolean open;

    private WsClient(WsClientOptions options, WsListener listener) {
        this.options = options;
        this.listener = listener;
    }

    private void open() {
        SslContext sslContext = options.isSecure() ? sslContext() : null;
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                options.uri(), WebSocketVersion.V13, null, false, EmptyHttpHeaders.INSTANCE, options.maxPayloadSize());
        WsClientHandler handler = new WsClientHandler(this, handshaker);
        long timeoutMillis = options.connectTimeout().toMillis();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, Integer.MAX_VALUE))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), options.host(), options.port()));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(options.maxPayloadSize()));
                        p.addLast(handler);
                    }
                });
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        try {
            ChannelFuture connected = bootstrap.connect(options.host(), options.port());
            if (!connected.await(timeoutMillis) || !connected.isSuccess()) {
                throw failed("cannot reach " + options.host() + ":" + options.port(), connected.cause());
            }
            channel = connected.channel();
            long remaining = Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
            ChannelFuture handshake = handler.getHandshakeFuture();
            if (!handshake.await(remaining) || !handshake.isSuccess()) {
                throw failed("websocket handshake failed", handshake.cause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failed("interrupted while connecting", e);
        }
        open = true;
        logger.debug("websocket connected: {}", options.uri());
    }

    private static WsException failed(String message, Throwable cause) {
        String detail = cause == null ? "timeout" : cause.getMessage();
        return new WsException(WsException.Type.CONNECT_FAILED, message + ": " + detail, cause);
    }

    private static SslContext sslContext() {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new WsException(WsException.Type.CONNECT_FAILED, "cannot create ssl context", e);
        }
    }

    public boolean isOpen() {
        Channel ch = channel;
        return open && ch != null && ch.isActive();
    }

    /**
     * Queues a text frame. A write that fails later closes the socket, which reaches the
     * listener as {@link WsListener#onClose(String)}.
     *
     * @throws WsException of type {@code CONNECTION_CLOSED} if the socket is not open
     */
    public void send(String text) {
        if (!isOpen()) {
            throw new WsException(WsException.Type.CONNECTION_CLOSED, "websocket is not open");
        }
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                logger.error("send failed, closing: {}", future.cause().getMessage());
                future.channel().close();
            }
        });
    }

    /**
     * Sends a close frame and releases the event loop. Safe to call more than once.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        boolean handshaken = open;
        open = false;
        Channel ch = channel;
        if (ch != null && handshaken && ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    // called by the handler, on the event loop

    void received(String text) {
        try {
            listener.onText(text);
        } catch (Exception e) {
            logger.error("listener failed on message: {}", e.getMessage(), e);
        }
    }

    void disconnected(String reason) {
        open = false;
        if (!closeNotified.compareAndSet(false, true)) {
            return;
        }
        logger.debug("websocket closed: {} ({})", options.uri(), reason);
        try {
            listener.onClose(reason);
        } catch (Exception e) {
            logger.error("listener failed on close: {}", e.getMessage(), e);
        }
        if (closed.compareAndSet(false, true)) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
    }

}
