// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.rpc.transport;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.ScheduledFuture;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.net.ssl.SSLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.conduit.rpc.WebSocketConfig;

/**
 * Netty-backed {@link WebSocketTransport}.
 *
 * <p>
 * TLS is configured automatically for {@code wss://}. Configured headers are sent
 * with the upgrade request. Fragmented messages are aggregated up to
 * {@link WebSocketConfig#maxFrameSize()}. All listener callbacks run on the
 * channel's event loop, so they must not block.
 *
 * <p>
 * Each transport reports exactly one terminal event: either
 * {@link TransportListener#onError} or {@link TransportListener#onClose}.
 */
public final class NettyWebSocketTransport implements WebSocketTransport {

    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketTransport.class);

    private static final int ABNORMAL_CLOSURE = 1006;

    private final WebSocketConfig config;
    private final EventLoopGroup group;
    private final TransportListener listener;
    private final URI uri;
    private final AtomicBoolean terminated = new AtomicBoolean();

    private volatile Channel channel;
    private volatile boolean handshakeComplete;

    public NettyWebSocketTransport(
            final WebSocketConfig config, final EventLoopGroup group, final TransportListener listener) {
        this.config = config;
        this.group = group;
        this.listener = listener;
        this.uri = URI.create(config.url());
    }

    /**
     * Returns a factory that creates transports on the given event loop group.
     *
     * @param group the Netty group the channels are registered with
     * @return a transport factory
     */
    public static TransportFactory factory(final EventLoopGroup group) {
        return (config, listener) -> new NettyWebSocketTransport(config, group, listener);
    }

    @Override
    public void connect() {
        final boolean secure = "wss".equals(uri.getScheme().toLowerCase(Locale.ROOT));
        final SslContext sslContext;
        try {
            sslContext = secure ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            reportError(e);
            return;
        }

        final int port = uri.getPort() == -1 ? (secure ? 443 : 80) : uri.getPort();
        final HttpHeaders headers = new DefaultHttpHeaders();
        config.headers().forEach(headers::add);

        final WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, headers, config.maxFrameSize());
        final ConnectionHandler handler = new ConnectionHandler(handshaker);

        final Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) Math.min(Integer.MAX_VALUE, config.timeout().toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), uri.getHost(), port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        p.addLast(new WebSocketFrameAggregator(config.maxFrameSize()));
                        p.addLast(handler);
                    }
                });

        final ChannelFuture future = b.connect(uri.getHost(), port);
        channel = future.channel();
        future.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                reportError(f.cause());
            }
        });
    }

    @Override
    public void send(final String text) {
        final Channel ch = channel;
        if (ch == null) {
            log.warn("Dropping frame written before connect: {}", text);
            return;
        }
        ch.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                log.warn("Failed to write frame to {}: {}", uri, f.cause().getMessage());
            }
        });
    }

    @Override
    public void close(final int code) {
        final Channel ch = channel;
        if (ch == null) {
            return;
        }
        if (ch.isActive() && handshakeComplete) {
            ch.writeAndFlush(new CloseWebSocketFrame(code, "")).addListener(ChannelFutureListener.CLOSE);
        } else {
            ch.close();
        }
    }

    @Override
    public void terminate() {
        final Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public boolean isOpen() {
        final Channel ch = channel;
        return ch != null && ch.isActive() && handshakeComplete;
    }

    private void reportError(final Throwable cause) {
        if (terminated.compareAndSet(false, true)) {
            listener.onError(cause);
        }
        terminate();
    }

    private void reportClose(final int code, final String reason) {
        if (terminated.compareAndSet(false, true)) {
            listener.onClose(code, reason);
        }
    }

    private final class ConnectionHandler extends SimpleChannelInboundHandler<Object> {
        private final WebSocketClientHandshaker handshaker;
        private ScheduledFuture<?> handshakeTimeout;
        private int closeCode = ABNORMAL_CLOSURE;
        private String closeReason = "";

        ConnectionHandler(final WebSocketClientHandshaker handshaker) {
            this.handshaker = handshaker;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            handshaker.handshake(ctx.channel());
            final long timeoutMillis = config.timeout().toMillis();
            handshakeTimeout = ctx.executor().schedule(() -> {
                if (!handshaker.isHandshakeComplete()) {
                    reportError(new WebSocketHandshakeException(
                            "Handshake with " + uri + " timed out after " + timeoutMillis + "ms"));
                }
            }, timeoutMillis, TimeUnit.MILLISECONDS);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            cancelHandshakeTimeout();
            reportClose(closeCode, closeReason);
        }

        @Override
        public void channelRead0(ChannelHandlerContext ctx, Object msg) {
            final Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                if (!(msg instanceof FullHttpResponse)) {
                    return;
                }
                try {
                    handshaker.finishHandshake(ch, (FullHttpResponse) msg);
                } catch (WebSocketHandshakeException e) {
                    cancelHandshakeTimeout();
                    reportError(e);
                    return;
                }
                cancelHandshakeTimeout();
                handshakeComplete = true;
                listener.onOpen();
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                throw new IllegalStateException("Unexpected FullHttpResponse (status=" + response.status() + ")");
            }

            if (msg instanceof TextWebSocketFrame text) {
                listener.onMessage(text.text());
            } else if (msg instanceof BinaryWebSocketFrame binary) {
                listener.onMessage(binary.content().toString(StandardCharsets.UTF_8));
            } else if (msg instanceof PingWebSocketFrame ping) {
                ch.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            } else if (msg instanceof CloseWebSocketFrame close) {
                closeCode = close.statusCode() == -1 ? ABNORMAL_CLOSURE : close.statusCode();
                closeReason = close.reasonText() == null ? "" : close.reasonText();
                ch.close();
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            cancelHandshakeTimeout();
            reportError(cause);
        }

        private void cancelHandshakeTimeout() {
            if (handshakeTimeout != null) {
                handshakeTimeout.cancel(false);
                handshakeTimeout = null;
            }
        }
    }
}
