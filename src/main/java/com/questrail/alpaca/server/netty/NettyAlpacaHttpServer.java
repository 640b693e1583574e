package com.questrail.alpaca.server.netty;

import com.questrail.alpaca.config.TlsSettings;
import com.questrail.alpaca.server.AlpacaRequest;
import com.questrail.alpaca.server.AlpacaResponse;
import com.questrail.alpaca.server.RequestHandler;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.*;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyAlpacaHttpServer
 * =============================================================================
 * HTTP/1.1 transport for the Alpaca REST surface.
 *
 * <h2>Netty containment rule</h2>
 * Netty types stay in this package. Each request is converted into an
 * {@link AlpacaRequest} on the I/O thread and handed to the
 * {@link RequestHandler} on a separate handler executor, since handlers may
 * block on backend calls.
 *
 * <h2>Timeouts</h2>
 * A connection with no inbound data for the read timeout, no outbound write
 * for the write timeout, or no traffic at all for the idle timeout is closed.
 *
 * <h2>Shutdown</h2>
 * {@link #stop()} closes the listening socket, lets in-flight handlers finish
 * for up to the shutdown timeout, then releases the event loops.
 */
public final class NettyAlpacaHttpServer
{
    private static final Logger log = LoggerFactory.getLogger(NettyAlpacaHttpServer.class);

    static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final InetSocketAddress bindAddress;
    private final RequestHandler handler;
    private final Options options;
    private final SslContext sslContext;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ExecutorService handlerExecutor;

    private volatile Channel serverChannel;

    /**
     * @param readTimeout     per-connection read inactivity bound
     * @param writeTimeout    per-connection write inactivity bound
     * @param idleTimeout     per-connection total inactivity bound
     * @param shutdownTimeout drain bound for {@link #stop()}
     * @param handlerThreads  size of the handler executor
     */
    public record Options(Duration readTimeout,
                          Duration writeTimeout,
                          Duration idleTimeout,
                          Duration shutdownTimeout,
                          int handlerThreads)
    {
        public Options
        {
            Objects.requireNonNull(readTimeout, "readTimeout");
            Objects.requireNonNull(writeTimeout, "writeTimeout");
            Objects.requireNonNull(idleTimeout, "idleTimeout");
            Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
            if (handlerThreads <= 0) {
                throw new IllegalArgumentException("handlerThreads must be > 0");
            }
        }
    }

    public NettyAlpacaHttpServer(InetSocketAddress bindAddress,
                                 RequestHandler handler,
                                 Options options,
                                 TlsSettings tls)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.options = Objects.requireNonNull(options, "options");
        this.sslContext = tls != null && tls.enabled() ? buildSslContext(tls) : null;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        AtomicInteger threadIds = new AtomicInteger();
        this.handlerExecutor = Executors.newFixedThreadPool(options.handlerThreads(), r -> {
            Thread t = new Thread(r, "alpaca-http-handler-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Bind and start accepting. Blocks until the socket is bound.
     *
     * @throws IOException if binding fails
     */
    public void start() throws IOException
    {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast("tls", sslContext.newHandler(ch.alloc()));
                        }
                        p.addLast("idle", new IdleStateHandler(
                                options.readTimeout().toMillis(),
                                options.writeTimeout().toMillis(),
                                options.idleTimeout().toMillis(),
                                TimeUnit.MILLISECONDS));
                        p.addLast("codec", new HttpServerCodec());
                        p.addLast("aggregator", new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        p.addLast("alpaca", new AlpacaChannelHandler());
                    }
                });

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            shutdownGroups();
            throw new IOException("cannot bind HTTP server to " + bindAddress, f.cause());
        }
        serverChannel = f.channel();
        log.info("Alpaca HTTP server listening on {}{}", serverChannel.localAddress(),
                sslContext != null ? " (TLS)" : "");
    }

    public void stop()
    {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly(options.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }

        handlerExecutor.shutdown();
        try {
            if (!handlerExecutor.awaitTermination(options.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("HTTP handlers still running after {}; interrupting", options.shutdownTimeout());
                handlerExecutor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            handlerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        shutdownGroups();
        log.info("Alpaca HTTP server stopped");
    }

    /** Bound address, or {@code null} when not running. */
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        return ch == null ? null : (InetSocketAddress) ch.localAddress();
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    static SslContext buildSslContext(TlsSettings tls)
    {
        try {
            return SslContextBuilder.forServer(new File(tls.certFile()), new File(tls.keyFile()))
                    .protocols(tls.enabledProtocols())
                    .build();
        }
        catch (SSLException | IllegalArgumentException e) {
            throw new IllegalStateException("cannot load TLS material from " + tls.certFile() + " / " + tls.keyFile(), e);
        }
    }

    static AlpacaRequest toAlpacaRequest(FullHttpRequest msg, String remote)
    {
        QueryStringDecoder uri = new QueryStringDecoder(msg.uri(), StandardCharsets.UTF_8);
        Map<String, String> query = firstValues(uri.parameters());

        Map<String, String> form = Map.of();
        String contentType = msg.headers().get(HttpHeaderNames.CONTENT_TYPE, "");
        if (msg.content().isReadable()
                && contentType.toLowerCase(Locale.ROOT).startsWith(HttpHeaderValues.APPLICATION_X_WWW_FORM_URLENCODED.toString())) {
            String body = msg.content().toString(StandardCharsets.UTF_8);
            form = firstValues(new QueryStringDecoder(body, StandardCharsets.UTF_8, false).parameters());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> h : msg.headers()) {
            headers.putIfAbsent(h.getKey(), h.getValue());
        }

        int q = msg.uri().indexOf('?');
        String rawQuery = q < 0 ? "" : msg.uri().substring(q + 1);
        return AlpacaRequest.of(msg.method().name(), uri.path(), rawQuery, query, form, headers, remote);
    }

    private static Map<String, String> firstValues(Map<String, List<String>> params)
    {
        Map<String, String> out = new LinkedHashMap<>();
        params.forEach((k, v) -> {
            if (!v.isEmpty()) {
                out.put(k, v.get(0));
            }
        });
        return out;
    }

    private final class AlpacaChannelHandler extends SimpleChannelInboundHandler<FullHttpRequest>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest msg)
        {
            boolean keepAlive = HttpUtil.isKeepAlive(msg);
            if (!msg.decoderResult().isSuccess()) {
                write(ctx, AlpacaResponse.text(400, "malformed request"), false);
                return;
            }

            AlpacaRequest request = toAlpacaRequest(msg, String.valueOf(ctx.channel().remoteAddress()));
            try {
                handlerExecutor.execute(() -> {
                    AlpacaResponse response;
                    try {
                        response = handler.handle(request);
                    }
                    catch (RuntimeException e) {
                        log.error("Unhandled failure for {}", request, e);
                        response = AlpacaResponse.text(500, "internal server error");
                    }
                    write(ctx, response, keepAlive);
                });
            }
            catch (RejectedExecutionException e) {
                write(ctx, AlpacaResponse.text(503, "server shutting down"), false);
            }
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof IdleStateEvent idle) {
                log.debug("Closing {} after {}", ctx.channel().remoteAddress(), idle.state());
                ctx.close();
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.debug("Connection {} failed: {}", ctx.channel().remoteAddress(), cause.toString());
            ctx.close();
        }

        private void write(ChannelHandlerContext ctx, AlpacaResponse response, boolean keepAlive)
        {
            FullHttpResponse out = new DefaultFullHttpResponse(
                    HttpVersion.HTTP_1_1,
                    HttpResponseStatus.valueOf(response.status()),
                    Unpooled.wrappedBuffer(response.body()));
            response.headers().forEach((k, v) -> out.headers().set(k, v));
            HttpUtil.setContentLength(out, response.bodyLength());

            if (keepAlive) {
                HttpUtil.setKeepAlive(out, true);
                ctx.writeAndFlush(out);
            }
            else {
                ctx.writeAndFlush(out).addListener(ChannelFutureListener.CLOSE);
            }
        }
    }
}
