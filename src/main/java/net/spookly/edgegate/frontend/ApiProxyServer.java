package net.spookly.edgegate.frontend;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpRequestDecoder;
import io.netty.handler.codec.http.HttpResponseEncoder;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.auth.AccessPolicy;
import net.spookly.edgegate.auth.ApiAuthenticator;
import net.spookly.edgegate.routing.EndpointProxyRouter;
import net.spookly.edgegate.util.ListenAddress;

/**
 * Client-facing HTTP listener for {@code /api/endpoints/...} requests.
 */
@Slf4j
public final class ApiProxyServer {
    private static final int MAX_INITIAL_LINE_BYTES = 8192;
    private static final int MAX_CHUNK_BYTES = 64 * 1024;

    private final ListenAddress listen;
    private final int maxHeaderBytes;
    private final EndpointProxyRouter router;
    private final ApiAuthenticator authenticator;
    private final AccessPolicy accessPolicy;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel channel;

    public ApiProxyServer(ListenAddress listen,
                          int maxHeaderBytes,
                          EndpointProxyRouter router,
                          ApiAuthenticator authenticator,
                          AccessPolicy accessPolicy) {
        this.listen = Objects.requireNonNull(listen, "listen");
        this.maxHeaderBytes = maxHeaderBytes;
        this.router = Objects.requireNonNull(router, "router");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.accessPolicy = Objects.requireNonNull(accessPolicy, "accessPolicy");
    }

    public synchronized void start() {
        if (channel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(ApiProxyHandler.DECODER,
                                        new HttpRequestDecoder(MAX_INITIAL_LINE_BYTES, maxHeaderBytes, MAX_CHUNK_BYTES))
                                .addLast(ApiProxyHandler.ENCODER, new HttpResponseEncoder())
                                .addLast("proxy", new ApiProxyHandler(router, authenticator, accessPolicy));
                    }
                });
        try {
            channel = bootstrap.bind(listen.toSocketAddress()).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("API listener bind interrupted", e);
        }
        log.info("API proxy listening on {}", boundAddress());
    }

    public synchronized void stop() {
        if (channel != null) {
            channel.close().syncUninterruptibly();
            channel = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            bossGroup = null;
        }
    }

    public synchronized InetSocketAddress boundAddress() {
        return channel == null ? null : (InetSocketAddress) channel.localAddress();
    }
}
