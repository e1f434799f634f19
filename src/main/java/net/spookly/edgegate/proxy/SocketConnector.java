package net.spookly.edgegate.proxy;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.handler.ssl.SslContext;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.error.ConfigInvalidException;
import net.spookly.edgegate.error.EnvironmentUnreachableException;

/**
 * Dials backend sockets (TCP with optional TLS, or unix domain sockets) and hands back {@link UpstreamConnection}s.
 */
@Slf4j
public final class SocketConnector implements AutoCloseable {
    private final EventLoopGroup group;
    private final int connectTimeoutMs;
    private final Object domainGroupLock = new Object();
    private EventLoopGroup domainSocketGroup;

    /**
     * @param group shared NIO event loop group; not shut down by this connector
     */
    public SocketConnector(EventLoopGroup group, int connectTimeoutMs) {
        this.group = Objects.requireNonNull(group, "group");
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public EventLoopGroup group() {
        return group;
    }

    public CompletableFuture<UpstreamConnection> connectTcp(String host,
                                                            int port,
                                                            SslContext sslContext,
                                                            UpstreamReader reader) {
        ChannelUpstreamConnection connection = new ChannelUpstreamConnection(reader);
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        if (sslContext != null) {
                            ch.pipeline().addLast("tls", sslContext.newHandler(ch.alloc(), host, port));
                        }
                        ch.pipeline().addLast("upstream", connection);
                    }
                });
        return complete(bootstrap.connect(host, port), connection, host + ":" + port);
    }

    public CompletableFuture<UpstreamConnection> connectUnix(String path, UpstreamReader reader) {
        if (!Epoll.isAvailable()) {
            Throwable cause = Epoll.unavailabilityCause();
            return CompletableFuture.failedFuture(new ConfigInvalidException(
                    "unix socket endpoints need native epoll support on this host", cause));
        }
        ChannelUpstreamConnection connection = new ChannelUpstreamConnection(reader);
        Bootstrap bootstrap = new Bootstrap()
                .group(domainSocketGroup())
                .channel(EpollDomainSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ch.pipeline().addLast("upstream", connection);
                    }
                });
        return complete(bootstrap.connect(new DomainSocketAddress(path)), connection, "unix://" + path);
    }

    private CompletableFuture<UpstreamConnection> complete(ChannelFuture connect,
                                                           ChannelUpstreamConnection connection,
                                                           String target) {
        CompletableFuture<UpstreamConnection> result = new CompletableFuture<>();
        connect.addListener(future -> {
            if (future.isSuccess()) {
                result.complete(connection);
                return;
            }
            Throwable cause = future.cause();
            log.debug("Connect to {} failed: {}", target, cause == null ? "cancelled" : cause.getMessage());
            result.completeExceptionally(new EnvironmentUnreachableException(
                    "connect to " + target + " failed: " + (cause == null ? "cancelled" : cause.getMessage()), cause));
        });
        return result;
    }

    private EventLoopGroup domainSocketGroup() {
        synchronized (domainGroupLock) {
            if (domainSocketGroup == null) {
                domainSocketGroup = new EpollEventLoopGroup(1);
            }
            return domainSocketGroup;
        }
    }

    @Override
    public void close() {
        synchronized (domainGroupLock) {
            if (domainSocketGroup != null) {
                domainSocketGroup.shutdownGracefully();
                domainSocketGroup = null;
            }
        }
    }
}
