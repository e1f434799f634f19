package net.spookly.edgegate.frontend;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;
import net.spookly.edgegate.auth.AccessPolicy;
import net.spookly.edgegate.auth.ApiAuthenticator;
import net.spookly.edgegate.auth.TokenRedactor;
import net.spookly.edgegate.error.ProxyException;
import net.spookly.edgegate.proxy.ProxyRequest;
import net.spookly.edgegate.proxy.ProxySession;
import net.spookly.edgegate.proxy.ResponseHead;
import net.spookly.edgegate.proxy.ResponseSink;
import net.spookly.edgegate.routing.EndpointProxyRouter;

/**
 * One client connection, one proxied exchange. Upstream bytes are written back verbatim and the
 * connection is closed when the exchange ends; after a {@code 101} the connection becomes a raw pipe.
 */
@Slf4j
final class ApiProxyHandler extends ChannelInboundHandlerAdapter {
    static final String DECODER = "httpDecoder";
    static final String ENCODER = "httpEncoder";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EndpointProxyRouter router;
    private final ApiAuthenticator authenticator;
    private final AccessPolicy accessPolicy;
    private ProxySession session;
    private boolean responseStarted;
    private boolean finished;

    ApiProxyHandler(EndpointProxyRouter router, ApiAuthenticator authenticator, AccessPolicy accessPolicy) {
        this.router = Objects.requireNonNull(router, "router");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.accessPolicy = Objects.requireNonNull(accessPolicy, "accessPolicy");
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (msg instanceof HttpRequest) {
                onRequest(ctx, (HttpRequest) msg);
            }
            if (msg instanceof HttpContent) {
                onContent((HttpContent) msg);
            } else if (msg instanceof ByteBuf) {
                onRaw((ByteBuf) msg);
                return;
            }
        } finally {
            if (!(msg instanceof ByteBuf)) {
                ReferenceCountUtil.release(msg);
            }
        }
    }

    private void onRequest(ChannelHandlerContext ctx, HttpRequest request) {
        if (session != null || finished) {
            return;
        }
        if (request.decoderResult().isFailure()) {
            writeError(ctx, HttpResponseStatus.BAD_REQUEST, "BAD_REQUEST", "malformed request");
            return;
        }
        Optional<ApiPath> path = ApiPath.parse(request.uri());
        if (path.isEmpty()) {
            writeError(ctx, HttpResponseStatus.NOT_FOUND, "NOT_FOUND", "no route for " + request.uri());
            return;
        }
        String environmentId = path.get().environmentId();
        Optional<String> principal = authenticator.authenticate(request.headers());
        if (principal.isEmpty()) {
            log.debug("Unauthenticated request from {} (authorization {})", ctx.channel().remoteAddress(),
                    TokenRedactor.redactAuthorization(request.headers().get(HttpHeaderNames.AUTHORIZATION)));
            writeError(ctx, HttpResponseStatus.UNAUTHORIZED, "UNAUTHORIZED", "missing or invalid API token");
            return;
        }
        if (!accessPolicy.isAllowed(principal.get(), environmentId)) {
            writeError(ctx, HttpResponseStatus.FORBIDDEN, "FORBIDDEN", "access to environment " + environmentId + " denied");
            return;
        }
        ProxyRequest proxyRequest = ProxyRequest.of(request.method(), path.get().forwardPath(),
                new DefaultHttpHeaders().add(request.headers()));
        try {
            session = router.route(environmentId, proxyRequest, new ChannelSink(ctx));
        } catch (ProxyException e) {
            log.debug("Routing {} {} failed: {}", request.method(), request.uri(), e.getMessage());
            writeError(ctx, HttpResponseStatus.valueOf(e.httpStatus()), e.code().name(), e.getMessage());
        }
    }

    private void onContent(HttpContent content) {
        if (session == null) {
            return;
        }
        ByteBuf data = content.content();
        if (data.isReadable()) {
            session.sendBody(data.retain());
        }
        if (content instanceof LastHttpContent) {
            session.endBody();
        }
    }

    private void onRaw(ByteBuf data) {
        if (session == null) {
            data.release();
            return;
        }
        session.sendBody(data);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session != null && !finished) {
            session.cancel();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("API client connection {} failed", ctx.channel().remoteAddress(), cause);
        if (session != null) {
            session.cancel();
        }
        ctx.close();
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String code, String message) {
        finished = true;
        byte[] payload;
        try {
            payload = MAPPER.writeValueAsBytes(ApiResponse.error(code, message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode error response", e);
        }
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(payload));
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .set(HttpHeaderNames.CONTENT_LENGTH, payload.length)
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    /**
     * Moves every callback onto the client channel's event loop.
     */
    private final class ChannelSink implements ResponseSink {
        private final ChannelHandlerContext ctx;

        private ChannelSink(ChannelHandlerContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public void onResponseHead(ResponseHead head) {
            ctx.executor().execute(() -> {
                startRawResponse();
                if (head.isSwitchingProtocols() && ctx.pipeline().get(DECODER) != null) {
                    ctx.pipeline().remove(DECODER);
                }
            });
        }

        @Override
        public void onInterimResponse(ByteBuf data) {
            ctx.executor().execute(() -> {
                startRawResponse();
                write(data);
            });
        }

        @Override
        public void onData(ByteBuf data) {
            ctx.executor().execute(() -> write(data));
        }

        private void startRawResponse() {
            responseStarted = true;
            if (ctx.pipeline().get(ENCODER) != null) {
                ctx.pipeline().remove(ENCODER);
            }
        }

        private void write(ByteBuf data) {
            if (!ctx.channel().isActive()) {
                data.release();
                return;
            }
            ctx.writeAndFlush(data);
        }

        @Override
        public void onComplete() {
            ctx.executor().execute(() -> {
                finished = true;
                ctx.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
            });
        }

        @Override
        public void onError(ProxyException error) {
            ctx.executor().execute(() -> {
                if (responseStarted) {
                    finished = true;
                    ctx.close();
                    return;
                }
                writeError(ctx, HttpResponseStatus.valueOf(error.httpStatus()), error.code().name(), error.getMessage());
            });
        }
    }
}
