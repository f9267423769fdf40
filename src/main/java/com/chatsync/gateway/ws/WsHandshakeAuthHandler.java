package com.chatsync.gateway.ws;

import com.chatsync.auth.service.JwtService;
import com.chatsync.common.ratelimit.LimitClass;
import com.chatsync.common.ratelimit.WindowedRateLimiter;
import com.chatsync.gateway.session.PresenceRegistry;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * WebSocket 握手阶段（HTTP Upgrade）的鉴权与建连准入：
 * <ul>
 *   <li>从 Authorization: Bearer &lt;token&gt; 或 query 参数 token/accessToken 取 accessToken 并验签</li>
 *   <li>按 CONNECTION 分类限流，超限回 429</li>
 *   <li>通过后把 userId 绑到 channel 属性上；真正进入在线表要等握手完成</li>
 * </ul>
 */
@Slf4j
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final String wsPath;
    private final JwtService jwtService;
    private final WindowedRateLimiter limiter;

    public WsHandshakeAuthHandler(String wsPath, JwtService jwtService, WindowedRateLimiter limiter) {
        this.wsPath = wsPath;
        this.jwtService = jwtService;
        this.limiter = limiter;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath)) {
            writeAndClose(ctx, HttpResponseStatus.NOT_FOUND, "not_found", null);
            return;
        }

        String token = extractAccessToken(req);
        if (token == null || token.isBlank()) {
            writeAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, "missing_access_token", null);
            return;
        }

        long userId;
        try {
            userId = jwtService.verifyUserId(token);
        } catch (Exception e) {
            log.debug("ws handshake rejected: err={}", e.toString());
            writeAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, "invalid_access_token", null);
            return;
        }

        WindowedRateLimiter.Decision decision = limiter.check(LimitClass.CONNECTION, "user:" + userId);
        if (!decision.allowed()) {
            writeAndClose(ctx, HttpResponseStatus.TOO_MANY_REQUESTS, "too_many_connections", decision.retryAfterSeconds());
            return;
        }

        ctx.channel().attr(PresenceRegistry.ATTR_USER_ID).set(userId);
        ctx.fireChannelRead(req.retain());
    }

    private String extractAccessToken(FullHttpRequest req) {
        String auth = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (auth != null && auth.startsWith("Bearer ")) {
            return auth.substring("Bearer ".length()).trim();
        }
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        for (String name : List.of("token", "accessToken")) {
            List<String> values = decoder.parameters().get(name);
            if (values != null && !values.isEmpty() && !values.get(0).isBlank()) {
                return values.get(0);
            }
        }
        return null;
    }

    private void writeAndClose(ChannelHandlerContext ctx, HttpResponseStatus status, String reason, Long retryAfter) {
        byte[] bytes = reason.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        if (retryAfter != null) {
            resp.headers().set(HttpHeaderNames.RETRY_AFTER, String.valueOf(retryAfter));
        }
        ctx.writeAndFlush(resp);
        ctx.close();
    }
}
