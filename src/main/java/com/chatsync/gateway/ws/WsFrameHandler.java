package com.chatsync.gateway.ws;

import com.chatsync.common.error.ChatException;
import com.chatsync.common.ratelimit.LimitClass;
import com.chatsync.common.ratelimit.WindowedRateLimiter;
import com.chatsync.domain.mutation.ReceiptHandler;
import com.chatsync.gateway.session.PresenceRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 握手完成后的业务帧处理。每个 channel 一个实例。
 *
 * <p>约定：客户端发来的每个 TextWebSocketFrame 都是一段 {@link WsEnvelope} JSON。
 * 需要访问存储的动作（MESSAGE_SEEN）切到 db 线程池执行，eventLoop 上不做阻塞 IO。</p>
 */
@Slf4j
public class WsFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final long DB_TIMEOUT_SECONDS = 3;

    private final ObjectMapper objectMapper;
    private final PresenceNotifier presenceNotifier;
    private final FanOutDispatcher dispatcher;
    private final WindowedRateLimiter limiter;
    private final ReceiptHandler receiptHandler;
    private final Executor dbExecutor;

    public WsFrameHandler(ObjectMapper objectMapper,
                          PresenceNotifier presenceNotifier,
                          FanOutDispatcher dispatcher,
                          WindowedRateLimiter limiter,
                          ReceiptHandler receiptHandler,
                          Executor dbExecutor) {
        this.objectMapper = objectMapper;
        this.presenceNotifier = presenceNotifier;
        this.dispatcher = dispatcher;
        this.limiter = limiter;
        this.receiptHandler = receiptHandler;
        this.dbExecutor = dbExecutor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        Channel ch = ctx.channel();
        Long userId = ch.attr(PresenceRegistry.ATTR_USER_ID).get();
        if (userId == null) {
            dispatcher.send(ch, WsEnvelope.error("unauthorized", null));
            ctx.close();
            return;
        }

        WsEnvelope msg;
        try {
            msg = objectMapper.readValue(frame.text(), WsEnvelope.class);
        } catch (Exception e) {
            dispatcher.send(ch, WsEnvelope.error("bad_json", null));
            return;
        }

        WindowedRateLimiter.Decision decision = limiter.check(LimitClass.REALTIME, "user:" + userId);
        if (!decision.allowed()) {
            WsEnvelope err = WsEnvelope.error("rate_limited", msg.getMessageId());
            err.setRetryAfter(decision.retryAfterSeconds());
            dispatcher.send(ch, err);
            return;
        }

        String type = msg.getType() == null ? "" : msg.getType();
        switch (type) {
            case "PING" -> dispatcher.send(ch, WsEnvelope.of("PONG"));
            case "TYPING" -> relayTyping(ch, userId, msg, ChatEvents.TYPING);
            case "STOP_TYPING" -> relayTyping(ch, userId, msg, ChatEvents.STOP_TYPING);
            case "MESSAGE_SEEN" -> markSeen(ctx, userId, msg);
            default -> dispatcher.send(ch, WsEnvelope.error("unknown_type", null));
        }
    }

    private void relayTyping(Channel ch, long userId, WsEnvelope msg, String event) {
        Long to = msg.getTo();
        if (to == null || to <= 0 || to == userId) {
            dispatcher.send(ch, WsEnvelope.error("missing_to", null));
            return;
        }
        dispatcher.notifyUser(to, event, new TypingPayload(userId));
    }

    private void markSeen(ChannelHandlerContext ctx, long userId, WsEnvelope msg) {
        Long messageId = msg.getMessageId();
        if (messageId == null || messageId <= 0) {
            dispatcher.send(ctx.channel(), WsEnvelope.error("missing_message_id", null));
            return;
        }
        CompletableFuture<Boolean> future;
        try {
            future = CompletableFuture.supplyAsync(() -> receiptHandler.markSeen(userId, messageId), dbExecutor)
                    .orTimeout(DB_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("db executor saturated, drop MESSAGE_SEEN: userId={}, messageId={}", userId, messageId);
            dispatcher.send(ctx.channel(), WsEnvelope.error("server_busy", messageId));
            return;
        }
        future.whenComplete((ok, err) -> {
            if (err == null) {
                return;
            }
            String reason = reasonOf(err);
            if ("internal_error".equals(reason)) {
                log.error("mark seen failed: userId={}, messageId={}, cause={}", userId, messageId, err.toString());
            }
            ctx.executor().execute(() -> dispatcher.send(ctx.channel(), WsEnvelope.error(reason, messageId)));
        });
    }

    static String reasonOf(Throwable err) {
        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        if (cause instanceof ChatException ce) {
            return ce.getReason();
        }
        if (cause instanceof TimeoutException) {
            return "timeout";
        }
        return "internal_error";
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            Long userId = ctx.channel().attr(PresenceRegistry.ATTR_USER_ID).get();
            if (userId != null) {
                presenceNotifier.connected(userId, ctx.channel());
            }
            return;
        }
        if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.WRITER_IDLE) {
            // 应用层心跳，客户端回 PING/PONG 均可
            dispatcher.send(ctx.channel(), WsEnvelope.of("PING"));
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        presenceNotifier.disconnected(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("ws channel error, closing: channel={}, err={}", ctx.channel().id(), cause.toString());
        ctx.close();
    }
}
