package com.chatsync.gateway.ws;

import com.chatsync.auth.service.JwtService;
import com.chatsync.common.ratelimit.WindowedRateLimiter;
import com.chatsync.domain.mutation.ReceiptHandler;
import com.chatsync.gateway.config.GatewayProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
public class NettyWsServer implements SmartLifecycle {

    private final GatewayProperties props;
    private final ObjectMapper objectMapper;
    private final JwtService jwtService;
    private final WindowedRateLimiter limiter;
    private final PresenceNotifier presenceNotifier;
    private final FanOutDispatcher dispatcher;
    private final ReceiptHandler receiptHandler;
    private final Executor dbExecutor;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         ObjectMapper objectMapper,
                         JwtService jwtService,
                         WindowedRateLimiter limiter,
                         PresenceNotifier presenceNotifier,
                         FanOutDispatcher dispatcher,
                         ReceiptHandler receiptHandler,
                         @Qualifier("chatDbExecutor") Executor dbExecutor) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.jwtService = jwtService;
        this.limiter = limiter;
        this.presenceNotifier = presenceNotifier;
        this.dispatcher = dispatcher;
        this.receiptHandler = receiptHandler;
        this.dbExecutor = dbExecutor;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting Netty WS gateway on {}:{}{}", props.host(), props.port(), props.path());

        // boss 负责 accept，worker 负责已建立连接的读写
        boss = new NioEventLoopGroup(1);
        worker = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();

                        // 1) 握手阶段是 HTTP
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(props.maxFrameBytesEffective()));

                        // 2) 写空闲触发应用层 PING
                        p.addLast(new IdleStateHandler(0, props.writerIdleSecondsEffective(), 0));

                        // 3) Upgrade 前验 token + 建连限流
                        p.addLast(new WsHandshakeAuthHandler(props.path(), jwtService, limiter));

                        // 4) 协议层握手、ping/pong、关闭帧
                        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(props.path())
                                .checkStartsWith(true)
                                .allowExtensions(true)
                                .maxFramePayloadLength(props.maxFrameBytesEffective())
                                .build();
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));

                        // 5) 业务帧
                        p.addLast(new WsFrameHandler(objectMapper, presenceNotifier, dispatcher, limiter, receiptHandler, dbExecutor));
                    }
                });

        try {
            serverChannel = b.bind(props.host(), props.port()).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", props.host(), props.port(), props.path(), e);
            stop();
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping Netty WS gateway...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (worker != null) {
            worker.shutdownGracefully();
        }
        if (boss != null) {
            boss.shutdownGracefully();
        }
        log.info("Netty WS gateway stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 最后启动、最先停止：先停止接入再关闭业务 bean
        return Integer.MAX_VALUE;
    }
}
