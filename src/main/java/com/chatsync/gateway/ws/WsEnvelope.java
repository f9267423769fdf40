package com.chatsync.gateway.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * WS 文本帧的 JSON 信封，上下行共用。
 *
 * <p>下行 type：EVENT（业务事件，event + data）、ERROR（reason）、PONG、PING。
 * 上行 type：PING、TYPING、STOP_TYPING、MESSAGE_SEEN。</p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WsEnvelope {

    public String type;

    /** 仅 EVENT：事件名，见 {@link ChatEvents} */
    public String event;

    /** 上行 TYPING/STOP_TYPING 的目标用户 */
    public Long to;

    /** 上行 MESSAGE_SEEN 的消息 id；ERROR 回包时回显 */
    public Long messageId;

    public String reason;

    /** 仅限流 ERROR：多少秒后可重试 */
    public Long retryAfter;

    public Object data;

    public Long ts;

    public static WsEnvelope event(String event, Object data) {
        WsEnvelope e = new WsEnvelope();
        e.type = "EVENT";
        e.event = event;
        e.data = data;
        e.ts = System.currentTimeMillis();
        return e;
    }

    public static WsEnvelope error(String reason, Long messageId) {
        WsEnvelope e = new WsEnvelope();
        e.type = "ERROR";
        e.reason = reason;
        e.messageId = messageId;
        e.ts = System.currentTimeMillis();
        return e;
    }

    public static WsEnvelope of(String type) {
        WsEnvelope e = new WsEnvelope();
        e.type = type;
        e.ts = System.currentTimeMillis();
        return e;
    }
}
