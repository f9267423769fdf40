package com.chatsync.domain.mutation;

import com.chatsync.domain.dto.GroupMessagePayload;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.gateway.ws.FanOutDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * 消息类事件的统一出口：单聊 data 直接是消息，群聊 data 包一层 {message, groupId}。
 */
@Component
@RequiredArgsConstructor
public class MessageEventPublisher {

    private final FanOutDispatcher dispatcher;

    public int publish(Collection<Long> audience, MessageView view, String directEvent, String groupEvent) {
        if (view.groupId() != null) {
            return dispatcher.notify(audience, groupEvent, new GroupMessagePayload(view, view.groupId()));
        }
        return dispatcher.notify(audience, directEvent, view);
    }
}
