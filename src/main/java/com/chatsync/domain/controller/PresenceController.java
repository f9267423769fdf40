package com.chatsync.domain.controller;

import com.chatsync.common.api.Result;
import com.chatsync.common.ratelimit.LimitClass;
import com.chatsync.common.ratelimit.RateLimit;
import com.chatsync.gateway.session.PresenceRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 本机在线用户快照；id 以字符串返回，和 WS 的 getOnlineUsers 保持一致。
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/presence")
public class PresenceController {

    private final PresenceRegistry presence;

    @GetMapping("/online")
    @RateLimit(LimitClass.API)
    public Result<List<String>> online() {
        return Result.ok(presence.onlineUserIds().stream().map(String::valueOf).toList());
    }
}
