package com.chatsync.domain.controller;

import com.chatsync.common.api.Result;
import com.chatsync.common.ratelimit.WindowedRateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final WindowedRateLimiter limiter;

    @GetMapping("/ratelimit")
    public Result<WindowedRateLimiter.Metrics> rateLimit() {
        return Result.ok(limiter.metrics());
    }
}
