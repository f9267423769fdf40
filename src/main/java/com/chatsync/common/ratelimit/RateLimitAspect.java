package com.chatsync.common.ratelimit;

import com.chatsync.auth.web.AuthContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.ReflectionUtils;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.reflect.Method;

/**
 * HTTP 接口准入：拦截 {@link RateLimit} 标注的方法，按分类查窗口计数，超限抛 {@link RateLimitExceededException}。
 */
@Slf4j
@Aspect
@Order(Ordered.HIGHEST_PRECEDENCE)
@Component
@RequiredArgsConstructor
public class RateLimitAspect {

    private final RateLimitProperties props;
    private final WindowedRateLimiter limiter;

    @Around("@annotation(com.chatsync.common.ratelimit.RateLimit)")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        if (!props.isEnabled()) {
            return pjp.proceed();
        }

        RateLimit rateLimit = resolveRateLimitAnnotation(pjp);
        if (rateLimit == null) {
            return pjp.proceed();
        }

        HttpServletRequest req = currentRequest();
        String key = buildKey(req, rateLimit.key());
        if (key == null) {
            log.debug("ratelimit skipped, no key: method={}, keyType={}", pjp.getSignature().toShortString(), rateLimit.key());
            return pjp.proceed();
        }

        limiter.acquire(rateLimit.value(), key);
        return pjp.proceed();
    }

    String buildKey(HttpServletRequest req, RateLimitKey keyType) {
        Long uid = AuthContext.getUserId();
        if (keyType == RateLimitKey.USER) {
            return uid == null ? null : "user:" + uid;
        }
        if (keyType == RateLimitKey.AUTO && uid != null) {
            return "user:" + uid;
        }
        String ip = resolveIp(req);
        return ip == null || ip.isBlank() ? null : "ip:" + ip;
    }

    String resolveIp(HttpServletRequest req) {
        if (req == null) {
            return null;
        }
        if (props.isTrustForwardedHeaders()) {
            String xff = req.getHeader("X-Forwarded-For");
            if (xff != null && !xff.isBlank()) {
                String first = xff.split(",")[0].trim();
                if (!first.isBlank()) {
                    return first;
                }
            }
            String xri = req.getHeader("X-Real-IP");
            if (xri != null && !xri.isBlank()) {
                return xri.trim();
            }
        }
        return req.getRemoteAddr();
    }

    private HttpServletRequest currentRequest() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attrs) {
            return attrs.getRequest();
        }
        return null;
    }

    private static RateLimit resolveRateLimitAnnotation(ProceedingJoinPoint pjp) {
        if (pjp == null || !(pjp.getSignature() instanceof MethodSignature sig)) {
            return null;
        }

        Method method = sig.getMethod();
        RateLimit ann = method.getAnnotation(RateLimit.class);
        if (ann != null) {
            return ann;
        }

        // 代理场景下接口方法上拿不到注解，回退到实现类
        Object target = pjp.getTarget();
        if (target == null) {
            return null;
        }
        Method impl = ReflectionUtils.findMethod(target.getClass(), method.getName(), method.getParameterTypes());
        return impl == null ? null : impl.getAnnotation(RateLimit.class);
    }
}
