package com.ministation.common.ratelimit;

import com.ministation.auth.web.PrincipalContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.reflect.Method;
import java.util.Locale;

/**
 * 处理 {@link RateLimit}：按 (name, 维度值) 计数，超限抛 {@link RateLimitExceededException}。
 *
 * <p>拿不到维度值（匿名请求按 PRINCIPAL 限流、非 HTTP 调用）时不限流。</p>
 */
@Slf4j
@Aspect
@Order(Ordered.HIGHEST_PRECEDENCE)
@Component
@RequiredArgsConstructor
public class RateLimitAspect {

    private final RateLimitProperties props;
    private final FixedWindowLimiter limiter;

    /**
     * 不绑定注解参数：切面排在 ExposeInvocationInterceptor 之前，拿不到 JoinPointMatch，注解需反射取。
     */
    @Around("@annotation(com.ministation.common.ratelimit.RateLimit)")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        if (!props.isEnabled()) {
            return pjp.proceed();
        }
        RateLimit rateLimit = findAnnotation(pjp);
        if (rateLimit == null) {
            return pjp.proceed();
        }
        String key = buildKey(currentRequest(), rateLimit);
        if (key == null) {
            return pjp.proceed();
        }

        long window = Math.max(1, rateLimit.windowSeconds());
        long retryAfter = acquire(key, window, Math.max(1, rateLimit.max()));
        if (retryAfter > 0) {
            log.debug("rate limited: key={}, retryAfter={}s", key, retryAfter);
            throw new RateLimitExceededException("too_many_requests", retryAfter);
        }
        return pjp.proceed();
    }

    private long acquire(String key, long window, long max) {
        try {
            return limiter.hit(key, window, max);
        } catch (RuntimeException e) {
            if (props.isFailOpen()) {
                log.warn("rate limiter unavailable, letting request through: key={}, err={}", key, e.toString());
                return 0;
            }
            log.warn("rate limiter unavailable, rejecting request: key={}, err={}", key, e.toString());
            return window;
        }
    }

    String buildKey(HttpServletRequest req, RateLimit rateLimit) {
        String subject = switch (rateLimit.key()) {
            case PRINCIPAL -> {
                String principal = PrincipalContext.getPrincipal();
                yield principal == null ? null : principal.toLowerCase(Locale.ROOT);
            }
            case IP -> req == null ? null : resolveIp(req);
        };
        if (subject == null || subject.isBlank()) {
            return null;
        }
        String prefix = props.getKeyPrefix() == null ? "" : props.getKeyPrefix();
        return prefix + rateLimit.name() + ":" + rateLimit.key().name() + ":" + subject;
    }

    String resolveIp(HttpServletRequest req) {
        if (props.isTrustForwardedHeaders()) {
            String forwarded = firstToken(req.getHeader("X-Forwarded-For"));
            if (forwarded != null) {
                return forwarded;
            }
            String realIp = firstToken(req.getHeader("X-Real-IP"));
            if (realIp != null) {
                return realIp;
            }
        }
        return req.getRemoteAddr();
    }

    private static String firstToken(String header) {
        if (header == null) {
            return null;
        }
        int comma = header.indexOf(',');
        String token = (comma < 0 ? header : header.substring(0, comma)).trim();
        return token.isEmpty() ? null : token;
    }

    static RateLimit findAnnotation(ProceedingJoinPoint pjp) {
        if (!(pjp.getSignature() instanceof MethodSignature signature)) {
            return null;
        }
        Method method = signature.getMethod();
        Object target = pjp.getTarget();
        if (target != null) {
            Method specific = AopUtils.getMostSpecificMethod(method, target.getClass());
            RateLimit onTarget = AnnotationUtils.findAnnotation(specific, RateLimit.class);
            if (onTarget != null) {
                return onTarget;
            }
        }
        return AnnotationUtils.findAnnotation(method, RateLimit.class);
    }

    private static HttpServletRequest currentRequest() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attrs) {
            return attrs.getRequest();
        }
        return null;
    }
}
