package com.gocomet.tripsafety.admission.web;

import com.gocomet.tripsafety.admission.model.RateLimitDecision;
import com.gocomet.tripsafety.admission.service.RateLimiterService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies {@link RateLimited} quotas before the handler runs. Rejections are
 * thrown and rendered as 429 with Retry-After by the global exception handler.
 */
@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    public static final String ACTOR_HEADER = "X-Actor-Id";

    private final RateLimiterService rateLimiterService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        RateLimited rateLimited = ((HandlerMethod) handler).getMethodAnnotation(RateLimited.class);
        if (rateLimited == null) {
            return true;
        }

        RateLimitDecision decision = rateLimiterService.check(resolveActor(request), rateLimited.value());
        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.limit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
        return true;
    }

    static String resolveActor(HttpServletRequest request) {
        String actor = request.getHeader(ACTOR_HEADER);
        return StringUtils.hasText(actor) ? actor.trim() : "ip:" + request.getRemoteAddr();
    }
}
