package com.al.clinicalsummary.interceptor;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every API request with a request id in the MDC. The request id is separate from the
 * hospitalization id that document processing logs under {@code correlationId}.
 */
@Component
@Slf4j
public class MdcInterceptor implements HandlerInterceptor {

    public static final String MDC_KEY = "requestId";
    public static final String HEADER_KEY = "X-Request-Id";

    static final String START_ATTRIBUTE = MdcInterceptor.class.getName() + ".start";

    // Caller-supplied ids end up in log lines
    private static final Pattern VALID_REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String requestId = request.getHeader(HEADER_KEY);
        if (requestId == null || !VALID_REQUEST_ID.matcher(requestId).matches()) {
            requestId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER_KEY, requestId);
        request.setAttribute(START_ATTRIBUTE, System.currentTimeMillis());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
            @Nullable Exception ex) {
        Object start = request.getAttribute(START_ATTRIBUTE);
        if (start instanceof Long) {
            log.debug("{} {} -> {} in {}ms", request.getMethod(), request.getRequestURI(), response.getStatus(),
                    System.currentTimeMillis() - (Long) start);
        }
        MDC.remove(MDC_KEY);
    }
}
