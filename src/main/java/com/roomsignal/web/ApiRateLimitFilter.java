package com.roomsignal.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomsignal.exception.ErrorType;
import com.roomsignal.service.RateLimiter;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tags the request with the client address for logging and applies the
 * general API rate limit to {@code /api/**}.
 */
@Component
public class ApiRateLimitFilter extends OncePerRequestFilter {
    public static final String CLIENT_ADDRESS = "clientAddress";

    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public ApiRateLimitFilter(RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String address = request.getRemoteAddr();
        try {
            MDC.put(CLIENT_ADDRESS, address);

            if (request.getRequestURI().startsWith("/api/")
                    && !rateLimiter.tryAcquire(RateLimiter.Policy.API, address)) {
                reject(response);
                return;
            }
            chain.doFilter(request, response);
        } finally {
            MDC.remove(CLIENT_ADDRESS);
        }
    }

    private void reject(HttpServletResponse response) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ErrorType.RATE_LIMITED.getTag());
        body.put("message", RateLimiter.Policy.API.getMessage());

        response.setStatus(ErrorType.RATE_LIMITED.getHttpStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
