package com.edge.annotator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 记录标注 API 调用及耗时
 * <p>
 * 指针拖动事件频率很高，只在 DEBUG 级别输出；其余请求为 INFO。
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final String API_PREFIX = "/api/";
    private static final int MAX_BODY_LOG = 500;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        long startTime = System.currentTimeMillis();
        try {
            filterChain.doFilter(requestWrapper, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            boolean verbose = !request.getRequestURI().endsWith("/pointer/drag");

            String body = "";
            byte[] content = requestWrapper.getContentAsByteArray();
            if (content.length > 0) {
                body = new String(content, StandardCharsets.UTF_8);
                if (body.length() > MAX_BODY_LOG) body = body.substring(0, MAX_BODY_LOG) + "...";
            }

            if (verbose) {
                logger.info("{} {} {} | Status: {} | Duration: {} ms", request.getMethod(),
                    request.getRequestURI(), body, response.getStatus(), duration);
            } else if (logger.isDebugEnabled()) {
                logger.debug("{} {} {} | Status: {} | Duration: {} ms", request.getMethod(),
                    request.getRequestURI(), body, response.getStatus(), duration);
            }
        }
    }
}
