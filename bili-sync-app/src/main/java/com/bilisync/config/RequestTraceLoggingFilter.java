package com.bilisync.config;

import com.bilisync.types.common.Constants;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP 链路日志过滤器：写入 traceId/requestId 到 MDC，每个请求输出一行访问日志。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String API_PATH_PREFIX = "/api/";

    private final ObjectMapper objectMapper;
    private final long slowRequestThresholdMs;

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     @Value("${logging.http.slow-request-threshold-ms:1000}") long slowRequestThresholdMs) {
        this.objectMapper = objectMapper;
        this.slowRequestThresholdMs = slowRequestThresholdMs;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith(API_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreateHeader(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreateHeader(request.getHeader(HEADER_REQUEST_ID));
        String path = request.getRequestURI();
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(Constants.MDC_TRACE_ID, traceId);
        MDC.put(Constants.MDC_REQUEST_ID, requestId);

        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper wrapper
                ? wrapper
                : new ContentCachingResponseWrapper(response);
        long startNs = System.nanoTime();
        Throwable error = null;
        try {
            filterChain.doFilter(request, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            String responseCode = StringUtils.defaultIfBlank(extractResponseCode(responseWrapper), "-");
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, errorType={}, errorMessage={}",
                        method, path, responseWrapper.getStatus(), responseCode, costMs,
                        error.getClass().getSimpleName(), error.getMessage());
            } else if (costMs >= slowRequestThresholdMs) {
                log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, slow=true",
                        method, path, responseWrapper.getStatus(), responseCode, costMs);
            } else {
                log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}",
                        method, path, responseWrapper.getStatus(), responseCode, costMs);
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(Constants.MDC_REQUEST_ID);
            MDC.remove(Constants.MDC_TRACE_ID);
        }
    }

    private String resolveOrCreateHeader(String value) {
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private String extractResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        if (body.length == 0) {
            return null;
        }
        String contentType = responseWrapper.getContentType();
        if (StringUtils.isBlank(contentType) || !contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE)) {
            return null;
        }
        try {
            Map<String, Object> responseMap = objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {
            });
            Object code = responseMap.get("code");
            return code == null ? null : String.valueOf(code);
        } catch (IOException ex) {
            log.debug("Response body is not a json object. error={}", ex.getMessage());
            return null;
        }
    }
}
