package com.querylab.search.api;

import com.querylab.search.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import org.springframework.util.StringUtils;

/**
 * Trace and request id propagation. Callers that send no id get a fresh UUID echoed back.
 */
public final class RequestIds {
    public static final String TRACE_HEADER = "x-trace-id";
    public static final String REQUEST_HEADER = "x-request-id";

    private RequestIds() {
    }

    public static String resolve(String headerValue) {
        return StringUtils.hasText(headerValue) ? headerValue : UUID.randomUUID().toString();
    }

    public static ErrorResponse error(String code, String message, HttpServletRequest request) {
        return error(code, message, request.getHeader(TRACE_HEADER), request.getHeader(REQUEST_HEADER));
    }

    public static ErrorResponse error(String code, String message, String traceHeader, String requestHeader) {
        return new ErrorResponse(code, message, resolve(traceHeader), resolve(requestHeader));
    }
}
