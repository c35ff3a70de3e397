package com.sandy.adpulse.monitor.aspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.server.ResponseStatusException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request/response log line for every REST handler. Collection arguments (metric batches) are
 * logged by size only.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_JSON_CHARS = 2000;

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.adpulse.monitor.controller..*) && !within(com.sandy.adpulse.monitor.controller.ApiExceptionHandler)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long startedAt = System.currentTimeMillis();
        String call = describeRequest() + " " + pjp.getSignature().toShortString();
        log.info("API call {} args={}", call, toJson(handlerArgs(pjp)));
        try {
            Object result = pjp.proceed();
            long elapsed = System.currentTimeMillis() - startedAt;
            if (result instanceof ResponseEntity<?> entity) {
                log.info("API done {} status={} durationMs={} body={}", call, entity.getStatusCode(), elapsed, toJson(entity.getBody()));
            } else {
                log.info("API done {} durationMs={} result={}", call, elapsed, toJson(result));
            }
            return result;
        } catch (ResponseStatusException e) {
            log.info("API done {} status={} durationMs={} reason={}", call, e.getStatusCode(), System.currentTimeMillis() - startedAt, e.getReason());
            throw e;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("API rejected {} durationMs={} error={}", call, System.currentTimeMillis() - startedAt, e.getMessage());
            throw e;
        } catch (Throwable t) {
            log.error("API failed {} durationMs={} errorType={} message={}", call, System.currentTimeMillis() - startedAt,
                    t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
    }

    private static String describeRequest() {
        if (!(RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attrs)) return "-";
        HttpServletRequest request = attrs.getRequest();
        String query = request.getQueryString();
        return request.getMethod() + " " + request.getRequestURI() + (query == null ? "" : "?" + query);
    }

    private static Map<String, Object> handlerArgs(ProceedingJoinPoint pjp) {
        String[] names = ((MethodSignature) pjp.getSignature()).getParameterNames();
        Object[] values = pjp.getArgs();
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] instanceof HttpServletRequest) continue;
            String name = names != null && i < names.length ? names[i] : "arg" + i;
            Object v = values[i];
            out.put(name, v instanceof Collection<?> c ? c.size() + " items" : v);
        }
        return out;
    }

    private String toJson(Object value) {
        if (value == null) return "null";
        try {
            String json = objectMapper.writeValueAsString(value);
            return json.length() <= MAX_JSON_CHARS ? json
                    : json.substring(0, MAX_JSON_CHARS) + "...(" + (json.length() - MAX_JSON_CHARS) + " more chars)";
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
