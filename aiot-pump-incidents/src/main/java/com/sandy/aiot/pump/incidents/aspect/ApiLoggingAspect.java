package com.sandy.aiot.pump.incidents.aspect;

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request/response log line for every REST handler. Read-only calls (GET) log at DEBUG since dashboards
 * poll them; device posts and operator actions log at INFO.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_BODY_CHARS = 2000;

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.aiot.pump.incidents.controller..*)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.nanoTime();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? request.getRequestURI() : "";
        boolean readOnly = "GET".equals(method);

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String handler = sig.getDeclaringType().getSimpleName() + "." + sig.getName();
        if (readOnly ? log.isDebugEnabled() : log.isInfoEnabled()) {
            String line = String.format("API Request: method=%s uri=%s query=%s handler=%s args=%s",
                    method, uri, request != null ? request.getQueryString() : null, handler, toJson(namedArgs(sig, pjp.getArgs())));
            if (readOnly) log.debug(line); else log.info(line);
        }

        try {
            Object result = pjp.proceed();
            long ms = (System.nanoTime() - start) / 1_000_000;
            Object body = result instanceof ResponseEntity<?> re ? re.getBody() : result;
            String status = result instanceof ResponseEntity<?> re ? String.valueOf(re.getStatusCode().value()) : "200";
            if (readOnly) {
                log.debug("API Response: method={} uri={} handler={} status={} durationMs={}", method, uri, handler, status, ms);
            } else {
                log.info("API Response: method={} uri={} handler={} status={} durationMs={} body={}", method, uri, handler, status, ms, toJson(body));
            }
            return result;
        } catch (Throwable t) {
            long ms = (System.nanoTime() - start) / 1_000_000;
            log.warn("API Error: method={} uri={} handler={} durationMs={} errorType={} message={}",
                    method, uri, handler, ms, t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
    }

    private Map<String, Object> namedArgs(MethodSignature sig, Object[] args) {
        String[] names = sig.getParameterNames();
        Map<String, Object> argMap = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String name = names != null && i < names.length ? names[i] : ("arg" + i);
            argMap.put(name, args[i]);
        }
        return argMap;
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            if (s.length() > MAX_BODY_CHARS) {
                return s.substring(0, MAX_BODY_CHARS) + "...(" + (s.length() - MAX_BODY_CHARS) + " more chars)";
            }
            return s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}
