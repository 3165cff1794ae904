package com.sandy.aiot.rack.control.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
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
import java.util.concurrent.CompletableFuture;

/**
 * Logs every REST call against the rack API. Command endpoints return a future, so their
 * response line is written when the command resolves rather than when the handler returns.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_BODY_CHARS = 2000;

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.aiot.rack.control.controller..*) && @within(org.springframework.web.bind.annotation.RestController)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? request.getRequestURI() : "";

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        Object[] args = pjp.getArgs();
        String[] paramNames = sig.getParameterNames();

        Map<String, Object> argMap = new LinkedHashMap<>();
        String rackId = null;
        for (int i = 0; i < args.length; i++) {
            Object a = args[i];
            if (a instanceof HttpServletRequest || a instanceof HttpServletResponse) continue;
            String name = paramNames != null && i < paramNames.length ? paramNames[i] : ("arg" + i);
            if ("rackId".equals(name) && a instanceof String s) rackId = s;
            argMap.put(name, a);
        }

        log.info("API Request: method={} uri={} rackId={} handler={} args={}", method, uri, rackId, sig.toShortString(), toJson(argMap));

        Object result;
        try {
            result = pjp.proceed();
        } catch (Throwable t) {
            long cost = System.currentTimeMillis() - start;
            log.warn("API Error: method={} uri={} rackId={} handler={} durationMs={} errorType={} message={}",
                    method, uri, rackId, sig.toShortString(), cost, t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }

        if (result instanceof CompletableFuture<?> future) {
            String rid = rackId;
            future.whenComplete((value, error) -> {
                long cost = System.currentTimeMillis() - start;
                if (error == null) {
                    log.info("API Response: method={} uri={} rackId={} handler={} durationMs={} result={}", method, uri, rid, sig.toShortString(), cost, toJson(value));
                } else {
                    log.error("API Error: method={} uri={} rackId={} handler={} durationMs={} message={}", method, uri, rid, sig.toShortString(), cost, error.getMessage());
                }
            });
            return result;
        }

        long cost = System.currentTimeMillis() - start;
        if (result instanceof ResponseEntity<?> re) {
            log.info("API Response: method={} uri={} rackId={} handler={} status={} durationMs={} body={}", method, uri, rackId, sig.toShortString(), re.getStatusCode(), cost, toJson(re.getBody()));
        } else {
            log.info("API Response: method={} uri={} rackId={} handler={} durationMs={} result={}", method, uri, rackId, sig.toShortString(), cost, toJson(result));
        }
        return result;
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
