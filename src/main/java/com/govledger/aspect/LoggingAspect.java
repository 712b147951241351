package com.govledger.aspect;

import com.govledger.exception.GovernanceViolation;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Method execution logging for the ledger layers.
 *
 * - Services: entry with parameters, outcome and duration at DEBUG,
 *   rejected requests at INFO, unexpected failures at ERROR
 * - Controllers: one line per request/response at INFO
 * - Repositories: DEBUG only, plus slow query warnings
 *
 * Governance rejections (GovernanceViolation) are expected outcomes and are
 * not logged as errors.
 */
@Aspect
@Component
public class LoggingAspect {

    private static final Logger log = LoggerFactory.getLogger(LoggingAspect.class);

    private static final long SLOW_SERVICE_MS = 1000;
    private static final long SLOW_QUERY_MS = 500;

    @Around("execution(public * com.govledger.service..*(..))")
    public Object logServiceMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        boolean outermost = MDC.get("executionId") == null;
        if (outermost) {
            MDC.put("executionId", generateExecutionId());
        }

        if (log.isDebugEnabled()) {
            log.debug("SERVICE CALL: {}.{}({})", className, methodName, formatArguments(signature, joinPoint.getArgs()));
        }

        long startTime = System.currentTimeMillis();
        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            if (log.isDebugEnabled()) {
                log.debug("✓ {}.{} returned {} in {} ms", className, methodName, formatParameter(result), executionTime);
            }
            if (executionTime > SLOW_SERVICE_MS) {
                log.warn("⚠ SLOW OPERATION: {}.{} took {} ms", className, methodName, executionTime);
            }
            return result;

        } catch (Exception e) {
            if (e instanceof GovernanceViolation violation) {
                log.info("✗ {}.{} rejected: {} - {}", className, methodName, violation.errorCode(), e.getMessage());
            } else {
                log.error("✗ {}.{} failed - {}: {}", className, methodName, e.getClass().getSimpleName(), e.getMessage());
            }
            throw e;

        } finally {
            if (outermost) {
                MDC.remove("executionId");
            }
        }
    }

    @Around("execution(* com.govledger.controller..*(..))")
    public Object logControllerMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        log.info("→ HTTP REQUEST: {}.{}", className, methodName);

        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;
            log.info("← HTTP RESPONSE: {}.{} completed in {} ms", className, methodName, executionTime);
            return result;

        } catch (Exception e) {
            long executionTime = System.currentTimeMillis() - startTime;
            log.info("← HTTP ERROR: {}.{} failed after {} ms - {}: {}",
                     className, methodName, executionTime, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    @Around("execution(* com.govledger.repository..*(..))")
    public Object logRepositoryMethods(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();

        if (log.isDebugEnabled()) {
            String params = joinPoint.getArgs() != null ? Arrays.stream(joinPoint.getArgs())
                .map(this::formatParameter)
                .collect(Collectors.joining(", ")) : "";
            log.debug("DB CALL: {}.{}({})", className, methodName, params);
        }

        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long executionTime = System.currentTimeMillis() - startTime;

            // Lock waits on the ledger state row show up here
            if (executionTime > SLOW_QUERY_MS) {
                log.warn("⚠ SLOW QUERY: {}.{} took {} ms", className, methodName, executionTime);
            }
            return result;

        } catch (Exception e) {
            log.error("DB ERROR: {}.{} - {}: {}", className, methodName, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    private String formatArguments(MethodSignature signature, Object[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        String[] paramNames = signature.getParameterNames();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            String paramName = (paramNames != null && i < paramNames.length) ? paramNames[i] : "arg" + i;
            sb.append(paramName).append('=').append(maskIfSensitive(paramName, args[i]));
        }
        return sb.toString();
    }

    private String maskIfSensitive(String paramName, Object value) {
        if (paramName.toLowerCase().contains("password")) {
            return "[REDACTED]";
        }
        return formatParameter(value);
    }

    /**
     * Format parameter for logging (truncate long values, mask sensitive data).
     */
    private String formatParameter(Object param) {
        if (param == null) {
            return "null";
        }

        String value = param.toString();

        if (value.contains("password") || value.contains("token") || value.contains("secret")) {
            return "[REDACTED]";
        }

        if (value.length() > 100) {
            return value.substring(0, 97) + "...";
        }

        return value;
    }

    private String generateExecutionId() {
        return String.format("%d-%d", System.currentTimeMillis(), Thread.currentThread().getId());
    }
}
