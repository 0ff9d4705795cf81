package com.geobuffer.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Logs the execution time of {@link Timed} methods and keeps the last duration of the
 * current thread for the {@code elapsed} field of API responses
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    private static final ThreadLocal<Long> EXECUTION_TIME = new ThreadLocal<>();

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        long startTime = System.currentTimeMillis();
        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String operation = timed.value().isEmpty() ? joinPoint.getSignature().getName() : timed.value();
        
        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            EXECUTION_TIME.set(duration);
            
            switch (timed.logLevel()) {
                case INFO -> log.info("{}#{} executed in {}ms", className, operation, duration);
                case WARN -> log.warn("{}#{} executed in {}ms", className, operation, duration);
                default -> log.debug("{}#{} executed in {}ms", className, operation, duration);
            }
            
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            EXECUTION_TIME.set(duration);
            log.error("{}#{} failed after {}ms", className, operation, duration, e);
            throw e;
        }
    }
    
    /**
     * Last measured duration of the current thread, cleared on read
     */
    public static String getAndClearExecutionTime() {
        Long duration = EXECUTION_TIME.get();
        EXECUTION_TIME.remove();
        return duration != null ? duration + "ms" : "0ms";
    }
}
