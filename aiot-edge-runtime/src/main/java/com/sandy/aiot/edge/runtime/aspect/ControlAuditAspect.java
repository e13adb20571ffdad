package com.sandy.aiot.edge.runtime.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audits mutations of the runtime control state (mode, scenario, auto-apply).
 * Rejected requests are logged at debug, they are caller errors rather than faults.
 */
@Aspect
@Component
@Slf4j
public class ControlAuditAspect {

    @Around("execution(public void com.sandy.aiot.edge.runtime.service.impl.EdgeRuntimeService.set*(..))")
    public Object auditControlChange(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        MethodSignature sig = (MethodSignature) pjp.getSignature();
        String[] names = sig.getParameterNames();
        Object[] args = pjp.getArgs();
        Map<String, Object> argMap = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            argMap.put(names != null && i < names.length ? names[i] : "arg" + i, args[i]);
        }
        try {
            Object result = pjp.proceed();
            log.info("Control change: operation={} args={} outcome=accepted durationMs={}",
                    sig.getName(), argMap, System.currentTimeMillis() - start);
            return result;
        } catch (IllegalArgumentException e) {
            log.debug("Control change rejected: operation={} args={} reason={}", sig.getName(), argMap, e.getMessage());
            throw e;
        } catch (Throwable t) {
            log.error("Control change failed: operation={} args={} durationMs={} errorType={} message={}",
                    sig.getName(), argMap, System.currentTimeMillis() - start, t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
    }
}
