package com.rentdesk.backend.audit;

import com.rentdesk.backend.entities.AuditEvent;
import com.rentdesk.backend.enums.AuditEventStatus;
import com.rentdesk.backend.services.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class AuditAspect {

    public static final String ACTOR_HEADER = "X-Actor";
    static final String SYSTEM_ACTOR = "SYSTEM";

    private final AuditService auditService;

    @Around("@annotation(auditable)")
    public Object audit(ProceedingJoinPoint joinPoint, Auditable auditable) throws Throwable {
        HttpServletRequest request = currentRequest();
        String actor = resolveActor(request);
        String ipAddress = resolveClientIp(request);

        Map<String, Object> details = new HashMap<>();
        AuditEventStatus status = AuditEventStatus.SUCCESS;
        String entityId = null;

        try {
            Object[] args = joinPoint.getArgs();
            if (args != null && args.length > 0) {
                details.put("arguments", extractRelevantArguments(args));
            }

            Object result = joinPoint.proceed();
            entityId = extractEntityId(result);
            details.put("result", "Operation completed successfully");
            return result;
        } catch (Exception e) {
            status = AuditEventStatus.FAILURE;
            details.put("error", e.getMessage());
            details.put("errorType", e.getClass().getSimpleName());
            throw e;
        } finally {
            AuditEvent event = auditService.createEvent(
                    actor,
                    ipAddress,
                    auditable.action(),
                    entityId,
                    auditable.entityType(),
                    details,
                    status
            );
            auditService.logEvent(event);
        }
    }

    private HttpServletRequest currentRequest() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            return attributes.getRequest();
        }
        return null;
    }

    /**
     * Operator name passed by the back-office front end; scheduled runs have no request and audit as SYSTEM.
     */
    private String resolveActor(HttpServletRequest request) {
        if (request == null) {
            return SYSTEM_ACTOR;
        }
        String actor = request.getHeader(ACTOR_HEADER);
        return actor == null || actor.isBlank() ? "ANONYMOUS" : actor.trim();
    }

    private String resolveClientIp(HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return forwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private String extractEntityId(Object result) {
        if (result == null) return null;
        try {
            Method getIdMethod = result.getClass().getMethod("getId");
            Object id = getIdMethod.invoke(result);
            return id != null ? id.toString() : null;
        } catch (ReflectiveOperationException e) {
            log.debug("[Audit] no id on {}", result.getClass().getSimpleName());
            return null;
        }
    }

    private Map<String, Object> extractRelevantArguments(Object[] args) {
        Map<String, Object> relevant = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            if (arg == null) continue;

            if (arg instanceof String || arg instanceof Number || arg instanceof Boolean || arg instanceof UUID) {
                relevant.put("arg" + i, arg.toString());
            } else {
                relevant.put("arg" + i + "_type", arg.getClass().getSimpleName());
            }
        }
        return relevant;
    }
}
