package com.example.rbac.guard;

import com.example.rbac.audit.AccessAuditService;
import com.example.rbac.common.exception.FeatureAccessDeniedException;
import com.example.rbac.engine.AccessDecision;
import com.example.rbac.engine.FeatureAccessEngine;
import com.example.rbac.profile.UserProfile;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Enforces {@link RequiresFeature} on reactive handler methods.
 *
 * <p>Fails closed: no resolver, no exchange argument or no profile all deny.
 */
@Aspect
@Order(1)
public class FeatureGuardAspect {

    private static final Logger log = LoggerFactory.getLogger(FeatureGuardAspect.class);

    private final FeatureAccessEngine engine;
    @Nullable
    private final CurrentProfileResolver profileResolver;
    @Nullable
    private final AccessAuditService auditService;

    public FeatureGuardAspect(FeatureAccessEngine engine,
                              @Nullable CurrentProfileResolver profileResolver,
                              @Nullable AccessAuditService auditService) {
        this.engine = engine;
        this.profileResolver = profileResolver;
        this.auditService = auditService;

        if (profileResolver == null) {
            log.warn("No CurrentProfileResolver available; every @RequiresFeature method will be denied");
        }
    }

    @Around("@annotation(requiresFeature)")
    public Object checkFeature(ProceedingJoinPoint joinPoint, RequiresFeature requiresFeature) {
        String featureKey = requiresFeature.value();
        String operation = ((MethodSignature) joinPoint.getSignature()).getMethod().getName();

        ServerWebExchange exchange = extractExchange(joinPoint.getArgs());
        if (exchange == null || profileResolver == null) {
            log.error("Cannot resolve caller for {} (exchange={}, resolver={})",
                    operation, exchange != null, profileResolver != null);
            if (auditService != null) {
                auditService.logError(featureKey, "Caller could not be resolved", operation, null);
            }
            return Mono.error(new FeatureAccessDeniedException(AccessDecision.noProfile(featureKey)));
        }

        return profileResolver.resolve(exchange)
                .map(profile -> audited(profile, engine.evaluate(profile, featureKey), operation, exchange))
                .switchIfEmpty(Mono.fromSupplier(() ->
                        audited(null, AccessDecision.noProfile(featureKey), operation, exchange)))
                .flatMap(decision -> {
                    if (decision.isDenied()) {
                        log.warn("Feature {} denied for {}: {}", featureKey, operation, decision.reason());
                        return Mono.error(new FeatureAccessDeniedException(decision));
                    }
                    log.debug("Feature {} granted for {}: {}", featureKey, operation, decision.reason());
                    try {
                        Object result = joinPoint.proceed();
                        if (result instanceof Mono) {
                            return (Mono<?>) result;
                        }
                        return Mono.justOrEmpty(result);
                    } catch (Throwable e) {
                        return Mono.error(e);
                    }
                });
    }

    private AccessDecision audited(@Nullable UserProfile profile, AccessDecision decision,
                                   String operation, ServerWebExchange exchange) {
        if (auditService != null) {
            auditService.logDecision(profile, decision, operation, exchange.getRequest());
        }
        return decision;
    }

    @Nullable
    private ServerWebExchange extractExchange(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof ServerWebExchange) {
                return (ServerWebExchange) arg;
            }
        }
        return null;
    }
}
