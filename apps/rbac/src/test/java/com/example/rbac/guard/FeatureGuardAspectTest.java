package com.example.rbac.guard;

import com.example.rbac.audit.AccessAuditService;
import com.example.rbac.common.exception.FeatureAccessDeniedException;
import com.example.rbac.department.DepartmentInheritanceMap;
import com.example.rbac.engine.AccessDecision;
import com.example.rbac.engine.FeatureAccessEngine;
import com.example.rbac.engine.VirtualPermissions;
import com.example.rbac.feature.FeatureCatalog;
import com.example.rbac.permission.PermissionBundleTable;
import com.example.rbac.role.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static com.example.rbac.util.UserProfileTestBuilder.aProfileWithRole;
import static com.example.rbac.util.UserProfileTestBuilder.aScopedManager;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FeatureGuardAspect")
class FeatureGuardAspectTest {

    @Mock
    private CurrentProfileResolver profileResolver;

    @Mock
    private AccessAuditService auditService;

    private final FeatureAccessEngine engine = new FeatureAccessEngine(
            PermissionBundleTable.standard(),
            DepartmentInheritanceMap.standard(),
            FeatureCatalog.standard(),
            VirtualPermissions.ROLE_DEFAULTS);

    private MockServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/jo/42/costs").build());
    }

    private JobOrderHandler guarded(FeatureGuardAspect aspect, JobOrderHandler target) {
        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.addAspect(aspect);
        return factory.getProxy();
    }

    @Nested
    @DisplayName("with a resolved profile")
    class WithProfile {

        @Test
        @DisplayName("should proceed when the feature is granted")
        void proceedsWhenGranted() {
            JobOrderHandler target = new JobOrderHandler();
            when(profileResolver.resolve(exchange)).thenReturn(Mono.just(aScopedManager("operations")));
            JobOrderHandler handler = guarded(new FeatureGuardAspect(engine, profileResolver, auditService), target);

            StepVerifier.create(handler.fillCosts("42", exchange))
                    .expectNext("costs:42")
                    .verifyComplete();

            assertThat(target.invocations.get()).isEqualTo(1);
            verify(auditService).logDecision(any(), argThat(AccessDecision::isAllowed), eq("fillCosts"), any());
        }

        @Test
        @DisplayName("should error without invoking the handler when denied")
        void deniesWithoutInvoking() {
            JobOrderHandler target = new JobOrderHandler();
            when(profileResolver.resolve(exchange)).thenReturn(Mono.just(aProfileWithRole(Role.HR)));
            JobOrderHandler handler = guarded(new FeatureGuardAspect(engine, profileResolver, auditService), target);

            StepVerifier.create(handler.fillCosts("42", exchange))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(FeatureAccessDeniedException.class);
                        FeatureAccessDeniedException denied = (FeatureAccessDeniedException) error;
                        assertThat(denied.getFeatureKey()).isEqualTo("jo.fill_costs");
                        assertThat(denied.getReason()).isEqualTo(AccessDecision.Reason.DENIED);
                    })
                    .verify();

            assertThat(target.invocations.get()).isZero();
        }

        @Test
        @DisplayName("should work without an audit service")
        void withoutAudit() {
            when(profileResolver.resolve(exchange)).thenReturn(Mono.just(aProfileWithRole(Role.OPS)));
            JobOrderHandler handler = guarded(new FeatureGuardAspect(engine, profileResolver, null), new JobOrderHandler());

            StepVerifier.create(handler.fillCosts("7", exchange))
                    .expectNext("costs:7")
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("fail closed")
    class FailClosed {

        @Test
        @DisplayName("should deny when the caller has no profile")
        void noProfile() {
            JobOrderHandler target = new JobOrderHandler();
            when(profileResolver.resolve(exchange)).thenReturn(Mono.empty());
            JobOrderHandler handler = guarded(new FeatureGuardAspect(engine, profileResolver, auditService), target);

            StepVerifier.create(handler.fillCosts("42", exchange))
                    .expectErrorSatisfies(error -> assertThat(((FeatureAccessDeniedException) error).getReason())
                            .isEqualTo(AccessDecision.Reason.NO_PROFILE))
                    .verify();

            assertThat(target.invocations.get()).isZero();
            verify(auditService).logDecision(isNull(),
                    argThat(decision -> decision.reason() == AccessDecision.Reason.NO_PROFILE),
                    eq("fillCosts"), any());
        }

        @Test
        @DisplayName("should deny when no resolver is available")
        void noResolver() {
            JobOrderHandler target = new JobOrderHandler();
            JobOrderHandler handler = guarded(new FeatureGuardAspect(engine, null, auditService), target);

            StepVerifier.create(handler.fillCosts("42", exchange))
                    .expectError(FeatureAccessDeniedException.class)
                    .verify();

            assertThat(target.invocations.get()).isZero();
            verify(auditService).logError(eq("jo.fill_costs"), any(), eq("fillCosts"), any());
        }

        @Test
        @DisplayName("should deny when the method has no exchange argument")
        void noExchange() {
            JobOrderHandler target = new JobOrderHandler();
            JobOrderHandler handler = guarded(new FeatureGuardAspect(engine, profileResolver, null), target);

            StepVerifier.create(handler.deletePib("PIB-1"))
                    .expectError(FeatureAccessDeniedException.class)
                    .verify();

            assertThat(target.invocations.get()).isZero();
        }
    }

    public static class JobOrderHandler {

        final AtomicInteger invocations = new AtomicInteger();

        @RequiresFeature("jo.fill_costs")
        public Mono<String> fillCosts(String jobOrderId, ServerWebExchange exchange) {
            invocations.incrementAndGet();
            return Mono.just("costs:" + jobOrderId);
        }

        @RequiresFeature("pib.delete")
        public Mono<String> deletePib(String pibId) {
            invocations.incrementAndGet();
            return Mono.just(pibId);
        }
    }
}
