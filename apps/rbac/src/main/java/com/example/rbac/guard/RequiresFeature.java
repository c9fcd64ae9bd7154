package com.example.rbac.guard;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Guards a reactive handler method with a feature check.
 *
 * <p>The method must return {@code Mono} and take a {@code ServerWebExchange} argument.
 *
 * <pre>
 * {@literal @}PostMapping("/pjo/{id}/approve")
 * {@literal @}RequiresFeature("pjo.approve")
 * public Mono&lt;Pjo&gt; approve(@PathVariable String id, ServerWebExchange exchange) {...}
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresFeature {

    /**
     * Feature key that must be granted.
     */
    String value();
}
