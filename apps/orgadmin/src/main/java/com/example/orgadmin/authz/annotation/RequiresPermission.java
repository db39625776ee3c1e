package com.example.orgadmin.authz.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a permission a controller method requires. Repeat the annotation to require
 * several permissions at once; all of them must be granted.
 *
 * <p>The method must return a {@code Mono} or {@code Flux} and take a {@code ServerWebExchange}
 * argument. For scoped permissions the resource id is looked up in {@code @PathVariable}
 * arguments, then the {@code @RequestBody}, then query parameters, under {@code id} or
 * {@code <resource>Id}.
 *
 * <p>Example usage:
 * <pre>
 * {@literal @}PutMapping("/departments/{id}")
 * {@literal @}RequiresPermission(resource = "department", action = "UPDATE", scope = "DEPARTMENT")
 * public Mono&lt;Department&gt; update(@PathVariable String id, ServerWebExchange exchange) {...}
 * </pre>
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(RequiresPermissions.class)
public @interface RequiresPermission {

    String resource();

    String action();

    /**
     * OWN, DEPARTMENT, SCHOOL or ALL. Empty means unscoped.
     */
    String scope() default "";
}
