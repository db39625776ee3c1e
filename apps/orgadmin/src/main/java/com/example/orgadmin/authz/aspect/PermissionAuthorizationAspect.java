package com.example.orgadmin.authz.aspect;

import com.example.orgadmin.authz.actor.ActorResolver;
import com.example.orgadmin.authz.annotation.RequiresPermission;
import com.example.orgadmin.authz.engine.PolicyEvaluator;
import com.example.orgadmin.authz.exception.MissingActorException;
import com.example.orgadmin.authz.exception.PermissionDeniedException;
import com.example.orgadmin.authz.model.RequestResourceIds;
import com.example.orgadmin.authz.model.RequiredPermission;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Enforces {@link RequiresPermission} on reactive controller methods.
 * The method body is subscribed only after every declared permission was granted.
 */
@Slf4j
@Aspect
@Component
@Order(1)
@ConditionalOnProperty(name = "app.authz.enabled", havingValue = "true")
public class PermissionAuthorizationAspect {

    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {};

    private final PolicyEvaluator policyEvaluator;
    private final ActorResolver actorResolver;
    private final ObjectMapper objectMapper;

    public PermissionAuthorizationAspect(
            PolicyEvaluator policyEvaluator,
            ActorResolver actorResolver,
            ObjectMapper objectMapper) {
        this.policyEvaluator = policyEvaluator;
        this.actorResolver = actorResolver;
        this.objectMapper = objectMapper;
    }

    @Around("@annotation(com.example.orgadmin.authz.annotation.RequiresPermission)"
            + " || @annotation(com.example.orgadmin.authz.annotation.RequiresPermissions)")
    public Object checkPermissions(ProceedingJoinPoint joinPoint) throws Throwable {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        List<RequiredPermission> required = Arrays.stream(method.getAnnotationsByType(RequiresPermission.class))
                .map(annotation -> RequiredPermission.of(annotation.resource(), annotation.action(), annotation.scope()))
                .toList();

        Class<?> returnType = method.getReturnType();
        if (Mono.class.isAssignableFrom(returnType)) {
            return authorize(joinPoint, method, required)
                    .then(Mono.defer(() -> proceedMono(joinPoint)));
        }
        if (Flux.class.isAssignableFrom(returnType)) {
            return authorize(joinPoint, method, required)
                    .thenMany(Flux.defer(() -> proceedFlux(joinPoint)));
        }
        throw new IllegalStateException("@RequiresPermission requires a Mono or Flux return type: " + method.getName());
    }

    private Mono<Void> authorize(ProceedingJoinPoint joinPoint, Method method, List<RequiredPermission> required) {
        ServerWebExchange exchange = extractExchange(joinPoint.getArgs());
        if (exchange == null) {
            log.error("No ServerWebExchange found in method arguments: {}", method.getName());
            return Mono.error(new IllegalStateException("Request context unavailable"));
        }
        RequestResourceIds resourceIds = extractResourceIds(method, joinPoint.getArgs(), exchange);

        return actorResolver.resolve(exchange)
                .switchIfEmpty(Mono.error(() -> new MissingActorException("Authentication required")))
                .flatMap(actor -> policyEvaluator.evaluate(actor, required, resourceIds)
                        .flatMap(result -> {
                            if (result.allowed()) {
                                log.debug("Permission check passed for {}", method.getName());
                                return Mono.<Void>empty();
                            }
                            return Mono.error(new PermissionDeniedException(actor.id(), result));
                        }));
    }

    private RequestResourceIds extractResourceIds(Method method, Object[] args, ServerWebExchange exchange) {
        Map<String, String> params = new HashMap<>();
        Map<String, Object> body = Map.of();
        Parameter[] parameters = method.getParameters();

        for (int i = 0; i < parameters.length; i++) {
            if (args[i] == null) {
                continue;
            }
            PathVariable pathVariable = parameters[i].getAnnotation(PathVariable.class);
            if (pathVariable != null) {
                params.put(pathVariableName(pathVariable, parameters[i]), args[i].toString());
            } else if (parameters[i].isAnnotationPresent(RequestBody.class)) {
                body = bodyAsMap(args[i]);
            }
        }

        return new RequestResourceIds(params, body, exchange.getRequest().getQueryParams().toSingleValueMap());
    }

    private Map<String, Object> bodyAsMap(Object body) {
        if (body instanceof Mono || body instanceof Flux) {
            return Map.of();
        }
        try {
            return objectMapper.convertValue(body, BODY_TYPE);
        } catch (IllegalArgumentException e) {
            log.debug("Request body of type {} is not an object, ignoring for resource id lookup",
                    body.getClass().getSimpleName());
            return Map.of();
        }
    }

    private static String pathVariableName(PathVariable pathVariable, Parameter parameter) {
        if (!pathVariable.value().isEmpty()) {
            return pathVariable.value();
        }
        if (!pathVariable.name().isEmpty()) {
            return pathVariable.name();
        }
        return parameter.getName();
    }

    @Nullable
    private static ServerWebExchange extractExchange(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof ServerWebExchange exchange) {
                return exchange;
            }
        }
        return null;
    }

    private static Mono<Object> proceedMono(ProceedingJoinPoint joinPoint) {
        try {
            Object result = joinPoint.proceed();
            return result != null ? ((Mono<?>) result).cast(Object.class) : Mono.empty();
        } catch (Throwable e) {
            return Mono.error(e);
        }
    }

    private static Flux<Object> proceedFlux(ProceedingJoinPoint joinPoint) {
        try {
            Object result = joinPoint.proceed();
            return result != null ? ((Flux<?>) result).cast(Object.class) : Flux.empty();
        } catch (Throwable e) {
            return Flux.error(e);
        }
    }
}
