package com.smartcampus.accessservice.infrastructure.web;

import com.smartcampus.observability.RequestContext;
import com.smartcampus.observability.RequestContextHolder;
import com.smartcampus.security.AuthenticatedIdentity;
import com.smartcampus.security.LinkedEntityResolver;
import com.smartcampus.security.MalformedPrincipalException;
import com.smartcampus.security.Principal;
import com.smartcampus.security.PrincipalFactory;
import com.smartcampus.security.RequestLinkCache;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link Principal} handler argument from the identity headers set by the campus
 * gateway after it has verified the session.
 *
 * <ul>
 *   <li>{@code X-User-Id} and {@code X-User-Role} are required
 *   <li>{@code X-Tenant-Id} is the caller's school code (absent for super administrators)
 *   <li>{@code X-User-Permissions} is a comma-separated permission list
 * </ul>
 *
 * <p>Linked IDs are resolved through a fresh {@link RequestLinkCache} per request. Once built,
 * the principal is bound to the {@link RequestContext} so that log lines name the caller.
 * Headers that do not describe a valid principal raise {@link MalformedPrincipalException}.
 */
@Component
public class PrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";
    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String PERMISSIONS_HEADER = "X-User-Permissions";

    private final LinkedEntityResolver linkedEntityResolver;

    public PrincipalArgumentResolver(LinkedEntityResolver linkedEntityResolver) {
        this.linkedEntityResolver = linkedEntityResolver;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Principal.class.equals(parameter.getParameterType());
    }

    @Override
    public Principal resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        String userId = webRequest.getHeader(USER_ID_HEADER);
        String role = webRequest.getHeader(ROLE_HEADER);
        if (isBlank(userId) || isBlank(role)) {
            throw new MalformedPrincipalException(
                    List.of(USER_ID_HEADER + " and " + ROLE_HEADER + " headers are required"));
        }
        var identity =
                new AuthenticatedIdentity(
                        userId.trim(),
                        role.trim(),
                        webRequest.getHeader(TENANT_HEADER),
                        permissions(webRequest.getHeader(PERMISSIONS_HEADER)));

        Principal principal =
                PrincipalFactory.create(identity, new RequestLinkCache(linkedEntityResolver));
        bindToContext(principal);
        return principal;
    }

    private static void bindToContext(Principal principal) {
        RequestContext current =
                RequestContextHolder.get()
                        .orElseGet(() -> RequestContext.anonymous(UUID.randomUUID().toString()));
        RequestContextHolder.set(
                current.withPrincipal(
                        principal.tenantId(), principal.id(), principal.role().value()));
    }

    static Set<String> permissions(String header) {
        if (isBlank(header)) {
            return Set.of();
        }
        return Arrays.stream(header.split(","))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
