package com.fun.compute.api.config;

import com.fun.compute.api.model.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.Arrays;

/**
 * Builds a {@link RequestContext} from the identity headers set by the authenticating proxy.
 */
public class RequestContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String PROJECT_HEADER = "X-Project-Id";
    public static final String USER_HEADER = "X-User-Id";
    public static final String ROLES_HEADER = "X-Roles";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return RequestContext.class.equals(parameter.getParameterType());
    }

    @Override
    public RequestContext resolveArgument(MethodParameter parameter,
                                          ModelAndViewContainer mavContainer,
                                          NativeWebRequest webRequest,
                                          WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        String applicationUrl = request == null
                ? ""
                : ServletUriComponentsBuilder.fromContextPath(request).build().toUriString();
        return new RequestContext(
                trimToNull(webRequest.getHeader(PROJECT_HEADER)),
                trimToNull(webRequest.getHeader(USER_HEADER)),
                hasAdminRole(webRequest.getHeader(ROLES_HEADER)),
                applicationUrl
        );
    }

    private boolean hasAdminRole(String roles) {
        if (!StringUtils.hasText(roles)) {
            return false;
        }
        return Arrays.stream(roles.split(","))
                .map(String::trim)
                .anyMatch("admin"::equalsIgnoreCase);
    }

    private String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
