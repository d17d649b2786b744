package com.orgauth.authservice.infrastructure.web;

import com.orgauth.security.AuthErrorCode;
import com.orgauth.security.AuthException;
import com.orgauth.security.IdentityContext;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/** Injects the verified {@link IdentityContext} into controller methods that declare it. */
public class IdentityContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return IdentityContext.class.equals(parameter.getParameterType());
    }

    @Override
    public IdentityContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        return current(webRequest);
    }

    static IdentityContext current(RequestAttributes request) {
        Object identity =
                request.getAttribute(AccessGateFilter.IDENTITY_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (identity instanceof IdentityContext context) {
            return context;
        }
        throw new AuthException(
                AuthErrorCode.MISSING_OR_MALFORMED_HEADER, "No authenticated identity on this request");
    }
}
