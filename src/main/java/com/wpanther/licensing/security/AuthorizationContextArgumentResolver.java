package com.wpanther.licensing.security;

import com.wpanther.licensing.exception.UnauthenticatedException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Injects the request's {@link AuthorizationContext} into controller parameters of that type.
 */
public class AuthorizationContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AuthorizationContext.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Object context = webRequest.getAttribute(AuthorizationContext.REQUEST_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (context == null) {
            throw new UnauthenticatedException("Authentication required");
        }
        return context;
    }
}
