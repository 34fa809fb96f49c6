package com.agentverse.authz.infrastructure.web;

import com.agentverse.authz.domain.error.UnauthenticatedException;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.CallerIdentityValidator;
import com.agentverse.security.IdentityValidationResult;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Injects the request's {@link CallerIdentity} into controller methods; fails with 401 when the
 * request carries no valid identity.
 */
public class CallerIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerIdentity resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        Object attribute = webRequest.getAttribute(
                CallerIdentityFilter.IDENTITY_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (!(attribute instanceof CallerIdentity identity)) {
            throw new UnauthenticatedException("Missing caller identity");
        }
        IdentityValidationResult result = CallerIdentityValidator.validate(identity);
        if (!result.valid()) {
            throw new UnauthenticatedException("Invalid caller identity: " + String.join("; ", result.errors()));
        }
        return identity;
    }
}
