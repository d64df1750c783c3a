package com.dyntable.tableservice.security;

import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * 从认证网关设置的请求头中解析当前 {@link Actor}
 */
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_ADMIN_HEADER = "X-Actor-Admin";
    static final String ANONYMOUS = "anonymous";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String id = webRequest.getHeader(ACTOR_ID_HEADER);
        if (id == null || id.isBlank()) {
            id = ANONYMOUS;
        }
        boolean admin = Boolean.parseBoolean(webRequest.getHeader(ACTOR_ADMIN_HEADER));
        return admin ? Actor.admin(id.trim()) : Actor.user(id.trim());
    }
}
