package com.caradonti.finance_ledger.identity;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Reads the actor from the {@code X-Actor-Id} / {@code X-Actor-Name} headers set
 * by the authenticating gateway. Outside a request, or without the headers,
 * the actor is {@link Actor#SYSTEM}.
 */
@Component
public class RequestHeaderActorProvider implements ActorProvider {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_NAME_HEADER = "X-Actor-Name";

    @Override
    public Actor currentActor() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
            return Actor.SYSTEM;
        }

        HttpServletRequest request = servletAttributes.getRequest();
        String id = request.getHeader(ACTOR_ID_HEADER);
        if (id == null || id.isBlank()) {
            return Actor.SYSTEM;
        }
        String name = request.getHeader(ACTOR_NAME_HEADER);
        return new Actor(id.trim(), name != null ? name.trim() : null);
    }
}
