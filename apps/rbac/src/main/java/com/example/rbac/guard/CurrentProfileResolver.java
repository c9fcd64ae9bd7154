package com.example.rbac.guard;

import com.example.rbac.profile.UserProfile;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Loads the profile of the caller. Implemented by the session and persistence layer.
 */
public interface CurrentProfileResolver {

    /**
     * @return the caller's profile, or empty when the request is not authenticated
     */
    Mono<UserProfile> resolve(ServerWebExchange exchange);
}
