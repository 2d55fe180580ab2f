package io.procjobs.backend.util;

import io.procjobs.backend.model.query.Requester;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Maps the decoded token of a request to a {@link Requester}.
 * Admins are recognized by the configured role in the {@code roles} claim or in the token scope.
 */
@Component
public class RequesterResolver {

    private final String adminRole;

    @Autowired
    public RequesterResolver(@Value("${app.security.admin-role:admin}") String adminRole) {
        this.adminRole = adminRole;
    }

    public Requester resolve(Jwt jwt) {
        if (jwt == null || jwt.getSubject() == null) {
            return Requester.anonymous();
        }
        return isAdmin(jwt) ? Requester.admin(jwt.getSubject()) : Requester.user(jwt.getSubject());
    }

    private boolean isAdmin(Jwt jwt) {
        Object roles = jwt.getClaims().get("roles");
        if (roles instanceof Collection && ((Collection<?>) roles).contains(adminRole)) {
            return true;
        }
        if (roles instanceof String && adminRole.equals(roles)) {
            return true;
        }
        String scope = jwt.getClaimAsString("scope");
        return scope != null && List.of(scope.split(" ")).contains(adminRole);
    }
}
