package com.foodtruck.common.security;

import com.foodtruck.common.exception.BusinessException;
import com.foodtruck.common.exception.ErrorCode;
import com.foodtruck.user.entity.Role;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.foodtruck.common.security.AccessAction.*;
import static com.foodtruck.common.security.AccessScope.ANY;
import static com.foodtruck.common.security.AccessScope.OWN;

/**
 * Role-based permission table consulted before every state change.
 *
 * <p>Each (role, resource, action) cell holds the widest {@link AccessScope}
 * the role is granted, or nothing when the action is denied. Ownership is
 * supplied by the caller, the table itself holds no state and never touches
 * the database.</p>
 *
 * <pre>
 *            PRODUCT            USER               ORDER
 * ADMIN      read/write ANY     read/write ANY     everything ANY
 * STAFF      read ANY           read OWN           create/read/update/advance/cancel ANY, rate OWN
 * CUSTOMER   read ANY           read OWN           create/read/update/cancel/rate OWN
 * </pre>
 */
@Component
public class AccessPolicy {

    private static final Map<Role, Map<AccessResource, Map<AccessAction, AccessScope>>> RULES = Map.of(
            Role.ADMIN, Map.of(
                    AccessResource.PRODUCT, Map.of(READ, ANY, CREATE, ANY, UPDATE, ANY, DELETE, ANY),
                    AccessResource.USER, Map.of(READ, ANY, CREATE, ANY, UPDATE, ANY, DELETE, ANY),
                    AccessResource.ORDER, Map.of(READ, ANY, CREATE, ANY, UPDATE, ANY, DELETE, ANY,
                            ADVANCE, ANY, CANCEL, ANY, RATE, ANY)),
            Role.STAFF, Map.of(
                    AccessResource.PRODUCT, Map.of(READ, ANY),
                    AccessResource.USER, Map.of(READ, OWN),
                    AccessResource.ORDER, Map.of(READ, ANY, CREATE, ANY, UPDATE, ANY,
                            ADVANCE, ANY, CANCEL, ANY, RATE, OWN)),
            Role.CUSTOMER, Map.of(
                    AccessResource.PRODUCT, Map.of(READ, ANY),
                    AccessResource.USER, Map.of(READ, OWN),
                    AccessResource.ORDER, Map.of(READ, OWN, CREATE, OWN, UPDATE, OWN,
                            CANCEL, OWN, RATE, OWN))
    );

    public boolean isAllowed(Role role, AccessResource resource, AccessAction action, boolean owner) {
        AccessScope scope = scopeOf(role, resource, action);
        if (scope == null) {
            return false;
        }
        return scope == ANY || owner;
    }

    /**
     * True when the role may act on entities owned by anyone, e.g. list every order.
     */
    public boolean hasUnrestrictedAccess(Role role, AccessResource resource, AccessAction action) {
        return scopeOf(role, resource, action) == ANY;
    }

    public void check(AuthenticatedUser actor, AccessResource resource, AccessAction action, boolean owner) {
        if (actor == null || !isAllowed(actor.role(), resource, action, owner)) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, String.format(
                    "Role %s may not %s %s%s",
                    actor == null ? "ANONYMOUS" : actor.role(),
                    action.name().toLowerCase(),
                    owner ? "" : "another user's ",
                    resource.name().toLowerCase()));
        }
    }

    private AccessScope scopeOf(Role role, AccessResource resource, AccessAction action) {
        if (role == null) {
            return null;
        }
        return RULES.getOrDefault(role, Map.of())
                .getOrDefault(resource, Map.of())
                .get(action);
    }
}
