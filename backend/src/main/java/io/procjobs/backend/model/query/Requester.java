package io.procjobs.backend.model.query;

import lombok.Value;

/**
 * Resolved identity of the caller and its permission level.
 */
@Value
public class Requester {

    private static final Requester ANONYMOUS = new Requester(null, false);

    String userId;
    boolean admin;

    public static Requester anonymous() {
        return ANONYMOUS;
    }

    public static Requester user(String userId) {
        return new Requester(userId, false);
    }

    public static Requester admin(String userId) {
        return new Requester(userId, true);
    }

    public boolean isAnonymous() {
        return userId == null && !admin;
    }

    public boolean owns(String ownerId) {
        return userId != null && userId.equals(ownerId);
    }
}
