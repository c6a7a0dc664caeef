package com.docgate.security;

import com.docgate.model.IdentifierMapper;

import java.util.Set;

/**
 * The subject on whose behalf an access decision is made.
 *
 * @param userId  internal user id derived from the subject
 * @param subject identity-provider subject
 * @param roles   granted roles
 */
public record Requester(String userId, String subject, Set<Role> roles) {

    public Requester {
        roles = Set.copyOf(roles);
    }

    public static Requester from(Claims claims) {
        return new Requester(IdentifierMapper.userIdForSubject(claims.subject()), claims.subject(), claims.roles());
    }
}
