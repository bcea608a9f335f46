package com.flagship.escrow_engine.member;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.UUID;

/**
 * A contract party as it appears in responses: either just an id, or an
 * embedded summary. Resolved once by {@link MembershipDirectory#resolveParty}.
 */
public sealed interface PartyRef permits PartyRef.Id, PartyRef.Embedded {

    UUID userId();

    record Id(UUID userId) implements PartyRef {
        @JsonValue
        public String value() {
            return userId.toString();
        }
    }

    record Embedded(PartyInfo info) implements PartyRef {
        @Override
        public UUID userId() {
            return info.userId();
        }

        @JsonValue
        public PartyInfo value() {
            return info;
        }
    }

    record PartyInfo(UUID userId, String displayName, String email, boolean identityVerified) {
    }
}
