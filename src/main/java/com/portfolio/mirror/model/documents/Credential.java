package com.portfolio.mirror.model.documents;

import com.portfolio.mirror.enums.CredentialKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * One stored brokerage token. At most one active ACCESS and one active REFRESH row exist per person;
 * rotation retires the previous rows instead of updating them in place.
 * The token itself is only ever held encrypted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document("credentials")
@CompoundIndex(name = "person_kind_active", def = "{'personName': 1, 'kind': 1, 'isActive': 1}")
public class Credential {

    @Id
    private String id;

    private String personName;

    private CredentialKind kind;

    private String encryptedToken;

    /** Base URL for resource calls; only set on ACCESS rows. */
    private String apiServer;

    private Instant expiresAt;

    @Field("isActive")
    private boolean active;

    private int errorCount;

    private String lastError;

    private Instant lastUsed;

    private Instant lastSuccessfulUse;

    private Instant createdAt;

    private Instant updatedAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }

    /**
     * An access row without its api server cannot be used for resource calls.
     */
    public boolean isUsableAccessAt(Instant now) {
        return active && kind == CredentialKind.ACCESS && !isExpiredAt(now)
                && apiServer != null && !apiServer.isBlank();
    }
}
