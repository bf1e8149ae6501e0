package com.portfolio.mirror.model.documents;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * An enrolled brokerage identity. The health fields are a view over its credentials and are only
 * written by the token lifecycle.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document("persons")
public class Person {

    @Id
    private String id;

    @Indexed(unique = true)
    private String personName;

    private String displayName;

    @Field("isActive")
    private boolean active;

    private boolean hasValidToken;

    private Instant lastTokenRefresh;

    private String lastTokenError;

    private Instant createdAt;

    private Instant updatedAt;
}
