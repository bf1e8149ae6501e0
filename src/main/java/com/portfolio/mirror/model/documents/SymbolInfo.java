package com.portfolio.mirror.model.documents;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Local copy of a brokerage instrument, keyed by its ticker.
 */
@Document("symbols")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymbolInfo {

    private @Id String id;

    @Indexed(unique = true)
    private String symbol;

    @Indexed
    private long symbolId;

    private String description;
    private String securityType;
    private String exchange;
    private String currency;
    private boolean tradable;
    private boolean quotable;
    private boolean hasOptions;

    private Instant updatedAt;
}
