package com.geobuffer.model.base;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Base entity with id, write timestamp and optional expiry
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseEntity<ID> {

    private ID id;

    /**
     * Write time in epoch millis
     */
    private long timestamp;

    private Instant expireAt;

    public boolean isExpired() {
        return expireAt != null && Instant.now().isAfter(expireAt);
    }

    /**
     * Expire {@code seconds} from now
     */
    public void setExpirationSeconds(long seconds) {
        this.expireAt = Instant.now().plusSeconds(seconds);
    }
}
