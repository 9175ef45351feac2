package com.demoBank.onboarding.audit.model;

import lombok.Builder;
import lombok.Value;
import org.bson.Document;

import java.time.Instant;

/**
 * Append-only audit entry for one verification outcome.
 */
@Value
@Builder
public class VerificationRecord {

    String id;

    String sessionId;

    /**
     * Provider tag, e.g. "primary_id".
     */
    String provider;

    VerificationStatus status;

    /**
     * Structured provider response. Returned as a copy so entries stay unchanged.
     */
    Document response;

    Instant createdAt;

    public Document getResponse() {
        return response == null ? new Document() : new Document(response);
    }
}
