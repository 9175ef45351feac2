package com.demoBank.onboarding.audit.service;

import com.demoBank.onboarding.audit.model.VerificationRecord;
import com.demoBank.onboarding.audit.model.VerificationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of verification outcomes per signup session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationLog {

    private final Clock clock;

    // sessionId -> entries in append order
    private final Map<String, List<VerificationRecord>> recordsBySession = new ConcurrentHashMap<>();

    public VerificationRecord append(String sessionId, String provider, VerificationStatus status, Document response) {
        VerificationRecord record = VerificationRecord.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .provider(provider)
                .status(status)
                .response(new Document(response))
                .createdAt(clock.instant())
                .build();
        recordsBySession.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(record);
        log.info("Verification recorded - sessionId: {}, provider: {}, status: {}", sessionId, provider, status);
        return record;
    }

    public List<VerificationRecord> findBySession(String sessionId) {
        return List.copyOf(recordsBySession.getOrDefault(sessionId, List.of()));
    }
}
