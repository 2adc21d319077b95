package com.mouse.betinfo.service;

import com.mouse.betinfo.config.LedgerProperties;
import com.mouse.betinfo.entity.LedgerRecord;
import com.mouse.betinfo.enums.EntityType;
import com.mouse.betinfo.logservice.LedgerAuditLogService;
import com.mouse.betinfo.model.HashMismatch;
import com.mouse.betinfo.model.RecordKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recomputes the hash of every stored record and lists the ones that no longer match.
 * Read-only: nothing is repaired, and one bad row never stops the walk.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntegrityVerifier {

    private final ImmutableStore store;
    private final LedgerProperties properties;
    private final LedgerAuditLogService auditLog;

    public List<HashMismatch> verifyAll() {
        Instant startedAt = Instant.now();
        List<HashMismatch> mismatches = new ArrayList<>();
        long checked = 0;
        for (EntityType type : EntityType.values()) {
            checked += verify(type, mismatches);
        }
        auditLog.logVerification(checked, mismatches, startedAt);
        return mismatches;
    }

    public List<HashMismatch> verify(EntityType type) {
        List<HashMismatch> mismatches = new ArrayList<>();
        verify(type, mismatches);
        return mismatches;
    }

    private long verify(EntityType type, List<HashMismatch> sink) {
        int pageSize = Math.max(1, properties.getVerify().getPageSize());
        long checked = 0;
        int pageNumber = 0;
        Page<RecordKey> page;
        do {
            page = store.recordKeys(type, PageRequest.of(pageNumber++, pageSize));
            for (RecordKey key : page.getContent()) {
                checked++;
                check(type, key).ifPresent(sink::add);
            }
        } while (page.hasNext());
        log.debug("Verified {} | rows={}", type, checked);
        return checked;
    }

    private Optional<HashMismatch> check(EntityType type, RecordKey key) {
        String actual;
        try {
            LedgerRecord record = store.loadUnverified(type, key.getId());
            actual = record.computeHash();
        } catch (RuntimeException e) {
            log.error("❌ Unreadable row | type={} | id={} | error={}", type, key.getId(), e.getMessage(), e);
            return Optional.of(new HashMismatch(type, key.getId(), key.getContentHash(), null));
        }
        if (actual.equals(key.getContentHash())) {
            return Optional.empty();
        }
        return Optional.of(new HashMismatch(type, key.getId(), key.getContentHash(), actual));
    }
}
