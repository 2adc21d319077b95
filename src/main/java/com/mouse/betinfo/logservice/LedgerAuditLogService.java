package com.mouse.betinfo.logservice;

import com.mouse.betinfo.entity.LedgerRecord;
import com.mouse.betinfo.enums.EntityType;
import com.mouse.betinfo.enums.ProposalStatus;
import com.mouse.betinfo.model.HashMismatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One place for the audit trail of the ledger: what went in, what was refused,
 * what verification found.
 */
@Slf4j
@Service
public class LedgerAuditLogService {

    public void logInserted(LedgerRecord record) {
        log.info("💾 INSERT | type={} | id={} | hash={}",
                record.getEntityType(), record.getId(), abbreviate(record.getContentHash()));
    }

    public void logDeduplicated(LedgerRecord existing) {
        log.info("♻️ DEDUP | type={} | existingId={} | hash={}",
                existing.getEntityType(), existing.getId(), abbreviate(existing.getContentHash()));
    }

    public void logRejected(EntityType type, String reason) {
        log.warn("⛔ REJECTED | type={} | reason={}", type, reason);
    }

    public void logMutationDenied(String operation, EntityType type, String id) {
        log.error("🚫 MUTATION DENIED | op={} | type={} | id={}", operation, type, id);
    }

    public void logStatusTransition(String proposalId, ProposalStatus from, ProposalStatus to, String newHash) {
        log.info("🔁 STATUS | proposalId={} | {} -> {} | hash={}", proposalId, from, to, abbreviate(newHash));
    }

    public void logVerification(long checked, List<HashMismatch> mismatches, Instant startedAt) {
        long ms = startedAt == null ? 0 : Duration.between(startedAt, Instant.now()).toMillis();
        if (mismatches.isEmpty()) {
            log.info("✅ VERIFY CLEAN | checked={} | tookMs={}", checked, ms);
            return;
        }
        log.error("❌ VERIFY FAILED | checked={} | mismatches={} | tookMs={}", checked, mismatches.size(), ms);
        for (HashMismatch mismatch : mismatches) {
            log.error("   MISMATCH | type={} | id={} | expected={} | actual={}",
                    mismatch.entityType(), mismatch.entityId(),
                    abbreviate(mismatch.expected()), abbreviate(mismatch.actual()));
        }
    }

    private static String abbreviate(String hash) {
        if (hash == null) return "null";
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
