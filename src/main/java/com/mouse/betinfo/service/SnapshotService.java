package com.mouse.betinfo.service;

import com.mouse.betinfo.config.LedgerProperties;
import com.mouse.betinfo.entity.InfoSnapshot;
import com.mouse.betinfo.exception.LedgerException;
import com.mouse.betinfo.interfaces.MarketDataProvider;
import com.mouse.betinfo.model.BatchReport;
import com.mouse.betinfo.model.ProviderPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Collects one snapshot per call from every registered provider. A provider that
 * fails is recorded as {@code <provider>_error} in the raw payloads; the snapshot is
 * still taken with what the others returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotService {

    private final ImmutableStore store;
    private final LedgerProperties properties;
    private final List<MarketDataProvider> providers;
    private final BatchRunner batchRunner;

    public InfoSnapshot collect(String gameId, String sport) {
        if (providers.isEmpty()) {
            throw new LedgerException("No market data providers registered");
        }
        Instant collectedAt = Instant.now();
        Map<String, Object> raw = new LinkedHashMap<>();
        Map<String, Object> normalized = new LinkedHashMap<>();
        Map<String, String> versions = new TreeMap<>();

        for (MarketDataProvider provider : providers) {
            String name = provider.providerName();
            try {
                ProviderPayload payload = provider.fetch(gameId, sport);
                raw.put(name, payload.raw());
                versions.put(name, provider.version());
                if (payload.normalized() != null) {
                    normalized.putAll(payload.normalized());
                }
                log.info("📥 Provider ok | provider={} | gameId={}", name, gameId);
            } catch (RuntimeException e) {
                log.warn("📥 Provider failed | provider={} | gameId={} | error={}", name, gameId, e.getMessage(), e);
                raw.put(name + "_error", String.valueOf(e.getMessage()));
            }
        }

        return record(gameId, collectedAt, versions, raw, normalized);
    }

    /**
     * Stores payloads that were fetched elsewhere.
     */
    public InfoSnapshot record(String gameId,
                               Instant collectedAt,
                               Map<String, String> sourceVersions,
                               Map<String, Object> rawPayloads,
                               Map<String, Object> normalizedFields) {
        InfoSnapshot snapshot = InfoSnapshot.builder()
                .gameId(gameId)
                .collectedAt(collectedAt)
                .schemaVersion(properties.getSchemaVersion())
                .sourceVersions(sourceVersions)
                .rawPayloads(rawPayloads)
                .normalizedFields(normalizedFields)
                .build();
        InfoSnapshot stored = store.insertSnapshot(snapshot);
        log.info("💾 Snapshot stored | gameId={} | snapshotId={} | collectedAt={}",
                gameId, stored.getSnapshotId(), stored.getCollectedAt());
        return stored;
    }

    public BatchReport<InfoSnapshot> collectAll(List<String> gameIds, String sport) {
        return batchRunner.run("collect-all", gameIds, gameId -> Optional.of(collect(gameId, sport)));
    }

    public List<InfoSnapshot> timeline(String gameId, Instant asOf) {
        return asOf == null ? store.listByGame(gameId) : store.listByGameAsOf(gameId, asOf);
    }
}
