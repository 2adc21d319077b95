package com.mouse.betinfo.service;

import com.mouse.betinfo.entity.InfoSnapshot;
import com.mouse.betinfo.model.FieldDelta;
import com.mouse.betinfo.model.OddsMovement;
import com.mouse.betinfo.utils.CanonicalHasher;
import com.mouse.betinfo.utils.OddsCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.TreeSet;

import static com.mouse.betinfo.utils.NormalizedFields.AWAY_TEAM;
import static com.mouse.betinfo.utils.NormalizedFields.BEST_AWAY_ODDS;
import static com.mouse.betinfo.utils.NormalizedFields.BEST_HOME_ODDS;
import static com.mouse.betinfo.utils.NormalizedFields.EVENT_ID;
import static com.mouse.betinfo.utils.NormalizedFields.HOME_TEAM;
import static com.mouse.betinfo.utils.NormalizedFields.ODDS_EVENTS;
import static com.mouse.betinfo.utils.NormalizedFields.intValue;
import static com.mouse.betinfo.utils.NormalizedFields.mapList;
import static com.mouse.betinfo.utils.NormalizedFields.text;

/**
 * Field-level differences between two snapshots of the same game. Only normalized
 * fields are compared; raw provider payloads have no stable shape to diff.
 */
@Slf4j
@Service
public class DeltaComputer {

    // Probability moves at or below this are noise
    private static final BigDecimal MIN_PROBABILITY_MOVE = new BigDecimal("0.01");

    /**
     * One delta per top-level normalized field present in either snapshot, in sorted key
     * order. The sequence is computed lazily and can be iterated any number of times.
     */
    public Iterable<FieldDelta> diff(InfoSnapshot older, InfoSnapshot newer) {
        requireSameGame(older, newer);
        Map<String, Object> before = older.getNormalizedFields();
        Map<String, Object> after = newer.getNormalizedFields();
        return () -> new FieldDeltaIterator(before, after);
    }

    public List<FieldDelta> changes(InfoSnapshot older, InfoSnapshot newer) {
        List<FieldDelta> changes = new ArrayList<>();
        for (FieldDelta delta : diff(older, newer)) {
            if (delta.isChange()) {
                changes.add(delta);
            }
        }
        return changes;
    }

    /**
     * Line moves per sportsbook event: changed best odds, or a no-vig home
     * probability shift above one point.
     */
    public List<OddsMovement> oddsMovements(InfoSnapshot older, InfoSnapshot newer) {
        requireSameGame(older, newer);
        Map<String, Map<String, Object>> before = eventsById(older);
        Map<String, Map<String, Object>> after = eventsById(newer);

        List<OddsMovement> movements = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> entry : after.entrySet()) {
            Map<String, Object> was = before.get(entry.getKey());
            if (was == null) {
                continue;
            }
            Map<String, Object> now = entry.getValue();
            Integer oldHome = intValue(was.get(BEST_HOME_ODDS));
            Integer newHome = intValue(now.get(BEST_HOME_ODDS));
            Integer oldAway = intValue(was.get(BEST_AWAY_ODDS));
            Integer newAway = intValue(now.get(BEST_AWAY_ODDS));

            BigDecimal oldProb = homeProbability(oldHome, oldAway);
            BigDecimal newProb = homeProbability(newHome, newAway);
            BigDecimal move = oldProb == null || newProb == null ? null : newProb.subtract(oldProb);

            boolean oddsChanged = !Objects.equals(oldHome, newHome) || !Objects.equals(oldAway, newAway);
            boolean probabilityMoved = move != null && move.abs().compareTo(MIN_PROBABILITY_MOVE) > 0;
            if (oddsChanged || probabilityMoved) {
                movements.add(new OddsMovement(entry.getKey(),
                        text(now.get(HOME_TEAM)), text(now.get(AWAY_TEAM)),
                        oldHome, newHome, oldAway, newAway,
                        OddsCalculator.round(oldProb), OddsCalculator.round(newProb), OddsCalculator.round(move)));
            }
        }
        log.debug("Odds movements | gameId={} | from={} | to={} | count={}",
                newer.getGameId(), older.getSnapshotId(), newer.getSnapshotId(), movements.size());
        return movements;
    }

    private static BigDecimal homeProbability(Integer home, Integer away) {
        if (home == null || away == null) {
            return null;
        }
        try {
            return OddsCalculator.noVig(home, away).noVigA();
        } catch (IllegalArgumentException e) {
            log.debug("Unusable line pair home={} away={}: {}", home, away, e.getMessage());
            return null;
        }
    }

    private static Map<String, Map<String, Object>> eventsById(InfoSnapshot snapshot) {
        Map<String, Map<String, Object>> byId = new LinkedHashMap<>();
        for (Map<String, Object> event : mapList(snapshot.getNormalizedFields(), ODDS_EVENTS)) {
            String id = text(event.get(EVENT_ID));
            if (id != null) {
                byId.put(id, event);
            }
        }
        return byId;
    }

    private static void requireSameGame(InfoSnapshot older, InfoSnapshot newer) {
        if (older == null || newer == null) {
            throw new IllegalArgumentException("Two snapshots are required");
        }
        if (!older.getGameId().equals(newer.getGameId())) {
            throw new IllegalArgumentException(String.format(
                    "Snapshots belong to different games: %s vs %s", older.getGameId(), newer.getGameId()));
        }
    }

    /**
     * Walks the sorted union of keys, building each delta only when asked for.
     */
    private static final class FieldDeltaIterator implements Iterator<FieldDelta> {

        private final Map<String, Object> before;
        private final Map<String, Object> after;
        private final Iterator<String> keys;

        private FieldDeltaIterator(Map<String, Object> before, Map<String, Object> after) {
            this.before = before;
            this.after = after;
            TreeSet<String> union = new TreeSet<>(before.keySet());
            union.addAll(after.keySet());
            this.keys = union.iterator();
        }

        @Override
        public boolean hasNext() {
            return keys.hasNext();
        }

        @Override
        public FieldDelta next() {
            if (!keys.hasNext()) {
                throw new NoSuchElementException();
            }
            String key = keys.next();
            boolean wasThere = before.containsKey(key);
            boolean isThere = after.containsKey(key);
            if (!wasThere) {
                return FieldDelta.added(key, after.get(key));
            }
            if (!isThere) {
                return FieldDelta.removed(key, before.get(key));
            }
            Object oldValue = before.get(key);
            Object newValue = after.get(key);
            return sameValue(oldValue, newValue)
                    ? FieldDelta.unchanged(key, newValue)
                    : FieldDelta.changed(key, oldValue, newValue);
        }

        // 1.0 and 1 are the same value, so compare canonical forms
        private static boolean sameValue(Object a, Object b) {
            if (Objects.equals(a, b)) {
                return true;
            }
            Map<String, Object> left = new LinkedHashMap<>();
            left.put("v", a);
            Map<String, Object> right = new LinkedHashMap<>();
            right.put("v", b);
            return CanonicalHasher.canonicalJson(left).equals(CanonicalHasher.canonicalJson(right));
        }
    }
}
