package com.mouse.betinfo.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Line movement for one event between two snapshots of the same game.
 */
public record OddsMovement(String eventId,
                           String homeTeam,
                           String awayTeam,
                           Integer oldHomeOdds,
                           Integer newHomeOdds,
                           Integer oldAwayOdds,
                           Integer newAwayOdds,
                           BigDecimal oldHomeProbability,
                           BigDecimal newHomeProbability,
                           BigDecimal probabilityMove) {

    public boolean oddsChanged() {
        return !Objects.equals(oldHomeOdds, newHomeOdds)
                || !Objects.equals(oldAwayOdds, newAwayOdds);
    }
}
