package com.mouse.betinfo.interfaces;

import com.mouse.betinfo.model.ProviderPayload;

/**
 * A source of market data for a game (a prediction market, a sportsbook odds feed).
 * Transport, authentication and rate limiting live behind this interface.
 */
public interface MarketDataProvider {

    /** Key under which the payload is stored in a snapshot, e.g. "odds_feed". */
    String providerName();

    /** Version of the provider API or payload format. */
    String version();

    ProviderPayload fetch(String gameId, String sport);
}
