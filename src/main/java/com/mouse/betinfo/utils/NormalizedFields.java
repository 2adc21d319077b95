package com.mouse.betinfo.utils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keys of the normalized snapshot layout and lenient readers for values that may
 * have gone through a JSON round trip (an int can come back as Integer, Long or BigDecimal).
 */
public final class NormalizedFields {

    /** Sportsbook events: event_id, home_team, away_team, best_home_odds, best_away_odds, ... */
    public static final String ODDS_EVENTS = "odds_events";
    /** Prediction markets: market_id, title, yes_bid, yes_ask, volume, ... */
    public static final String PREDICTION_MARKETS = "prediction_markets";

    public static final String EVENT_ID = "event_id";
    public static final String HOME_TEAM = "home_team";
    public static final String AWAY_TEAM = "away_team";
    public static final String BEST_HOME_ODDS = "best_home_odds";
    public static final String BEST_AWAY_ODDS = "best_away_odds";
    public static final String COMMENCE_TIME = "commence_time";
    public static final String GAME_STATUS = "game_status";

    public static final String MARKET_ID = "market_id";
    public static final String TITLE = "title";
    public static final String YES_BID = "yes_bid";
    public static final String YES_ASK = "yes_ask";
    public static final String IMPLIED_PROBABILITY = "implied_probability";
    public static final String VOLUME = "volume";

    private NormalizedFields() {
    }

    public static List<Map<String, Object>> mapList(Map<String, ?> fields, String key) {
        if (fields == null) {
            return Collections.emptyList();
        }
        Object value = fields.get(key);
        if (!(value instanceof List<?> list)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> maps = new ArrayList<>();
        for (Object item : list) {
            Map<String, Object> map = asMap(item);
            if (map != null) {
                maps.add(map);
            }
        }
        return maps;
    }

    /**
     * String-keyed copy of a JSON object, or null when {@code value} is not one.
     */
    public static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    public static Integer intValue(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim()).intValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static BigDecimal decimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
