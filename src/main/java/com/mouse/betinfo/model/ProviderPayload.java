package com.mouse.betinfo.model;

import java.util.Map;

/**
 * What one market data provider returned for one request.
 *
 * @param raw        verbatim provider response, stored untouched
 * @param normalized fields computed from it, merged into the snapshot's normalized fields
 */
public record ProviderPayload(Object raw, Map<String, Object> normalized) {
}
