package com.insightplatform.common.trends;

import java.time.Instant;

/** One raw search: query text as typed, and when it happened. */
public record SearchEvent(String query, Instant timestamp) {}
