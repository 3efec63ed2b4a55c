package com.insightplatform.engine.events;

/**
 * The three raw behavioral event streams the engine reads.
 */
public enum EventStream {
    SEARCH,
    CLICK,
    PURCHASE
}
