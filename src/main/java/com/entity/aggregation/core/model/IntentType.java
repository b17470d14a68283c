package com.entity.aggregation.core.model;

/**
 * Kind of question the user asked.
 */
public enum IntentType {
    SEARCH,
    RANKING,
    COMPARISON,
    RECOMMENDATION
}
