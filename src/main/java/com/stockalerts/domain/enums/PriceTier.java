package com.stockalerts.domain.enums;

/**
 * Which layer of the price cache served an observation.
 */
public enum PriceTier {
    MEMORY,
    SECONDARY,
    FEED
}
