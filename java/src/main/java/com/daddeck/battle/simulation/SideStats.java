package com.daddeck.battle.simulation;

import com.daddeck.battle.card.Category;
import com.daddeck.battle.card.StatSet;

/**
 * Power breakdown for one side of a deck battle.
 *
 * @param totalPower     normalized deck power before any modifier
 * @param effectivePower power after type advantage
 * @param finalPower     power compared to decide the winner
 * @param mainType       most frequent category in the deck
 * @param averageStats   per-card average stats
 */
public record SideStats(double totalPower, double effectivePower, double finalPower,
                        Category mainType, StatSet averageStats) {
}
