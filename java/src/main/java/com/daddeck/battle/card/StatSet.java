package com.daddeck.battle.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of the eight card stats.
 * A missing stat or a value outside [0, 100] is rejected at construction.
 */
public final class StatSet {
    private final EnumMap<Stat, Double> values;

    private StatSet(EnumMap<Stat, Double> values) {
        this.values = values;
    }

    @JsonCreator
    public static StatSet fromJson(@JsonProperty("dadJoke") Double dadJoke,
                                   @JsonProperty("grillSkill") Double grillSkill,
                                   @JsonProperty("fixIt") Double fixIt,
                                   @JsonProperty("napPower") Double napPower,
                                   @JsonProperty("remoteControl") Double remoteControl,
                                   @JsonProperty("thermostat") Double thermostat,
                                   @JsonProperty("sockSandal") Double sockSandal,
                                   @JsonProperty("beerSnob") Double beerSnob) {
        EnumMap<Stat, Double> map = new EnumMap<>(Stat.class);
        putIfPresent(map, Stat.DAD_JOKE, dadJoke);
        putIfPresent(map, Stat.GRILL_SKILL, grillSkill);
        putIfPresent(map, Stat.FIX_IT, fixIt);
        putIfPresent(map, Stat.NAP_POWER, napPower);
        putIfPresent(map, Stat.REMOTE_CONTROL, remoteControl);
        putIfPresent(map, Stat.THERMOSTAT, thermostat);
        putIfPresent(map, Stat.SOCK_SANDAL, sockSandal);
        putIfPresent(map, Stat.BEER_SNOB, beerSnob);
        return of(map);
    }

    private static void putIfPresent(EnumMap<Stat, Double> map, Stat stat, Double value) {
        if (value != null) {
            map.put(stat, value);
        }
    }

    /**
     * Build a stat set from a map holding all eight stats.
     *
     * @throws IllegalArgumentException if a stat is missing or out of range
     */
    public static StatSet of(Map<Stat, Double> source) {
        Objects.requireNonNull(source, "stats");
        EnumMap<Stat, Double> map = new EnumMap<>(Stat.class);
        for (Stat stat : Stat.values()) {
            Double value = source.get(stat);
            if (value == null) {
                throw new IllegalArgumentException("Stat set is missing " + stat.getJsonValue());
            }
            if (value.isNaN() || value < Stat.MIN || value > Stat.MAX) {
                throw new IllegalArgumentException(
                        "Stat " + stat.getJsonValue() + " out of range [0, 100]: " + value);
            }
            map.put(stat, value);
        }
        return new StatSet(map);
    }

    /**
     * Build a stat set, clamping every value into [0, 100].
     * Missing stats are still rejected.
     */
    public static StatSet clamped(Map<Stat, Double> source) {
        Objects.requireNonNull(source, "stats");
        EnumMap<Stat, Double> map = new EnumMap<>(Stat.class);
        for (Stat stat : Stat.values()) {
            Double value = source.get(stat);
            if (value == null) {
                throw new IllegalArgumentException("Stat set is missing " + stat.getJsonValue());
            }
            map.put(stat, clamp(value));
        }
        return new StatSet(map);
    }

    /**
     * All eight stats at the same value.
     */
    public static StatSet uniform(double value) {
        EnumMap<Stat, Double> map = new EnumMap<>(Stat.class);
        for (Stat stat : Stat.values()) {
            map.put(stat, value);
        }
        return of(map);
    }

    public static double clamp(double value) {
        return Math.max(Stat.MIN, Math.min(Stat.MAX, value));
    }

    public double get(Stat stat) {
        return values.get(stat);
    }

    /**
     * Copy with one stat replaced.
     */
    public StatSet with(Stat stat, double value) {
        EnumMap<Stat, Double> copy = new EnumMap<>(values);
        copy.put(stat, value);
        return of(copy);
    }

    public double sum() {
        double total = 0.0;
        for (double value : values.values()) {
            total += value;
        }
        return total;
    }

    public double average() {
        return sum() / values.size();
    }

    /**
     * Read-only view in canonical stat order.
     */
    public Map<Stat, Double> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @JsonProperty("dadJoke")
    public double getDadJoke() {
        return get(Stat.DAD_JOKE);
    }

    @JsonProperty("grillSkill")
    public double getGrillSkill() {
        return get(Stat.GRILL_SKILL);
    }

    @JsonProperty("fixIt")
    public double getFixIt() {
        return get(Stat.FIX_IT);
    }

    @JsonProperty("napPower")
    public double getNapPower() {
        return get(Stat.NAP_POWER);
    }

    @JsonProperty("remoteControl")
    public double getRemoteControl() {
        return get(Stat.REMOTE_CONTROL);
    }

    @JsonProperty("thermostat")
    public double getThermostat() {
        return get(Stat.THERMOSTAT);
    }

    @JsonProperty("sockSandal")
    public double getSockSandal() {
        return get(Stat.SOCK_SANDAL);
    }

    @JsonProperty("beerSnob")
    public double getBeerSnob() {
        return get(Stat.BEER_SNOB);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatSet other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<Stat, Double> entry : values.entrySet()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(entry.getKey().getJsonValue()).append('=').append(entry.getValue());
        }
        return sb.append('}').toString();
    }
}
