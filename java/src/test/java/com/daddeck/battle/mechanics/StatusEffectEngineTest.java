package com.daddeck.battle.mechanics;

import com.daddeck.battle.card.Stat;
import com.daddeck.battle.card.StatSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StatusEffectEngine.
 */
class StatusEffectEngineTest {

    @Test
    void testGrilledReducesHandsOnStats() {
        StatSet stats = StatusEffectEngine.applyEffects(StatSet.uniform(100.0),
                List.of(StatusEffect.of(StatusEffectKind.GRILLED, 2)));

        assertEquals(80.0, stats.get(Stat.GRILL_SKILL), 1e-9);
        assertEquals(80.0, stats.get(Stat.FIX_IT), 1e-9);
        assertEquals(100.0, stats.get(Stat.DAD_JOKE), 1e-9);
    }

    @Test
    void testSecondStackIsHalfAsPotent() {
        StatSet stats = StatusEffectEngine.applyEffects(StatSet.uniform(100.0),
                List.of(new StatusEffect(StatusEffectKind.GRILLED, 2, 2)));

        assertEquals(70.0, stats.get(Stat.GRILL_SKILL), 1e-9);
    }

    @Test
    void testLecturedReducesOffensiveStats() {
        StatSet stats = StatusEffectEngine.applyEffects(StatSet.uniform(50.0),
                List.of(StatusEffect.of(StatusEffectKind.LECTURED, 2)));

        assertEquals(40.0, stats.get(Stat.DAD_JOKE), 1e-9);
        assertEquals(40.0, stats.get(Stat.REMOTE_CONTROL), 1e-9);
        assertEquals(50.0, stats.get(Stat.NAP_POWER), 1e-9);
    }

    @Test
    void testWiredIsClampedAt100() {
        StatSet stats = StatusEffectEngine.applyEffects(StatSet.uniform(90.0),
                List.of(StatusEffect.of(StatusEffectKind.WIRED, 2)));

        for (Stat stat : Stat.values()) {
            assertEquals(100.0, stats.get(stat), 1e-9);
        }
    }

    @Test
    void testEffectsCompoundInOrder() {
        StatSet stats = StatusEffectEngine.applyEffects(StatSet.uniform(50.0), List.of(
                StatusEffect.of(StatusEffectKind.WIRED, 2),
                StatusEffect.of(StatusEffectKind.GRILLED, 2)));

        // 50 * 1.3 * 0.8
        assertEquals(52.0, stats.get(Stat.GRILL_SKILL), 1e-9);
        assertEquals(65.0, stats.get(Stat.BEER_SNOB), 1e-9);
    }

    @Test
    void testFlavorOnlyEffectsChangeNothing() {
        StatSet base = StatSet.uniform(42.0);
        StatSet stats = StatusEffectEngine.applyEffects(base, Arrays.asList(
                StatusEffect.of(StatusEffectKind.DRUNK, 2),
                null,
                StatusEffect.of(StatusEffectKind.INSPIRED, 3)));

        assertEquals(base, stats);
    }

    @Test
    void testTickDecrementsAndExpires() {
        List<StatusEffect> effects = List.of(
                StatusEffect.of(StatusEffectKind.GRILLED, 1),
                StatusEffect.of(StatusEffectKind.WIRED, 3));

        List<StatusEffect> next = StatusEffectEngine.tick(effects);
        assertEquals(List.of(StatusEffect.of(StatusEffectKind.WIRED, 2)), next);
        assertEquals(2, effects.size(), "input list must be untouched");
        assertTrue(StatusEffectEngine.tick(List.of()).isEmpty());
    }

    @Test
    void testTickedListIsImmutable() {
        List<StatusEffect> next = StatusEffectEngine.tick(new ArrayList<>(List.of(StatusEffect.of(StatusEffectKind.BORED, 4))));
        assertThrows(UnsupportedOperationException.class, () -> next.add(StatusEffect.of(StatusEffectKind.BORED, 1)));
    }

    @Test
    void testAddEffectStacksAndRefreshesDuration() {
        List<StatusEffect> effects = StatusEffectEngine.addEffect(List.of(), StatusEffect.of(StatusEffectKind.GRILLED, 3));
        effects = StatusEffectEngine.addEffect(effects, StatusEffect.of(StatusEffectKind.GRILLED, 2));

        assertEquals(1, effects.size());
        assertEquals(new StatusEffect(StatusEffectKind.GRILLED, 2, 2), effects.get(0));

        effects = StatusEffectEngine.addEffect(effects, StatusEffect.of(StatusEffectKind.GRILLED, 5));
        assertEquals(new StatusEffect(StatusEffectKind.GRILLED, 5, 2), effects.get(0), "stacks cap at 2");
    }

    @Test
    void testAddEffectAppendsNewKind() {
        List<StatusEffect> effects = StatusEffectEngine.addEffect(
                List.of(StatusEffect.of(StatusEffectKind.WIRED, 2)),
                StatusEffect.of(StatusEffectKind.DRUNK, 2));

        assertEquals(2, effects.size());
        assertEquals(StatusEffectKind.DRUNK, effects.get(1).kind());
        assertTrue(StatusEffectEngine.hasEffect(effects, StatusEffectKind.DRUNK));
        assertEquals(1, StatusEffectEngine.stacksOf(effects, StatusEffectKind.WIRED));
        assertEquals(0, StatusEffectEngine.stacksOf(effects, StatusEffectKind.LECTURED));
    }

    @Test
    void testInvalidEffectsRejected() {
        assertThrows(IllegalArgumentException.class, () -> StatusEffect.of(StatusEffectKind.DRUNK, -1));
        assertThrows(IllegalArgumentException.class, () -> new StatusEffect(StatusEffectKind.DRUNK, 1, 3));
    }
}
