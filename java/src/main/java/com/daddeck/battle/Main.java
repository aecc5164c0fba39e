package com.daddeck.battle;

import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.CardDatabase;
import com.daddeck.battle.card.CardDatabaseException;
import com.daddeck.battle.card.Category;
import com.daddeck.battle.deck.Deck;
import com.daddeck.battle.mechanics.HitType;
import com.daddeck.battle.mechanics.TypeAdvantageMatrix;
import com.daddeck.battle.simulation.BattleResult;
import com.daddeck.battle.simulation.DuelResult;
import com.daddeck.battle.simulation.Prediction;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * DadDeck battle CLI - Main entry point.
 */
@Command(name = "daddeck-battle",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "DadDeck battle engine",
        subcommands = {
                Main.BattleCommand.class,
                Main.CompareCommand.class,
                Main.DuelCommand.class,
                Main.PredictCommand.class,
                Main.MatchupsCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    /**
     * Card catalog option shared by the subcommands that read cards.
     */
    static class CatalogOption {
        @Option(names = {"-c", "--cards"},
                description = "Path to cards database (default: bundled catalog)")
        String cardsPath;

        CardDatabase load() throws CardDatabaseException {
            CardDatabase db = cardsPath != null
                    ? CardDatabase.fromFile(cardsPath)
                    : CardDatabase.fromResource(CardDatabase.DEFAULT_RESOURCE);
            System.err.println("✓ Loaded " + db.cardCount() + " cards from "
                    + (cardsPath != null ? cardsPath : "bundled " + CardDatabase.DEFAULT_RESOURCE));
            return db;
        }
    }

    // ========== BATTLE COMMAND ==========
    @Command(name = "battle", description = "Resolve a battle between two decks")
    static class BattleCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Attacking deck file")
        String attackerPath;

        @Parameters(index = "1", description = "Defending deck file")
        String defenderPath;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Mixin
        CatalogOption catalog;

        @Override
        public Integer call() {
            Deck[] decks = loadDecks(catalog, attackerPath, defenderPath);
            if (decks == null) {
                return 1;
            }

            BattleResult result = seed != null
                    ? BattleEngine.calculateBattleResult(decks[0], decks[1], seed)
                    : BattleEngine.calculateBattleResult(decks[0], decks[1]);

            System.out.println("\n=== DadDeck Battle ===\n");
            result.log().forEach(System.out::println);
            System.out.println();
            System.out.println("Seed: " + result.seed());
            return 0;
        }
    }

    // ========== COMPARE COMMAND ==========
    @Command(name = "compare", description = "Run many battles between two decks and report win rates")
    static class CompareCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Attacking deck file")
        String attackerPath;

        @Parameters(index = "1", description = "Defending deck file")
        String defenderPath;

        @Option(names = {"-n", "--num-battles"}, defaultValue = "1000",
                description = "Number of battles to resolve")
        int numBattles;

        @Option(names = {"-s", "--seed"},
                description = "Base seed; battle i uses seed + i (optional)")
        Long seed;

        @Mixin
        CatalogOption catalog;

        @Override
        public Integer call() {
            Deck[] decks = loadDecks(catalog, attackerPath, defenderPath);
            if (decks == null) {
                return 1;
            }

            long startTime = System.currentTimeMillis();
            List<BattleResult> results = runBattles(decks[0], decks[1], numBattles, seed);
            long elapsed = System.currentTimeMillis() - startTime;

            printComparison(decks[0], decks[1], results, elapsed);
            return 0;
        }
    }

    // ========== DUEL COMMAND ==========
    @Command(name = "duel", description = "Simulate a turn-based battle between two cards")
    static class DuelCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "First card id")
        String firstId;

        @Parameters(index = "1", description = "Second card id")
        String secondId;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Mixin
        CatalogOption catalog;

        @Override
        public Integer call() {
            Card[] cards = loadCards(catalog, firstId, secondId);
            if (cards == null) {
                return 1;
            }

            DuelResult result = seed != null
                    ? BattleEngine.simulateBattle(cards[0], cards[1], seed)
                    : BattleEngine.simulateBattle(cards[0], cards[1]);

            System.out.println("\n=== DadDeck Duel ===\n");
            result.log().forEach(System.out::println);
            System.out.printf("%nWinner: %s after %d turns (%.0f HP left)%n",
                    result.winner().getName(), result.turns(), result.winnerHp());
            return 0;
        }
    }

    // ========== PREDICT COMMAND ==========
    @Command(name = "predict", description = "Estimate the winner of a card matchup without battling")
    static class PredictCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "First card id")
        String firstId;

        @Parameters(index = "1", description = "Second card id")
        String secondId;

        @Mixin
        CatalogOption catalog;

        @Override
        public Integer call() {
            Card[] cards = loadCards(catalog, firstId, secondId);
            if (cards == null) {
                return 1;
            }

            Prediction prediction = BattleEngine.predictWinner(cards[0], cards[1]);
            System.out.printf("%s vs %s%n", cards[0].getName(), cards[1].getName());
            System.out.printf("  Power: %.1f vs %.1f%n",
                    BattleEngine.calculatePower(cards[0]), BattleEngine.calculatePower(cards[1]));
            System.out.printf("  Predicted winner: %s (%d%% confidence)%n",
                    prediction.winner().getName(), prediction.confidence());
            System.out.println("  " + prediction.reason());
            return 0;
        }
    }

    // ========== MATCHUPS COMMAND ==========
    @Command(name = "matchups", description = "Print the type advantage table")
    static class MatchupsCommand implements Callable<Integer> {
        @Parameters(index = "0", arity = "0..1", description = "Only show this category")
        Category category;

        @Override
        public Integer call() {
            List<Category> categories = category != null ? List.of(category) : List.of(Category.values());
            System.out.printf("%-20s %-20s %-40s %-40s%n", "Type", "Name", "Strong against", "Weak against");
            System.out.println("-".repeat(120));
            for (Category c : categories) {
                System.out.printf("%-20s %-20s %-40s %-40s%n", c, c.getDisplayName(),
                        join(TypeAdvantageMatrix.advantagesOf(c)),
                        join(TypeAdvantageMatrix.disadvantagesOf(c)));
            }
            return 0;
        }

        private static String join(Iterable<Category> categories) {
            List<String> names = new ArrayList<>();
            categories.forEach(c -> names.add(c.name()));
            return String.join(", ", names);
        }
    }

    // ========== HELPER METHODS ==========

    private static Deck[] loadDecks(CatalogOption catalog, String attackerPath, String defenderPath) {
        CardDatabase db;
        try {
            db = catalog.load();
        } catch (CardDatabaseException e) {
            System.err.println("✗ Failed to load cards: " + e.getMessage());
            return null;
        }

        Deck attacker;
        Deck defender;
        try {
            attacker = Deck.loadFromFile(attackerPath, db);
        } catch (Deck.DeckException e) {
            System.err.println("✗ Failed to parse deck '" + attackerPath + "': " + e.getMessage());
            return null;
        }
        try {
            defender = Deck.loadFromFile(defenderPath, db);
        } catch (Deck.DeckException e) {
            System.err.println("✗ Failed to parse deck '" + defenderPath + "': " + e.getMessage());
            return null;
        }
        return new Deck[]{attacker, defender};
    }

    private static Card[] loadCards(CatalogOption catalog, String firstId, String secondId) {
        try {
            CardDatabase db = catalog.load();
            return new Card[]{db.getCard(firstId), db.getCard(secondId)};
        } catch (CardDatabaseException e) {
            System.err.println("✗ " + e.getMessage());
            return null;
        }
    }

    /**
     * Resolve battles sequentially from a fixed base seed, or in parallel with random seeds.
     */
    static List<BattleResult> runBattles(Deck attacker, Deck defender, int count, Long seed) {
        if (seed != null) {
            List<BattleResult> results = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                results.add(BattleEngine.calculateBattleResult(attacker, defender, seed + i));
            }
            return results;
        }
        return IntStream.range(0, count)
                .parallel()
                .mapToObj(i -> BattleEngine.calculateBattleResult(attacker, defender))
                .collect(Collectors.toList());
    }

    private static void printComparison(Deck attacker, Deck defender, List<BattleResult> results, long elapsedMs) {
        int total = results.size();
        long attackerWins = results.stream().filter(r -> r.attackerWon(attacker)).count();
        long defenderWins = total - attackerWins;
        double avgDamage = results.stream().mapToInt(BattleResult::damage).average().orElse(0.0);
        long criticals = results.stream().filter(r -> r.hitType() == HitType.CRITICAL).count();
        long glancing = results.stream().filter(r -> r.hitType() == HitType.GLANCING).count();

        System.out.println("\n=== Results ===\n");
        System.out.printf("%-20s %12s %12s%n", "Metric", attacker.getName(), defender.getName());
        System.out.println("-".repeat(50));
        System.out.printf("%-20s %11.1f%% %11.1f%%%n", "Win rate",
                pct(attackerWins, total), pct(defenderWins, total));
        System.out.println();
        System.out.printf("Average damage: %.2f%n", avgDamage);
        System.out.printf("Critical hits: %.1f%% | Glancing blows: %.1f%%%n",
                pct(criticals, total), pct(glancing, total));

        double elapsedSec = elapsedMs / 1000.0;
        double battlesPerSec = elapsedSec > 0 ? total / elapsedSec : 0;
        System.out.printf("%nCompleted in %.2fs (%.0f battles/sec)%n", elapsedSec, battlesPerSec);
    }

    private static double pct(long count, int total) {
        return total == 0 ? 0.0 : (double) count / total * 100.0;
    }
}
