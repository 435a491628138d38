package com.scoutintel.transferroom.runner;

import com.scoutintel.transferroom.config.TransferRoomProperties;
import org.springframework.boot.ApplicationArguments;

import java.util.List;

/**
 * What a single invocation should do, from command-line flags layered over
 * the transferroom.run defaults.
 *
 * <pre>
 *   --competitions-only   skip players
 *   --players-only        skip competitions
 *   --max-players=N       stop after N players
 *   --test                stop after the test-mode ceiling (100 by default)
 * </pre>
 */
public record RunOptions(boolean competitions, boolean players, Integer maxPlayers) {

    static final String COMPETITIONS_ONLY = "competitions-only";
    static final String PLAYERS_ONLY = "players-only";
    static final String MAX_PLAYERS = "max-players";
    static final String TEST = "test";

    public static RunOptions from(ApplicationArguments args, TransferRoomProperties.Run defaults) {
        boolean competitionsOnly = defaults.isCompetitionsOnly() || args.containsOption(COMPETITIONS_ONLY);
        boolean playersOnly = defaults.isPlayersOnly() || args.containsOption(PLAYERS_ONLY);
        if (competitionsOnly && playersOnly) {
            throw new IllegalArgumentException("--competitions-only and --players-only cannot be combined");
        }

        Integer maxPlayers = defaults.getMaxPlayers();
        if (args.containsOption(MAX_PLAYERS)) {
            maxPlayers = parseCeiling(args.getOptionValues(MAX_PLAYERS));
        }
        if (args.containsOption(TEST)) {
            maxPlayers = defaults.getTestModeMaxPlayers();
        }

        return new RunOptions(!playersOnly, !competitionsOnly, maxPlayers);
    }

    private static Integer parseCeiling(List<String> values) {
        if (values == null || values.isEmpty() || values.get(values.size() - 1).isBlank()) {
            throw new IllegalArgumentException("--max-players needs a value, e.g. --max-players=500");
        }
        String value = values.get(values.size() - 1).trim();
        try {
            int ceiling = Integer.parseInt(value);
            if (ceiling < 0) {
                throw new IllegalArgumentException("--max-players must not be negative: " + value);
            }
            return ceiling;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--max-players is not a number: " + value, e);
        }
    }
}
