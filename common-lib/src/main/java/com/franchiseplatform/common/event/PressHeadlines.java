package com.franchiseplatform.common.event;

import com.franchiseplatform.common.model.AgentMood;

import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Headline templates for leaked offers. Placeholders: player name, team name,
 * offered average per year in millions, market value in millions.
 */
final class PressHeadlines {

    private static final List<String> LOWBALL = List.of(
        "SOURCES: %2$s offering %1$s just $%3$.1fM a year, well under his $%4$.1fM market",
        "%1$s camp 'insulted' by %2$s offer of $%3$.1fM per season",
        "Talks stall as %2$s lowballs %1$s at $%3$.1fM");

    private static final List<String> STALLED = List.of(
        "%1$s and %2$s still apart; gap said to be around $%5$.1fM a year",
        "No deal in sight for %1$s as talks with %2$s drag on",
        "Agent for %1$s says %2$s 'knows what it takes'");

    private PressHeadlines() {}

    static String headline(String playerName, String teamName, AgentMood mood,
                           double offerAmount, long marketValue, Random rng) {
        List<String> templates = mood == AgentMood.ANGRY ? LOWBALL : STALLED;
        String template = templates.get(rng.nextInt(templates.size()));
        double offerM = offerAmount / 1_000_000.0;
        double marketM = marketValue / 1_000_000.0;
        return String.format(Locale.ROOT, template,
            playerName, teamName, offerM, marketM, Math.max(0.0, marketM - offerM));
    }
}
