package com.franchiseplatform.common.agent;

import com.franchiseplatform.common.model.Agent;
import com.franchiseplatform.common.model.AgentArchetype;
import com.franchiseplatform.common.model.PersonalityTraits;
import com.franchiseplatform.common.model.PlayerProfile;

import java.util.List;
import java.util.Random;

/**
 * Deterministic agent generator: the same player id always yields the same agent,
 * so a player keeps one representative across repeated negotiations in a season.
 *
 * <p>The archetype comes from personality traits when the caller has them, otherwise
 * from the player id. Patience, volatility and maximum term are the archetype's base
 * values with a small jitter drawn from a {@link Random} seeded by the player id.
 */
public final class AgentProfileFactory {

    /** Half-width of the uniform jitter applied to patience and volatility. */
    public static final double TRAIT_JITTER = 0.05;

    /** Spreads nearby id hashes across the whole seed space. */
    private static final long SEED_MIX = 0x9E3779B97F4A7C15L;

    private static final List<String> SHARK_NAMES = List.of(
        "Rick Vance", "Dana Marlow", "Joel Kessler");
    private static final List<String> BRAND_BUILDER_NAMES = List.of(
        "Tom Castellan", "Nia Okafor", "Marcus Bell");
    private static final List<String> FAMILY_TITLES = List.of(
        "%s's Uncle", "Family Friend", "Local Attorney");

    public Agent createAgent(PlayerProfile player) {
        return create(player.id(), player.personality(), player.firstName(), player.lastName(), player.age());
    }

    /**
     * Agent for a player known only by id and, optionally, traits. Age is treated
     * as unknown, so age-gated archetype rules pass.
     */
    public Agent createAgent(String playerId, PersonalityTraits traits) {
        return create(playerId, traits, null, null, 0);
    }

    private Agent create(String playerId, PersonalityTraits traits,
                         String firstName, String lastName, int age) {
        Random rng = new Random(playerId.hashCode() * SEED_MIX);

        int archetypeRoll = rng.nextInt(AgentArchetype.values().length);
        AgentArchetype archetype = traits != null
            ? archetypeFromTraits(traits, age)
            : AgentArchetype.values()[archetypeRoll];

        double patience   = jitter(archetype.basePatience(), rng);
        double volatility = jitter(archetype.baseMoodVolatility(), rng);
        int lengthRoll    = rng.nextInt(2);
        int maxLength     = archetype.jittersContractLength()
            ? archetype.baseMaxContractLength() - lengthRoll
            : archetype.baseMaxContractLength();
        String name       = nameFor(archetype, firstName, lastName, rng);

        return new Agent(name, archetype, patience, maxLength, volatility);
    }

    /**
     * Trait rules, checked in order:
     * <ol>
     *   <li>leadership ≥ 75, motivation ≥ 75, loyalty &lt; 50 → SELF_REPRESENTED</li>
     *   <li>marketability ≥ 70 and (teamPlayer &lt; 50 or loyalty &lt; 40) → SHARK</li>
     *   <li>marketability ≥ 65, age &lt; 27, workEthic ≥ 70 → BRAND_BUILDER</li>
     *   <li>otherwise → FAMILY_FRIEND</li>
     * </ol>
     */
    public static AgentArchetype archetypeFromTraits(PersonalityTraits traits, int age) {
        if (traits.leadership() >= 75 && traits.motivation() >= 75 && traits.loyalty() < 50) {
            return AgentArchetype.SELF_REPRESENTED;
        }
        if (traits.marketability() >= 70 && (traits.teamPlayer() < 50 || traits.loyalty() < 40)) {
            return AgentArchetype.SHARK;
        }
        if (traits.marketability() >= 65 && age < 27 && traits.workEthic() >= 70) {
            return AgentArchetype.BRAND_BUILDER;
        }
        return AgentArchetype.FAMILY_FRIEND;
    }

    private static double jitter(double base, Random rng) {
        double value = base + (rng.nextDouble() * 2.0 - 1.0) * TRAIT_JITTER;
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String nameFor(AgentArchetype archetype, String firstName, String lastName, Random rng) {
        int pick = rng.nextInt(3);
        return switch (archetype) {
            case SHARK         -> SHARK_NAMES.get(pick);
            case BRAND_BUILDER -> BRAND_BUILDER_NAMES.get(pick);
            case FAMILY_FRIEND -> lastName != null
                ? String.format(FAMILY_TITLES.get(pick), lastName)
                : FAMILY_TITLES.get(1 + pick % 2);
            case SELF_REPRESENTED -> firstName != null && lastName != null
                ? firstName + " " + lastName + " (Self-Rep)"
                : "Self-Represented";
        };
    }
}
