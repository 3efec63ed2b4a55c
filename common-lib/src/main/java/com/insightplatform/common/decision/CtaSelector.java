package com.insightplatform.common.decision;

import com.insightplatform.common.model.CooldownState;
import com.insightplatform.common.model.CtaType;
import com.insightplatform.common.model.DetectedSignal;
import com.insightplatform.common.model.EntityRef;
import com.insightplatform.common.model.SelectedInsight;
import com.insightplatform.common.model.SignalType;
import com.insightplatform.common.signal.SignalDetector;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Filters and ranks a week's signals into at most {@code maxCtasPerWeek} call-to-action
 * insights for a store. Never invents an entity: every selection comes from a signal.
 *
 * <p>Per signal, in order:
 * <ol>
 *   <li>drop when evidence {@code searches} is below {@code minSearches}</li>
 *   <li>drop when the entity was last generated less than {@code cooldownDays} ago,
 *       unless the entity already holds an insight of the week being decided</li>
 *   <li>map {@code SPIKE_DEMAND → PUSH_THIS_WEEK} (dropped when the store has no stock),
 *       {@code NO_RESULTS_SPIKE → FIX_THIS},
 *       {@code HIGH_INTEREST_LOW_CONVERSION → REPOSITION_THIS}</li>
 *   <li>score {@code confidence*100 + min(200, |deltaWoW|) + log10(max(1, searches))*10}</li>
 * </ol>
 * Then one candidate per entity (highest score), sorted by score descending, capped,
 * ranked from 1.
 */
public final class CtaSelector {

    static final double DELTA_SCORE_CAP = 200.0;

    private static final double MILLIS_PER_DAY = 24d * 60 * 60 * 1000;

    private CtaSelector() {}

    public static DecisionOutcome select(List<DetectedSignal> signals,
                                         Collection<CooldownState> cooldowns,
                                         boolean hasInStockInventory,
                                         DecisionConfig config,
                                         Instant now) {
        return select(signals, cooldowns, Set.of(), hasInStockInventory, config, now);
    }

    /**
     * @param decidedThisWeek entities that already hold a store insight for the same week;
     *                        cooldowns do not apply to them
     */
    public static DecisionOutcome select(List<DetectedSignal> signals,
                                         Collection<CooldownState> cooldowns,
                                         Set<EntityRef> decidedThisWeek,
                                         boolean hasInStockInventory,
                                         DecisionConfig config,
                                         Instant now) {
        Map<EntityRef, Instant> lastGenerated = new HashMap<>();
        if (cooldowns != null) {
            for (CooldownState c : cooldowns) {
                if (c.lastGeneratedAt() != null) {
                    lastGenerated.put(c.entity(), c.lastGeneratedAt());
                }
            }
        }

        // ── guardrails and scoring ─────────────────────────────────────────
        List<Candidate> candidates = new ArrayList<>();
        for (DetectedSignal s : signals) {
            Double searches = number(s.evidence(), SignalDetector.SEARCHES);
            if (searches != null && searches < config.minSearches()) continue;

            Instant last = lastGenerated.get(s.entity());
            if (last != null && !decidedThisWeek.contains(s.entity())
                && daysBetween(now, last) < config.cooldownDays()) continue;

            CtaType ctaType = ctaFor(s.type());
            if (ctaType == CtaType.PUSH_THIS_WEEK && !hasInStockInventory) continue;

            Double delta = number(s.evidence(), SignalDetector.DELTA_WOW);
            candidates.add(new Candidate(s, ctaType,
                priorityScore(s.confidence(), delta != null ? delta : 0.0, searches != null ? searches : 0.0)));
        }

        // ── one CTA per entity ─────────────────────────────────────────────
        Map<EntityRef, Candidate> bestByEntity = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            bestByEntity.merge(c.signal().entity(), c,
                (existing, incoming) -> incoming.score() > existing.score() ? incoming : existing);
        }

        List<Candidate> ranked = new ArrayList<>(bestByEntity.values());
        ranked.sort(Comparator.comparingDouble(Candidate::score).reversed());

        List<SelectedInsight> selected = new ArrayList<>();
        for (int i = 0; i < ranked.size() && i < config.maxCtasPerWeek(); i++) {
            Candidate c = ranked.get(i);
            DetectedSignal s = c.signal();
            selected.add(new SelectedInsight(
                c.ctaType(), s.entityType(), s.entityKey(), i + 1,
                s.confidence(), c.score(), s.evidence(),
                recommendedAction(c.ctaType(), s.entityKey())));
        }
        return new DecisionOutcome(candidates.size(), selected);
    }

    public static CtaType ctaFor(SignalType type) {
        return switch (type) {
            case SPIKE_DEMAND -> CtaType.PUSH_THIS_WEEK;
            case NO_RESULTS_SPIKE -> CtaType.FIX_THIS;
            case HIGH_INTEREST_LOW_CONVERSION -> CtaType.REPOSITION_THIS;
        };
    }

    public static double priorityScore(double confidence, double deltaWoW, double searches) {
        return confidence * 100
            + Math.min(DELTA_SCORE_CAP, Math.abs(deltaWoW))
            + Math.log10(Math.max(1.0, searches)) * 10;
    }

    public static String recommendedAction(CtaType ctaType, String entityKey) {
        return switch (ctaType) {
            case PUSH_THIS_WEEK -> "Merchandise and feature \"" + entityKey
                + "\" prominently this week (homepage/search suggestions/collections).";
            case FIX_THIS -> "Fix the gap for \"" + entityKey
                + "\": add relevant products, improve synonyms, and ensure search returns results.";
            case REPOSITION_THIS -> "Reposition \"" + entityKey
                + "\": review pricing, placement, and product content to convert existing interest.";
            default -> throw new IllegalArgumentException("Not a store CTA: " + ctaType);
        };
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static double daysBetween(Instant a, Instant b) {
        return Math.abs(Duration.between(a, b).toMillis()) / MILLIS_PER_DAY;
    }

    private static Double number(Map<String, Object> evidence, String key) {
        if (evidence != null && evidence.get(key) instanceof Number n) {
            return n.doubleValue();
        }
        return null;
    }

    private record Candidate(DetectedSignal signal, CtaType ctaType, double score) {}
}
