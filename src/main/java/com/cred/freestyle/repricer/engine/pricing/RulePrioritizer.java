package com.cred.freestyle.repricer.engine.pricing;

import com.cred.freestyle.repricer.domain.model.WhenCondition.Family;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Orders applicable rules so that the most specific one comes first.
 *
 * Within the less-than family the smaller threshold wins; within the greater-than family the larger
 * threshold wins. Rules of different families, and all other rules, keep their declaration order.
 * Only the first rule of the result is applied; rules are not cumulative.
 *
 * @author Repricer Team
 */
public final class RulePrioritizer {

    private RulePrioritizer() {
    }

    /**
     * Each family keeps the slots its rules occupy in declaration order; inside those slots the
     * family's rules are re-ordered by threshold (stable for equal thresholds).
     *
     * @param applicable Applicable rules in declaration order
     * @return New list in priority order
     */
    public static List<RuleMatch> prioritize(List<RuleMatch> applicable) {
        List<RuleMatch> ordered = new ArrayList<>(applicable);
        ordered.sort(Comparator.comparingInt(RulePrioritizer::position));

        Map<Family, List<Integer>> slots = new EnumMap<>(Family.class);
        for (int i = 0; i < ordered.size(); i++) {
            slots.computeIfAbsent(family(ordered.get(i)), f -> new ArrayList<>()).add(i);
        }

        List<RuleMatch> result = new ArrayList<>(ordered);
        for (Map.Entry<Family, List<Integer>> entry : slots.entrySet()) {
            Comparator<RuleMatch> byThreshold = thresholdOrder(entry.getKey());
            if (byThreshold == null) {
                continue;
            }
            List<RuleMatch> members = new ArrayList<>();
            for (Integer slot : entry.getValue()) {
                members.add(ordered.get(slot));
            }
            members.sort(byThreshold);
            for (int i = 0; i < members.size(); i++) {
                result.set(entry.getValue().get(i), members.get(i));
            }
        }
        return result;
    }

    /**
     * @return The rule to apply, or null when nothing is applicable
     */
    public static RuleMatch selectWinner(List<RuleMatch> applicable) {
        List<RuleMatch> ordered = prioritize(applicable);
        return ordered.isEmpty() ? null : ordered.get(0);
    }

    private static Comparator<RuleMatch> thresholdOrder(Family family) {
        Comparator<RuleMatch> ascending = Comparator.comparing(m -> m.getRule().whenValueAsDecimal());
        switch (family) {
            case LESS_THAN:
                return ascending;
            case GREATER_THAN:
                return ascending.reversed();
            default:
                return null;
        }
    }

    private static Family family(RuleMatch match) {
        return match.getRule().resolveCondition().getFamily();
    }

    private static int position(RuleMatch match) {
        Integer position = match.getRule().getPosition();
        return position != null ? position : Integer.MAX_VALUE;
    }
}
