package com.pharmaintel.engine;

import com.pharmaintel.domain.InteractionQueryResult;
import com.pharmaintel.domain.InteractionRule;
import com.pharmaintel.domain.InteractionRuleBase;
import com.pharmaintel.domain.InteractionSeverity;
import com.pharmaintel.domain.MatchedPair;
import com.pharmaintel.domain.ResolvedDrug;
import com.pharmaintel.exception.InvalidEngineInputException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

// A direct drug-drug rule wins over any class rule.
public class InteractionMatcher {

    private static final Pattern DOSAGE = Pattern.compile("\\b\\d+(?:[.,]\\d+)?\\s*(?:mg|mcg|g|ml|iu|units?)\\b");
    private static final Pattern FORM = Pattern.compile(
        "\\b(?:tablets?|capsules?|injections?|inhalers?|syrups?|creams?|drops|suspension)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final EngineSettings settings;

    public InteractionMatcher(EngineSettings settings) {
        this.settings = settings;
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String lower = name.toLowerCase(Locale.ROOT);
        String stripped = FORM.matcher(DOSAGE.matcher(lower).replaceAll(" ")).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public InteractionQueryResult checkInteractions(List<String> drugNames, InteractionRuleBase ruleBase) {
        if (drugNames == null) {
            throw new InvalidEngineInputException("drugNames is required");
        }
        InteractionRuleBase rules = ruleBase != null ? ruleBase : InteractionRuleBase.empty();
        Index index = new Index(rules);

        List<ResolvedDrug> resolved = new ArrayList<>();
        List<String> unmatched = new ArrayList<>();
        for (String input : drugNames) {
            ResolvedDrug drug = resolve(input, index.vocabulary);
            if (drug == null) {
                unmatched.add(input);
            } else {
                resolved.add(drug);
            }
        }

        List<String> canonical = new ArrayList<>(new TreeSet<>(resolved.stream().map(ResolvedDrug::getCanonical).toList()));
        List<MatchedPair> pairs = new ArrayList<>();
        for (int i = 0; i < canonical.size(); i++) {
            for (int j = i + 1; j < canonical.size(); j++) {
                MatchedPair pair = index.lookup(canonical.get(i), canonical.get(j));
                if (pair != null) {
                    pairs.add(pair);
                }
            }
        }
        pairs.sort(Comparator.comparing(MatchedPair::getSeverity).reversed()
            .thenComparing(MatchedPair::getDrugA)
            .thenComparing(MatchedPair::getDrugB));

        Map<InteractionSeverity, Integer> summary = new EnumMap<>(InteractionSeverity.class);
        for (InteractionSeverity s : InteractionSeverity.values()) {
            summary.put(s, 0);
        }
        InteractionSeverity overall = InteractionSeverity.NONE;
        for (MatchedPair pair : pairs) {
            summary.merge(pair.getSeverity(), 1, Integer::sum);
            overall = InteractionSeverity.max(overall, pair.getSeverity());
        }

        return InteractionQueryResult.builder()
            .matchedPairs(List.copyOf(pairs))
            .unmatchedInputs(List.copyOf(unmatched))
            .overallRisk(overall)
            .resolvedInputs(List.copyOf(resolved))
            .summary(summary)
            .safe(overall != InteractionSeverity.SEVERE)
            .ruleBaseVersion(rules.getVersion())
            .build();
    }

    private ResolvedDrug resolve(String input, Set<String> vocabulary) {
        String normalized = normalize(input);
        if (normalized.isEmpty()) {
            return null;
        }
        if (vocabulary.contains(normalized)) {
            return ResolvedDrug.builder()
                .input(input).normalized(normalized).canonical(normalized)
                .resolution(ResolvedDrug.Resolution.EXACT).similarity(1.0)
                .build();
        }
        String best = null;
        double bestScore = -1.0;
        for (String candidate : vocabulary) {
            double score = StringSimilarity.similarity(normalized, candidate);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best == null || bestScore < settings.getSimilarityThreshold()) {
            return null;
        }
        return ResolvedDrug.builder()
            .input(input).normalized(normalized).canonical(best)
            .resolution(ResolvedDrug.Resolution.FUZZY).similarity(EngineMath.round(bestScore))
            .build();
    }

    private static final class Index {

        private final Set<String> classNames = new TreeSet<>();
        private final Map<String, Set<String>> classesOfDrug = new HashMap<>();
        private final Set<String> vocabulary = new TreeSet<>();
        private final Map<String, InteractionRule> rulesByPair = new HashMap<>();

        private Index(InteractionRuleBase ruleBase) {
            Map<String, List<String>> classes = ruleBase.getDrugClasses() == null ? Map.of() : ruleBase.getDrugClasses();
            new TreeMap<>(classes).forEach((className, members) -> {
                if (members == null) {
                    throw new InvalidEngineInputException("drug class '" + className + "' has no member list");
                }
                String cls = normalize(className);
                classNames.add(cls);
                for (String member : members) {
                    String drug = normalize(member);
                    vocabulary.add(drug);
                    classesOfDrug.computeIfAbsent(drug, d -> new TreeSet<>()).add(cls);
                }
            });
            if (ruleBase.getRules() == null) {
                throw new InvalidEngineInputException("rule base has no rule list");
            }
            for (InteractionRule rule : ruleBase.getRules()) {
                if (rule == null || rule.getSeverity() == null || rule.getDrugA() == null || rule.getDrugB() == null) {
                    throw new InvalidEngineInputException("interaction rule needs drugA, drugB and severity: " + rule);
                }
                String a = normalize(rule.getDrugA());
                String b = normalize(rule.getDrugB());
                if (!classNames.contains(a)) {
                    vocabulary.add(a);
                }
                if (!classNames.contains(b)) {
                    vocabulary.add(b);
                }
                rulesByPair.merge(key(a, b), rule,
                    (existing, added) -> added.getSeverity().compareTo(existing.getSeverity()) > 0 ? added : existing);
            }
            vocabulary.remove("");
        }

        private MatchedPair lookup(String a, String b) {
            InteractionRule direct = rulesByPair.get(key(a, b));
            if (direct != null) {
                return toPair(a, b, direct, MatchedPair.Scope.DRUG);
            }
            InteractionRule best = null;
            for (String left : termsOf(a)) {
                for (String right : termsOf(b)) {
                    if (left.equals(a) && right.equals(b)) {
                        continue;
                    }
                    InteractionRule rule = rulesByPair.get(key(left, right));
                    if (rule != null && (best == null || rule.getSeverity().compareTo(best.getSeverity()) > 0)) {
                        best = rule;
                    }
                }
            }
            return best == null ? null : toPair(a, b, best, MatchedPair.Scope.CLASS);
        }

        private Set<String> termsOf(String drug) {
            Set<String> terms = new LinkedHashSet<>();
            terms.add(drug);
            terms.addAll(classesOfDrug.getOrDefault(drug, Set.of()));
            return terms;
        }

        private static MatchedPair toPair(String a, String b, InteractionRule rule, MatchedPair.Scope scope) {
            boolean withSubstitutes = rule.getSeverity().isAtLeast(InteractionSeverity.MODERATE);
            List<String> substitutes = rule.getSubstituteSuggestions() == null ? List.of() : rule.getSubstituteSuggestions();
            return MatchedPair.builder()
                .drugA(a)
                .drugB(b)
                .severity(rule.getSeverity())
                .scope(scope)
                .ruleDrugA(rule.getDrugA())
                .ruleDrugB(rule.getDrugB())
                .description(rule.getDescription())
                .management(rule.getManagement())
                .substituteSuggestions(withSubstitutes ? List.copyOf(substitutes) : List.of())
                .build();
        }

        private static String key(String a, String b) {
            return a.compareTo(b) <= 0 ? a + "\u0000" + b : b + "\u0000" + a;
        }
    }
}
