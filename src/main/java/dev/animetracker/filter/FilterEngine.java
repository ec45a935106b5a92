package dev.animetracker.filter;

import dev.animetracker.config.TrackerProperties;
import dev.animetracker.entity.FilterRule;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.model.ReleaseCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Decides whether a candidate is acceptable for a show.
 *
 * <p>Rules run by priority, highest first. At equal priority a show override runs before a
 * global rule, then insertion order decides. The first rule whose predicate matches gives the
 * decision. When nothing matches the candidate is rejected.
 *
 * <p>Evaluation has no side effects besides debug logging.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilterEngine {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    static final Comparator<FilterRule> EVALUATION_ORDER = Comparator
            .comparingInt(FilterRule::getPriority).reversed()
            .thenComparingInt(rule -> rule.isGlobal() ? 1 : 0)
            .thenComparing(FilterRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final TrackerProperties trackerProperties;

    /**
     * Build the ordered rule list that applies to one show: enabled global rules the show did not
     * switch off, plus the show's own enabled overrides.
     */
    public static List<FilterRule> applicableRules(List<FilterRule> globalRules, List<FilterRule> showRules,
                                                   Set<String> disabledRuleNames) {
        List<FilterRule> rules = new ArrayList<>();
        for (FilterRule rule : globalRules) {
            if (rule.isEnabled() && !disabledRuleNames.contains(rule.getName())) {
                rules.add(rule);
            }
        }
        for (FilterRule rule : showRules) {
            if (rule.isEnabled()) {
                rules.add(rule);
            }
        }
        rules.sort(EVALUATION_ORDER);
        return rules;
    }

    /**
     * Evaluate a candidate against rules already ordered by {@link #applicableRules}.
     */
    public Decision evaluate(ReleaseCandidate candidate, TrackedShow show, List<FilterRule> orderedRules) {
        for (FilterRule rule : orderedRules) {
            boolean matched;
            try {
                matched = matches(rule.predicate(), candidate, show);
            } catch (InvalidRuleException e) {
                log.warn("Skipping rule '{}': {}", rule.getName(), e.getMessage());
                continue;
            }
            if (!matched) {
                continue;
            }

            if (rule.getAction() == FilterAction.ACCEPT) {
                log.debug("'{}' accepted by rule '{}'", candidate.getRawTitle(), rule.getName());
                return Decision.accept(rule.getName());
            }
            String reason = describe(rule);
            log.debug("'{}' rejected by rule '{}': {}", candidate.getRawTitle(), rule.getName(), reason);
            return Decision.reject(rule.getName(), reason);
        }

        log.debug("'{}' rejected: no rule matched", candidate.getRawTitle());
        return Decision.noRuleMatched();
    }

    /**
     * Evaluate with the show's own and the global rules, ordering them first.
     */
    public Decision evaluate(ReleaseCandidate candidate, TrackedShow show,
                             List<FilterRule> globalRules, List<FilterRule> showRules) {
        return evaluate(candidate, show, applicableRules(globalRules, showRules, show.getDisabledRules()));
    }

    boolean matches(RulePredicate predicate, ReleaseCandidate candidate, TrackedShow show) {
        predicate.validate();
        FilterField field = predicate.field();

        return switch (predicate.operator()) {
            case EQUALS -> textValue(field, candidate).equalsIgnoreCase(predicate.pattern().trim());
            case CONTAINS -> textValue(field, candidate).toLowerCase(Locale.ROOT)
                    .contains(predicate.pattern().toLowerCase(Locale.ROOT));
            case MATCHES -> compiled(predicate.pattern()).matcher(textValue(field, candidate)).find();
            case AT_LEAST -> numericValue(field, candidate) >= threshold(predicate, show);
            case BELOW -> numericValue(field, candidate) < threshold(predicate, show);
        };
    }

    private String textValue(FilterField field, ReleaseCandidate candidate) {
        String value = switch (field) {
            case TITLE -> candidate.getRawTitle();
            case SHOW -> candidate.getShowGuess();
            case GROUP -> candidate.getGroup();
            case SOURCE -> candidate.getSourceName();
            case RESOLUTION -> String.valueOf(candidate.getResolution());
            case EPISODE -> String.valueOf(candidate.getEpisode());
        };
        return Objects.requireNonNullElse(value, "");
    }

    private int numericValue(FilterField field, ReleaseCandidate candidate) {
        return switch (field) {
            case RESOLUTION -> candidate.getResolution();
            case EPISODE -> candidate.getEpisode();
            default -> throw new InvalidRuleException(field + " is not numeric");
        };
    }

    private int threshold(RulePredicate predicate, TrackedShow show) {
        if (predicate.usesShowMinimum()) {
            return minimumResolution(show);
        }
        return predicate.parseThreshold();
    }

    /**
     * The show's minimum resolution, or the configured default.
     */
    public int minimumResolution(TrackedShow show) {
        Integer min = show.getMinResolution();
        return min != null ? min : trackerProperties.getDefaultMinResolution();
    }

    private static Pattern compiled(String regex) {
        return PATTERN_CACHE.computeIfAbsent(regex, k -> Pattern.compile(k, Pattern.CASE_INSENSITIVE));
    }

    private static String describe(FilterRule rule) {
        return String.format("%s %s '%s'", rule.getField(), rule.getOperator(), rule.getPattern())
                .toLowerCase(Locale.ROOT);
    }
}
