package dev.animetracker.service;

import dev.animetracker.config.FilterRulesConfig;
import dev.animetracker.config.RuleDefinition;
import dev.animetracker.entity.FilterRule;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.filter.FilterAction;
import dev.animetracker.filter.FilterEngine;
import dev.animetracker.filter.FilterField;
import dev.animetracker.filter.FilterOperator;
import dev.animetracker.filter.InvalidRuleException;
import dev.animetracker.repository.FilterRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Stored filter rules: seeding of the defaults, per-show overrides, and the rule list a show
 * is evaluated with.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FilterRuleService {

    private final FilterRuleRepository filterRuleRepository;
    private final FilterRulesConfig filterRulesConfig;

    /**
     * Seed the configured default rules when no rule exists yet.
     *
     * @return number of rules created
     */
    @Transactional
    public int seedDefaults() {
        if (filterRuleRepository.count() > 0) {
            log.debug("Filter rules already present, not seeding defaults");
            return 0;
        }

        List<FilterRule> rules = new ArrayList<>();
        for (RuleDefinition definition : filterRulesConfig.getDefaults()) {
            try {
                rules.add(toRule(definition, null));
            } catch (InvalidRuleException e) {
                log.warn("Ignoring default rule '{}': {}", definition.getName(), e.getMessage());
            }
        }
        filterRuleRepository.saveAll(rules);
        log.info("Seeded {} default filter rule(s)", rules.size());
        return rules.size();
    }

    /**
     * Convert a configured definition into a rule.
     *
     * @param showId null for a global rule
     * @throws InvalidRuleException when the definition cannot be evaluated
     */
    public FilterRule toRule(RuleDefinition definition, Long showId) {
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new InvalidRuleException("Rule without a name");
        }
        FilterRule rule = FilterRule.builder()
                .name(definition.getName().trim())
                .field(FilterField.parse(definition.getField()))
                .operator(FilterOperator.parse(definition.getOperator()))
                .pattern(definition.getPattern())
                .action(FilterAction.parse(definition.getAction()))
                .priority(definition.getPriority())
                .showId(showId)
                .enabled(definition.isEnabled())
                .build();
        rule.predicate().validate();
        return rule;
    }

    public List<FilterRule> globalRules() {
        return filterRuleRepository.findByShowIdIsNullOrderByPriorityDescIdAsc();
    }

    public List<FilterRule> showRules(Long showId) {
        return filterRuleRepository.findByShowIdOrderByPriorityDescIdAsc(showId);
    }

    /**
     * Rules a show is evaluated with, in evaluation order. Invalid stored rules are left out.
     */
    public List<FilterRule> rulesFor(TrackedShow show, List<FilterRule> globalRules) {
        List<FilterRule> overrides = show.getId() == null ? List.of() : showRules(show.getId());
        return FilterEngine.applicableRules(valid(globalRules), valid(overrides), show.getDisabledRules());
    }

    public List<FilterRule> rulesFor(TrackedShow show) {
        return rulesFor(show, globalRules());
    }

    /**
     * Replace a show's overrides. Invalid definitions are skipped, the others are kept.
     */
    @Transactional
    public List<FilterRule> replaceShowRules(TrackedShow show, List<RuleDefinition> definitions) {
        filterRuleRepository.deleteByShowId(show.getId());

        List<FilterRule> rules = new ArrayList<>();
        for (RuleDefinition definition : definitions) {
            try {
                rules.add(toRule(definition, show.getId()));
            } catch (InvalidRuleException e) {
                log.warn("Ignoring rule '{}' of {}: {}", definition.getName(), show.getTitle(), e.getMessage());
            }
        }
        return filterRuleRepository.saveAll(rules);
    }

    private List<FilterRule> valid(List<FilterRule> rules) {
        List<FilterRule> valid = new ArrayList<>(rules.size());
        for (FilterRule rule : rules) {
            try {
                rule.predicate().validate();
                valid.add(rule);
            } catch (InvalidRuleException e) {
                log.warn("Skipping invalid rule '{}': {}", rule.getName(), e.getMessage());
            }
        }
        return valid;
    }
}
