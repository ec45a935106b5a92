package dev.animetracker.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filter rule as written in configuration (application.yml or the show catalog).
 * Field, operator and action are kept as text and validated when converted to a rule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleDefinition {
    private String name;
    private String field;
    private String operator;
    private String pattern;
    private String action;
    private int priority;
    @Builder.Default
    private boolean enabled = true;
}
