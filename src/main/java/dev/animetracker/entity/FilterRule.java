package dev.animetracker.entity;

import dev.animetracker.filter.FilterAction;
import dev.animetracker.filter.FilterField;
import dev.animetracker.filter.FilterOperator;
import dev.animetracker.filter.RulePredicate;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entity for a filter rule. A null {@code showId} makes the rule global,
 * otherwise it is an override for that show only.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "filter_rules", indexes = {
        @Index(name = "idx_rule_show", columnList = "showId")
})
public class FilterRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FilterField field;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FilterOperator operator;

    @Column(nullable = false, length = 500)
    private String pattern;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FilterAction action;

    @Column(nullable = false)
    private int priority;

    private Long showId;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public boolean isGlobal() {
        return showId == null;
    }

    public RulePredicate predicate() {
        return new RulePredicate(field, operator, pattern);
    }
}
