package dev.animetracker.repository;

import dev.animetracker.entity.FilterRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for global filter rules and per-show overrides.
 */
@Repository
public interface FilterRuleRepository extends JpaRepository<FilterRule, Long> {

    /**
     * Global rules in evaluation order.
     */
    List<FilterRule> findByShowIdIsNullOrderByPriorityDescIdAsc();

    /**
     * Overrides of one show in evaluation order.
     */
    List<FilterRule> findByShowIdOrderByPriorityDescIdAsc(Long showId);

    void deleteByShowId(Long showId);
}
