package dev.animetracker.repository;

import dev.animetracker.entity.TrackedShow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for tracked shows.
 */
@Repository
public interface TrackedShowRepository extends JpaRepository<TrackedShow, Long> {

    List<TrackedShow> findByEnabledTrue();

    Optional<TrackedShow> findByTitleIgnoreCase(String title);
}
