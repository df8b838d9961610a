package com.example.rcaengine.repository;

import com.example.rcaengine.domain.RootCauseOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RootCauseOutcomeRepository extends JpaRepository<RootCauseOutcome, String> {

    long countByComponentIdAndAlertPattern(String componentId, String alertPattern);

    long countByComponentIdAndAlertPatternAndConfirmedTrue(String componentId, String alertPattern);

    @Query("SELECT o FROM RootCauseOutcome o WHERE o.componentId = :componentId AND o.alertPattern = :alertPattern " +
           "AND o.confirmed = true AND o.fixReference IS NOT NULL ORDER BY o.recordedAt DESC")
    List<RootCauseOutcome> findConfirmedFixes(String componentId, String alertPattern);

    boolean existsByIncidentId(String incidentId);
}
