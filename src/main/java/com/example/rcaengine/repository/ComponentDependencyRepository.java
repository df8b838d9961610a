package com.example.rcaengine.repository;

import com.example.rcaengine.domain.ComponentDependency;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ComponentDependencyRepository extends JpaRepository<ComponentDependency, String> {

    Optional<ComponentDependency> findByFromComponentIdAndToComponentId(String fromComponentId, String toComponentId);

    List<ComponentDependency> findByFromComponentId(String fromComponentId);

    List<ComponentDependency> findByToComponentId(String toComponentId);

    @Modifying
    @Query("DELETE FROM ComponentDependency d WHERE d.fromComponentId = :componentId OR d.toComponentId = :componentId")
    int deleteTouching(String componentId);
}
