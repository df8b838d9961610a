package com.example.rcaengine.repository;

import com.example.rcaengine.domain.TopologyComponent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TopologyComponentRepository extends JpaRepository<TopologyComponent, String> {

    List<TopologyComponent> findByType(String type);
}
