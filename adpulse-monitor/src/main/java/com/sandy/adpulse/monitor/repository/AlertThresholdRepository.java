package com.sandy.adpulse.monitor.repository;

import com.sandy.adpulse.monitor.entity.AlertThreshold;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertThresholdRepository extends JpaRepository<AlertThreshold, String> {
    List<AlertThreshold> findByActiveTrueAndMetric(String metric);
    List<AlertThreshold> findAllByOrderByCreatedAtAsc();
}
