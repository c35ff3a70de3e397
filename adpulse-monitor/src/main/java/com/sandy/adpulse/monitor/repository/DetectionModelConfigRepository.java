package com.sandy.adpulse.monitor.repository;

import com.sandy.adpulse.monitor.entity.DetectionModelConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DetectionModelConfigRepository extends JpaRepository<DetectionModelConfig, String> {
    List<DetectionModelConfig> findByActiveTrue();
}
