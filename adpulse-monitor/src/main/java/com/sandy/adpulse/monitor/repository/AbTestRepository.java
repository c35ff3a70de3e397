package com.sandy.adpulse.monitor.repository;

import com.sandy.adpulse.monitor.entity.AbTest;
import com.sandy.adpulse.monitor.model.AbTestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AbTestRepository extends JpaRepository<AbTest, String> {
    List<AbTest> findByStatus(AbTestStatus status);
}
