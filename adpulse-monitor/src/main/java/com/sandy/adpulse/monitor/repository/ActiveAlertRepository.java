package com.sandy.adpulse.monitor.repository;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.model.AlertStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ActiveAlertRepository extends JpaRepository<ActiveAlert, Long> {
    List<ActiveAlert> findByStatusOrderByTriggeredAtDesc(AlertStatus status);
    List<ActiveAlert> findByStatusNotOrderByTriggeredAtDesc(AlertStatus status);
    List<ActiveAlert> findTop50ByOrderByTriggeredAtDesc();
    List<ActiveAlert> findByTriggeredAtAfterOrderByTriggeredAtAsc(LocalDateTime after);
    long countByStatus(AlertStatus status);
}
