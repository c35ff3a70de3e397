package com.sandy.adpulse.monitor.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MonitoringSchedulerTest {

    AnomalyDetectionService detection;
    AlertEngineService alerts;
    MonitoringScheduler scheduler;

    @BeforeEach
    void setup() {
        detection = mock(AnomalyDetectionService.class);
        alerts = mock(AlertEngineService.class);
        when(detection.getPatterns()).thenReturn(List.of());
        when(alerts.drainPending()).thenReturn(List.of());
        scheduler = new MonitoringScheduler(detection, alerts);
        ReflectionTestUtils.setField(scheduler, "detectionEnabled", true);
        ReflectionTestUtils.setField(scheduler, "alertEnabled", true);
        ReflectionTestUtils.setField(scheduler, "autoRetrain", true);
    }

    @Test
    void loopsIdleUntilStarted() {
        scheduler.scheduledDetection();
        scheduler.scheduledAlertScan();
        scheduler.scheduledRetrain();
        verifyNoInteractions(detection, alerts);
        assertNull(scheduler.status().lastRetrainAt());

        assertTrue(scheduler.start());
        verify(alerts).discardPending();
        scheduler.scheduledDetection();
        scheduler.scheduledAlertScan();
        scheduler.scheduledRetrain();
        verify(detection).runCycle();
        verify(alerts).drainPending();
        assertNotNull(scheduler.status().lastRetrainAt());

        assertTrue(scheduler.stop());
        scheduler.scheduledDetection();
        verify(detection, times(1)).runCycle();
    }

    @Test
    void failingCycleDoesNotStopTheLoop() {
        when(detection.runCycle()).thenThrow(new IllegalStateException("store unavailable"));
        scheduler.start();
        assertDoesNotThrow(() -> scheduler.scheduledDetection());
        assertDoesNotThrow(() -> scheduler.scheduledDetection());
        verify(detection, times(2)).runCycle();
        assertTrue(scheduler.isRunning());
    }

    @Test
    void disabledDetectionSkipsCycles() {
        ReflectionTestUtils.setField(scheduler, "detectionEnabled", false);
        scheduler.start();
        scheduler.scheduledDetection();
        verify(detection, never()).runCycle(any(LocalDateTime.class));
        verify(detection, never()).runCycle();
    }

    @Test
    void autoStartRunsOnInit() {
        ReflectionTestUtils.setField(scheduler, "autoStart", true);
        scheduler.init();
        assertTrue(scheduler.status().active());
        assertNotNull(scheduler.status().startedAt());
        assertFalse(scheduler.start());
    }
}
