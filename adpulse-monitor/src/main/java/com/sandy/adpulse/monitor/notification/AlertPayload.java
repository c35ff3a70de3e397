package com.sandy.adpulse.monitor.notification;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.model.Severity;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * JSON body posted to webhook channels.
 */
@Data
@Builder
public class AlertPayload {
    private Long alertId;
    private String thresholdId;
    private String thresholdName;
    private String metric;
    private double currentValue;
    private double thresholdValue;
    private Severity severity;
    private String message;
    private LocalDateTime triggeredAt;
    private String campaignId;
    private String adsetId;

    public static AlertPayload of(ActiveAlert a) {
        return AlertPayload.builder()
                .alertId(a.getId())
                .thresholdId(a.getThresholdId())
                .thresholdName(a.getThresholdName())
                .metric(a.getMetric())
                .currentValue(a.getCurrentValue())
                .thresholdValue(a.getThresholdValue())
                .severity(a.getSeverity())
                .message(a.getMessage())
                .triggeredAt(a.getTriggeredAt())
                .campaignId(a.getCampaignId())
                .adsetId(a.getAdsetId())
                .build();
    }
}
