package com.sandy.adpulse.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class AbTestAlert {

    public enum Kind { SIGNIFICANCE, SAMPLE_SIZE, PERFORMANCE }

    public enum Level { INFO, WARNING, CRITICAL }

    Kind kind;
    Level level;
    String message;
    LocalDateTime timestamp;
}
