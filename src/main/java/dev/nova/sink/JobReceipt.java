package dev.nova.sink;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public record JobReceipt(
    String status,
    String jobId,
    Duration duration,
    Map<String, Object> echo,
    Instant startTime,
    Instant endTime
) {}
