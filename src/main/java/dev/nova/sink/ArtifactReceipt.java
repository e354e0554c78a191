package dev.nova.sink;

import java.time.Instant;

public record ArtifactReceipt(String status, String uri, long sizeBytes, Instant timestamp) {}
