package dev.nova.sink;

import java.time.Instant;

public record EventReceipt(String status, long id, Instant timestamp) {}
