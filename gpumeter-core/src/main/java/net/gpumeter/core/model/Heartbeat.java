package net.gpumeter.core.model;

import java.time.Instant;

public record Heartbeat(
        String jobId,
        long tickSeq,
        Instant workerTimestamp,
        long elapsedSecondsSinceLastHeartbeat,
        boolean sandboxAlive
) {}
