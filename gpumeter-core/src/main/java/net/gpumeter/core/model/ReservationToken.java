package net.gpumeter.core.model;

import java.math.BigDecimal;

public record ReservationToken(long reservationId, String userId, String jobId, BigDecimal amount) {}
