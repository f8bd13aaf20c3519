package net.gpumeter.core.spi;

import net.gpumeter.core.model.Reservation;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

public interface ReservationRepository {
    Reservation insert(Reservation reservation) throws Exception;

    Optional<Reservation> findById(long id) throws Exception;

    Optional<Reservation> findActiveByJob(String jobId) throws Exception;

    void updateRemaining(long id, BigDecimal remaining) throws Exception;

    /** ACTIVE → RELEASED, remaining=0 */
    void markReleased(long id, Instant at) throws Exception;
}
