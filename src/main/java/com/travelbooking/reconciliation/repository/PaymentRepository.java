package com.travelbooking.reconciliation.repository;

import com.travelbooking.reconciliation.entity.Payment;
import com.travelbooking.reconciliation.entity.PaymentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Optional<Payment> findByTxRef(String txRef);

    Optional<Payment> findByBookingId(Long bookingId);

    /**
     * Loads a payment with a row lock held until the surrounding transaction ends.
     * Every read-decide-write on payment status goes through this, so two triggers for
     * the same payment (webhook and manual verify) are applied one after the other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.id = :id")
    Optional<Payment> findByIdWithLock(@Param("id") Long id);

    /**
     * Payments in the given status that have not been touched since the threshold and
     * are still under the verification attempt limit. Oldest first.
     */
    @Query("SELECT p FROM Payment p WHERE p.status = :status " +
            "AND p.txRef IS NOT NULL " +
            "AND p.updatedAt < :updatedBefore " +
            "AND (p.verificationAttempts IS NULL OR p.verificationAttempts < :maxAttempts) " +
            "ORDER BY p.createdAt ASC")
    Page<Payment> findStaleForVerification(
            @Param("status") PaymentStatus status,
            @Param("updatedBefore") LocalDateTime updatedBefore,
            @Param("maxAttempts") int maxAttempts,
            Pageable pageable
    );

    long countByStatus(PaymentStatus status);
}
