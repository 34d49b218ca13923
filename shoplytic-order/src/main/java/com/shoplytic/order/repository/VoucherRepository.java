package com.shoplytic.order.repository;

import com.shoplytic.order.entity.Voucher;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VoucherRepository extends JpaRepository<Voucher, Long> {

    /**
     * Row-locks the voucher for the rest of the transaction, serializing
     * purchases that spend the same voucher.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Voucher v WHERE v.code = :code")
    Optional<Voucher> findByCodeForUpdate(@Param("code") String code);

    Optional<Voucher> findFirstByGeneratedBySessionAndUsedFalseOrderByCreatedAtDesc(String sessionId);

    boolean existsByCode(String code);
}
