package com.shoplytic.order.repository;

import com.shoplytic.order.entity.Order;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.items WHERE o.voucherCode = :voucherCode")
    Optional<Order> findByVoucherCodeWithItems(@Param("voucherCode") String voucherCode);

    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.items WHERE o.id = :id AND o.sessionId = :sessionId")
    Optional<Order> findByIdAndSessionIdWithItems(@Param("id") Long id, @Param("sessionId") String sessionId);

    @Query("SELECT o.id FROM Order o WHERE o.sessionId = :sessionId ORDER BY o.createdAt DESC, o.id DESC")
    List<Long> findRecentIdsBySessionId(@Param("sessionId") String sessionId, Pageable pageable);

    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.items WHERE o.id IN :ids "
            + "ORDER BY o.createdAt DESC, o.id DESC")
    List<Order> findByIdInWithItems(@Param("ids") List<Long> ids);
}
