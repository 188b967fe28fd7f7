package com.purchasingpower.stocksync.repository;

import com.purchasingpower.stocksync.model.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for Order rows, used for aggregate reads the view model layer does not cover.
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    /**
     * Total quantity ordered from a product; zero when it has no orders.
     */
    @Query("SELECT COALESCE(SUM(o.quantity), 0) FROM ProductOrder o WHERE o.productId = :productId")
    long sumQuantityByProductId(@Param("productId") Long productId);
}
