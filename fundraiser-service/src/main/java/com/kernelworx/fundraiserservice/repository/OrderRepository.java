package com.kernelworx.fundraiserservice.repository;

import com.kernelworx.fundraiserservice.model.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    List<Order> findByCampaignIdOrderByCreatedAtAsc(String campaignId);

    List<Order> findByProfileIdOrderByCreatedAtAsc(String profileId);

    @Query("SELECT COUNT(o) AS orderCount, COALESCE(SUM(o.totalAmount), 0) AS revenue "
            + "FROM Order o WHERE o.campaignId = :campaignId")
    CampaignTotals summarize(@Param("campaignId") String campaignId);
}
