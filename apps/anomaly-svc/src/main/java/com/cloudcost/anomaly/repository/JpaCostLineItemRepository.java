package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.entity.CostLineItemEntity;
import java.time.LocalDateTime;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCostLineItemRepository extends JpaRepository<CostLineItemEntity, UUID> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CostLineItemEntity c WHERE c.usageStartDate >= :from AND c.usageStartDate < :to AND c.dataSource = :dataSource")
    int deleteByRangeAndDataSource(@Param("from") LocalDateTime from,
                                   @Param("to") LocalDateTime to,
                                   @Param("dataSource") String dataSource);
}
