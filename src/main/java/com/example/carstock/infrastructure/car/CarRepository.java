package com.example.carstock.infrastructure.car;

import com.example.carstock.car.domain.CarEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository

public interface CarRepository extends JpaRepository<CarEntity, Integer>, JpaSpecificationExecutor<CarEntity> {

    List<CarEntity> findAllByDealerId(int dealerId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Car c where c.id = :id and c.dealerId = :dealerId")
    int deleteByIdAndDealerId(@Param("id") int id, @Param("dealerId") int dealerId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Car c set c.stockLevel = :stockLevel where c.id = :id and c.dealerId = :dealerId")
    int updateStockLevel(@Param("id") int id, @Param("dealerId") int dealerId, @Param("stockLevel") int stockLevel);
}
