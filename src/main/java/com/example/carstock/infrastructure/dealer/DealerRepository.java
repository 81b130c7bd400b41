package com.example.carstock.infrastructure.dealer;

import com.example.carstock.dealer.domain.DealerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository

public interface DealerRepository extends JpaRepository<DealerEntity, Integer> {
}
