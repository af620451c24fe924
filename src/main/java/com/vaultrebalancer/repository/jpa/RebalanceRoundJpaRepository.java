package com.vaultrebalancer.repository.jpa;

import com.vaultrebalancer.entity.RebalanceRoundEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RebalanceRoundJpaRepository extends JpaRepository<RebalanceRoundEntity, String> {

    List<RebalanceRoundEntity> findAllByOrderByStartedAtDesc(Pageable pageable);
}
