package com.vaultrebalancer.observability;

import com.vaultrebalancer.domain.model.RebalanceRoundResult;
import com.vaultrebalancer.entity.RebalanceRoundEntity;
import com.vaultrebalancer.event.RebalanceRoundEvent;
import com.vaultrebalancer.mapper.RebalanceRoundMapper;
import com.vaultrebalancer.repository.jpa.RebalanceRoundJpaRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Archive of finished rebalance rounds.
 *
 * <p>Keeps the last {@value #RING_BUFFER_SIZE} rounds in memory (newest first) for the
 * operations API and persists every round to H2. Rounds from before a restart are read back
 * from H2 when the buffer cannot answer.
 *
 * <p>The archive is write-only from the engine's point of view: nothing here feeds back into
 * planning. A failed save is logged and the round result is unaffected.
 */
@Service
public class RoundHistoryService {

    private static final Logger log = LoggerFactory.getLogger(RoundHistoryService.class);

    static final int RING_BUFFER_SIZE = 100;

    private final RebalanceRoundJpaRepository rebalanceRoundJpaRepository;
    private final RebalanceRoundMapper rebalanceRoundMapper = Mappers.getMapper(RebalanceRoundMapper.class);

    private final ConcurrentLinkedDeque<RebalanceRoundResult> ringBuffer = new ConcurrentLinkedDeque<>();

    public RoundHistoryService(RebalanceRoundJpaRepository rebalanceRoundJpaRepository) {
        this.rebalanceRoundJpaRepository = rebalanceRoundJpaRepository;
    }

    @EventListener
    @Order(10)
    public void onRoundFinished(RebalanceRoundEvent event) {
        record(event.getResult());
    }

    public void record(RebalanceRoundResult result) {
        ringBuffer.addFirst(result);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.pollLast();
        }

        try {
            RebalanceRoundEntity entity = rebalanceRoundMapper.toEntity(result);
            rebalanceRoundJpaRepository.save(entity);
        } catch (RuntimeException e) {
            log.error("Failed to persist rebalance round {}: {}", result.getRoundId(), e.getMessage());
        }
    }

    /** Most recent rounds, newest first. */
    public List<RebalanceRoundResult> getRecent(int limit) {
        int capped = Math.max(1, Math.min(limit, RING_BUFFER_SIZE));
        if (!ringBuffer.isEmpty()) {
            List<RebalanceRoundResult> recent = new ArrayList<>(capped);
            for (RebalanceRoundResult result : ringBuffer) {
                if (recent.size() >= capped) {
                    break;
                }
                recent.add(result);
            }
            return recent;
        }
        return rebalanceRoundMapper.toDomainList(
                rebalanceRoundJpaRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, capped)));
    }

    public Optional<RebalanceRoundResult> findById(String roundId) {
        for (RebalanceRoundResult result : ringBuffer) {
            if (result.getRoundId().equals(roundId)) {
                return Optional.of(result);
            }
        }
        return rebalanceRoundJpaRepository.findById(roundId).map(rebalanceRoundMapper::toDomain);
    }

    /** Most recent round, if any ran since startup. */
    public Optional<RebalanceRoundResult> getLast() {
        return Optional.ofNullable(ringBuffer.peekFirst());
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }
}
