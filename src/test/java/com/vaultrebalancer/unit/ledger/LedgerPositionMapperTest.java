package com.vaultrebalancer.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import com.vaultrebalancer.domain.model.Position;
import com.vaultrebalancer.ledger.dto.ClearinghouseStateDto;
import com.vaultrebalancer.ledger.dto.VaultDetailsDto;
import com.vaultrebalancer.ledger.dto.VaultEquityDto;
import com.vaultrebalancer.ledger.mapper.LedgerPositionMapper;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for LedgerPositionMapper: ROE over the capital basis, lock-up conversion and
 * open-position counting.
 */
class LedgerPositionMapperTest {

    private final LedgerPositionMapper mapper = new LedgerPositionMapper();

    @Test
    @DisplayName("ROE is PnL over equity minus PnL")
    void computesRoe() {
        Position position = mapper.toDomain(equity("1100", 0L), details("100"), null, 4);

        // 100 / (1100 - 100) * 100
        assertThat(position.getRoePct()).isEqualByComparingTo("10");
        assertThat(position.getPnlUsd()).isEqualByComparingTo("100");
        assertThat(position.getVaultName()).isEqualTo("Alpha");
        assertThat(position.getTradesLast7d()).isEqualTo(4);
    }

    @Test
    @DisplayName("Negative PnL gives negative ROE")
    void negativeRoe() {
        Position position = mapper.toDomain(equity("950", null), details("-50"), null, 0);

        assertThat(position.getRoePct()).isEqualByComparingTo("-5");
    }

    @Test
    @DisplayName("Missing follower state leaves PnL and ROE unknown")
    void missingDetails() {
        Position position = mapper.toDomain(equity("500", null), null, null, 0);

        assertThat(position.getPnlUsd()).isNull();
        assertThat(position.getRoePct()).isNull();
        assertThat(position.getEquityUsd()).isEqualByComparingTo("500");
    }

    @Test
    @DisplayName("Non-positive capital basis leaves ROE unknown")
    void nonPositiveBasis() {
        Position position = mapper.toDomain(equity("100", null), details("100"), null, 0);

        assertThat(position.getRoePct()).isNull();
    }

    @Test
    @DisplayName("Lock timestamp of zero means not locked")
    void lockConversion() {
        assertThat(mapper.toDomain(equity("1", 0L), null, null, 0).getLockedUntil()).isNull();
        assertThat(mapper.toDomain(equity("1", 1_772_323_200_000L), null, null, 0).getLockedUntil())
                .isEqualTo(Instant.ofEpochMilli(1_772_323_200_000L));
    }

    @Test
    @DisplayName("Only non-zero vault positions count as open")
    void countsOpenPositions() {
        ClearinghouseStateDto state = ClearinghouseStateDto.builder()
                .assetPositions(List.of(asset("BTC", "0.5"), asset("ETH", "0"), asset("SOL", "-12")))
                .build();

        Position position = mapper.toDomain(equity("10", null), null, state, 0);

        assertThat(position.getActivePositionCount()).isEqualTo(2);
        assertThat(position.isInactive()).isFalse();
    }

    @Test
    @DisplayName("Missing vault state leaves activity unknown, never inactive")
    void missingVaultStateNotInactive() {
        Position position = mapper.toDomain(equity("1000", null), null, null, 0);

        assertThat(position.getActivePositionCount()).isNull();
        assertThat(position.isInactive()).isFalse();
    }

    @Test
    @DisplayName("Observed zero open positions and zero fills is inactive")
    void observedDormancyInactive() {
        Position position = mapper.toDomain(equity("1000", null), null, new ClearinghouseStateDto(), 0);

        assertThat(position.getActivePositionCount()).isZero();
        assertThat(position.isInactive()).isTrue();
    }

    private static VaultEquityDto equity(String equity, Long lockedUntil) {
        return VaultEquityDto.builder()
                .vaultAddress("0xvault")
                .equity(new BigDecimal(equity))
                .lockedUntilTimestamp(lockedUntil)
                .build();
    }

    private static VaultDetailsDto details(String pnl) {
        return VaultDetailsDto.builder()
                .name("Alpha")
                .followerState(VaultDetailsDto.FollowerState.builder()
                        .pnl(new BigDecimal(pnl))
                        .build())
                .build();
    }

    private static ClearinghouseStateDto.AssetPosition asset(String coin, String size) {
        return new ClearinghouseStateDto.AssetPosition(
                new ClearinghouseStateDto.PerpPosition(coin, new BigDecimal(size)));
    }
}
