package com.vaultrebalancer.ledger;

import com.vaultrebalancer.domain.model.Position;
import com.vaultrebalancer.exception.LedgerException;
import com.vaultrebalancer.exception.LedgerTransportException;
import com.vaultrebalancer.ledger.dto.ClearinghouseStateDto;
import com.vaultrebalancer.ledger.dto.LedgerUpdateDto;
import com.vaultrebalancer.ledger.dto.VaultDetailsDto;
import com.vaultrebalancer.ledger.dto.VaultEquityDto;
import com.vaultrebalancer.ledger.mapper.LedgerPositionMapper;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hyperliquid implementation of {@link LedgerClient}.
 *
 * <p>Reads go to {@link HyperliquidInfoService}, transfers to {@link TransferSidecarService}.
 * Those two own the Resilience4j annotations and exception wrapping; this class only composes
 * the reads into domain objects.
 *
 * <p>A position needs four reads: the equity row, the vault details for the wallet, the
 * vault's own clearinghouse state and its fills over the last 7 days. Vaults are read one
 * after another. An empty vault state fails the read: activity must be observed before a
 * vault can be called inactive.
 */
@Component
public class HyperliquidLedgerClient implements LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(HyperliquidLedgerClient.class);

    static final Duration ACTIVITY_WINDOW = Duration.ofDays(7);

    private final HyperliquidInfoService infoService;
    private final TransferSidecarService transferSidecarService;
    private final LedgerPositionMapper ledgerPositionMapper;
    private final Clock clock;

    public HyperliquidLedgerClient(
            HyperliquidInfoService infoService,
            TransferSidecarService transferSidecarService,
            LedgerPositionMapper ledgerPositionMapper,
            Clock clock) {
        this.infoService = infoService;
        this.transferSidecarService = transferSidecarService;
        this.ledgerPositionMapper = ledgerPositionMapper;
        this.clock = clock;
    }

    @Override
    public List<Position> getPositions(String wallet) {
        List<VaultEquityDto> equities = infoService.getUserVaultEquities(wallet);
        long activitySince = clock.instant().minus(ACTIVITY_WINDOW).toEpochMilli();

        List<Position> positions = new ArrayList<>(equities.size());
        for (VaultEquityDto equity : equities) {
            String vault = equity.getVaultAddress();
            VaultDetailsDto details = readDetails(vault, wallet);
            ClearinghouseStateDto vaultState = infoService.getClearinghouseState(vault);
            if (vaultState == null) {
                throw new LedgerTransportException("Empty clearinghouse state for vault " + vault);
            }
            int tradesLast7d = infoService.getFillsSince(vault, activitySince).size();
            positions.add(ledgerPositionMapper.toDomain(equity, details, vaultState, tradesLast7d));
        }
        log.debug("Read {} vault positions for wallet {}", positions.size(), wallet);
        return positions;
    }

    @Override
    public BigDecimal getAvailableBalance(String wallet) {
        ClearinghouseStateDto state = infoService.getClearinghouseState(wallet);
        if (state == null || state.getWithdrawable() == null) {
            return BigDecimal.ZERO;
        }
        return state.getWithdrawable();
    }

    @Override
    public Optional<Instant> getLastDepositTime(String wallet) {
        return infoService.getNonFundingLedgerUpdates(wallet, 0L).stream()
                .filter(LedgerUpdateDto::isVaultDeposit)
                .map(LedgerUpdateDto::getTime)
                .filter(Objects::nonNull)
                .max(Long::compare)
                .map(Instant::ofEpochMilli);
    }

    @Override
    public void transfer(String vaultAddress, boolean isDeposit, long usdMicros) {
        transferSidecarService.submit(vaultAddress, isDeposit, usdMicros);
    }

    /** Missing details only cost us the name and PnL, so a failed read is not fatal. */
    private VaultDetailsDto readDetails(String vault, String wallet) {
        try {
            return infoService.getVaultDetails(vault, wallet);
        } catch (LedgerException e) {
            log.warn("Vault details unavailable, PnL unknown: vault={}, error={}", vault, e.getMessage());
            return null;
        }
    }
}
