package com.vaultrebalancer.ledger;

import com.vaultrebalancer.domain.model.Position;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Everything the rebalancing engine needs from the vault ledger. No other component talks to
 * the ledger directly.
 *
 * <p>Failures surface as {@link com.vaultrebalancer.exception.LedgerException} subtypes:
 * <ul>
 *   <li>{@link com.vaultrebalancer.exception.InsufficientEquityException}: the vault cannot
 *       release the requested amount right now; a smaller amount may succeed</li>
 *   <li>{@link com.vaultrebalancer.exception.LedgerRejectedException}: any other refusal</li>
 *   <li>{@link com.vaultrebalancer.exception.LedgerTransportException}: network or decoding
 *       failure; the outcome of a transfer is unknown</li>
 * </ul>
 */
public interface LedgerClient {

    /** Vaults the wallet holds equity in, with the vault's activity and the wallet's PnL. */
    List<Position> getPositions(String wallet);

    /** USD the wallet can deposit right now. */
    BigDecimal getAvailableBalance(String wallet);

    /** Time of the most recent vault deposit made by the wallet, if any. */
    Optional<Instant> getLastDepositTime(String wallet);

    /**
     * Moves {@code usdMicros} micro-USD between the wallet and a vault.
     *
     * @param isDeposit true moves funds into the vault, false withdraws
     */
    void transfer(String vaultAddress, boolean isDeposit, long usdMicros);
}
