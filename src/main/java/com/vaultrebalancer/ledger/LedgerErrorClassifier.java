package com.vaultrebalancer.ledger;

import com.vaultrebalancer.exception.InsufficientEquityException;
import com.vaultrebalancer.exception.LedgerException;
import com.vaultrebalancer.exception.LedgerRejectedException;
import java.util.Locale;

/**
 * Turns the exchange's free-text rejection into a typed {@link LedgerException}.
 *
 * <p>This is the only place that looks at error wording. Everything downstream dispatches on
 * the exception type.
 */
public final class LedgerErrorClassifier {

    static final String INSUFFICIENT_EQUITY_MARKER = "insufficient vault equity";

    private LedgerErrorClassifier() {}

    public static LedgerException classify(String message) {
        String text = message == null ? "" : message;
        if (text.toLowerCase(Locale.ROOT).contains(INSUFFICIENT_EQUITY_MARKER)) {
            return new InsufficientEquityException(text);
        }
        return new LedgerRejectedException(text.isBlank() ? "Transfer rejected by ledger" : text);
    }
}
