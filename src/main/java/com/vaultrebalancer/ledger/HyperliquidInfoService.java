package com.vaultrebalancer.ledger;

import com.vaultrebalancer.exception.LedgerTransportException;
import com.vaultrebalancer.ledger.dto.ClearinghouseStateDto;
import com.vaultrebalancer.ledger.dto.FillDto;
import com.vaultrebalancer.ledger.dto.InfoRequest;
import com.vaultrebalancer.ledger.dto.LedgerUpdateDto;
import com.vaultrebalancer.ledger.dto.VaultDetailsDto;
import com.vaultrebalancer.ledger.dto.VaultEquityDto;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Read-only queries against the ledger's public {@code POST /info} endpoint.
 *
 * <p>This is an implementation detail of {@link HyperliquidLedgerClient}; nothing else should
 * inject it. Every method is idempotent, so all of them carry:
 * <ul>
 *   <li><b>Retry</b> ({@code ledgerApi}): a few attempts with exponential backoff</li>
 *   <li><b>CircuitBreaker</b> ({@code ledgerApi}): stops hammering the endpoint when it is down</li>
 * </ul>
 *
 * <p>HTTP and decoding failures are wrapped in {@link LedgerTransportException}.
 */
@Service
public class HyperliquidInfoService {

    private static final Logger log = LoggerFactory.getLogger(HyperliquidInfoService.class);

    private static final ParameterizedTypeReference<List<VaultEquityDto>> VAULT_EQUITIES =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<FillDto>> FILLS = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<LedgerUpdateDto>> LEDGER_UPDATES =
            new ParameterizedTypeReference<>() {};

    private final RestClient ledgerInfoRestClient;

    public HyperliquidInfoService(@Qualifier("ledgerInfoRestClient") RestClient ledgerInfoRestClient) {
        this.ledgerInfoRestClient = ledgerInfoRestClient;
    }

    @CircuitBreaker(name = "ledgerApi")
    @Retry(name = "ledgerApi")
    public List<VaultEquityDto> getUserVaultEquities(String user) {
        List<VaultEquityDto> equities = query(InfoRequest.forUser("userVaultEquities", user), VAULT_EQUITIES);
        return equities != null ? equities : List.of();
    }

    /** Vault metadata plus {@code user}'s follower state (PnL, lock-up) in that vault. */
    @CircuitBreaker(name = "ledgerApi")
    @Retry(name = "ledgerApi")
    public VaultDetailsDto getVaultDetails(String vaultAddress, String user) {
        InfoRequest request = InfoRequest.builder()
                .type("vaultDetails")
                .vaultAddress(vaultAddress)
                .user(user)
                .build();
        return query(request, ParameterizedTypeReference.forType(VaultDetailsDto.class));
    }

    @CircuitBreaker(name = "ledgerApi")
    @Retry(name = "ledgerApi")
    public ClearinghouseStateDto getClearinghouseState(String user) {
        return query(
                InfoRequest.forUser("clearinghouseState", user),
                ParameterizedTypeReference.forType(ClearinghouseStateDto.class));
    }

    @CircuitBreaker(name = "ledgerApi")
    @Retry(name = "ledgerApi")
    public List<FillDto> getFillsSince(String user, long startTimeMillis) {
        InfoRequest request = InfoRequest.builder()
                .type("userFillsByTime")
                .user(user)
                .startTime(startTimeMillis)
                .build();
        List<FillDto> fills = query(request, FILLS);
        return fills != null ? fills : List.of();
    }

    @CircuitBreaker(name = "ledgerApi")
    @Retry(name = "ledgerApi")
    public List<LedgerUpdateDto> getNonFundingLedgerUpdates(String user, long startTimeMillis) {
        InfoRequest request = InfoRequest.builder()
                .type("userNonFundingLedgerUpdates")
                .user(user)
                .startTime(startTimeMillis)
                .build();
        List<LedgerUpdateDto> updates = query(request, LEDGER_UPDATES);
        return updates != null ? updates : List.of();
    }

    private <T> T query(InfoRequest request, ParameterizedTypeReference<T> responseType) {
        try {
            return ledgerInfoRestClient
                    .post()
                    .uri("/info")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(responseType);
        } catch (RestClientException e) {
            log.error("Ledger info query failed: type={}, error={}", request.getType(), e.getMessage());
            throw new LedgerTransportException(
                    "Ledger info query " + request.getType() + " failed: " + e.getMessage(), e);
        }
    }
}
