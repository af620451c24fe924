package com.vaultrebalancer.ledger;

import com.vaultrebalancer.exception.LedgerTransportException;
import com.vaultrebalancer.ledger.dto.VaultTransferRequest;
import com.vaultrebalancer.ledger.dto.VaultTransferResponse;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Submits vault transfers through the signing sidecar, which holds the wallet key.
 *
 * <p>Transfers move money, so there is no transport-level retry here: a timeout leaves the
 * outcome unknown and resubmitting could move funds twice. The only retry is the
 * amount-reducing ladder in the executor, and only for {@code InsufficientEquityException}.
 * A rate limiter ({@code ledgerTransfers}) paces submissions.
 *
 * <p>A 4xx from the sidecar is an exchange rejection and is classified by its text. A 5xx or
 * a network error leaves the outcome unknown and surfaces as {@link LedgerTransportException}.
 */
@Service
public class TransferSidecarService {

    private static final Logger log = LoggerFactory.getLogger(TransferSidecarService.class);

    private final RestClient ledgerSidecarRestClient;

    public TransferSidecarService(@Qualifier("ledgerSidecarRestClient") RestClient ledgerSidecarRestClient) {
        this.ledgerSidecarRestClient = ledgerSidecarRestClient;
    }

    @RateLimiter(name = "ledgerTransfers")
    public void submit(String vaultAddress, boolean isDeposit, long usdMicros) {
        VaultTransferResponse response;
        try {
            response = ledgerSidecarRestClient
                    .post()
                    .uri("/vault-transfer")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new VaultTransferRequest(vaultAddress, isDeposit, usdMicros))
                    .retrieve()
                    .body(VaultTransferResponse.class);
        } catch (HttpClientErrorException e) {
            // The sidecar relays exchange rejections with a 4xx and the exchange text as body
            String body = e.getResponseBodyAsString();
            log.warn("Vault transfer rejected: vault={}, status={}, body={}", vaultAddress, e.getStatusCode(), body);
            throw LedgerErrorClassifier.classify(body.isBlank() ? e.getMessage() : body);
        } catch (RestClientException e) {
            log.error("Vault transfer transport failure: vault={}, error={}", vaultAddress, e.getMessage());
            throw new LedgerTransportException("Vault transfer failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new LedgerTransportException("Vault transfer returned an empty response", null);
        }
        if (!response.isOk()) {
            throw LedgerErrorClassifier.classify(response.errorMessage());
        }
    }
}
