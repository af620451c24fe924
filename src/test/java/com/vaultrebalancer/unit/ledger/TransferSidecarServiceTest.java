package com.vaultrebalancer.unit.ledger;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.vaultrebalancer.exception.InsufficientEquityException;
import com.vaultrebalancer.exception.LedgerRejectedException;
import com.vaultrebalancer.exception.LedgerTransportException;
import com.vaultrebalancer.ledger.TransferSidecarService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/**
 * Tests for TransferSidecarService against a mocked sidecar: request shape and the mapping
 * of sidecar answers onto ledger exceptions.
 */
class TransferSidecarServiceTest {

    private MockRestServiceServer server;
    private TransferSidecarService transferSidecarService;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://sidecar");
        server = MockRestServiceServer.bindTo(builder).build();
        transferSidecarService = new TransferSidecarService(builder.build());
    }

    @Test
    void submitsTransferInMicroUsd() {
        server.expect(requestTo("http://sidecar/vault-transfer"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"vaultAddress\":\"0xvault\",\"isDeposit\":true,\"usd\":84000000}"))
                .andRespond(withSuccess(
                        "{\"status\":\"ok\",\"response\":{\"type\":\"default\"}}", MediaType.APPLICATION_JSON));

        assertThatCode(() -> transferSidecarService.submit("0xvault", true, 84_000_000L))
                .doesNotThrowAnyException();
        server.verify();
    }

    @Test
    void errStatusIsClassified() {
        server.expect(requestTo("http://sidecar/vault-transfer"))
                .andRespond(withSuccess(
                        "{\"status\":\"err\",\"response\":\"Insufficient vault equity for withdrawal\"}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> transferSidecarService.submit("0xvault", false, 10_000_000L))
                .isInstanceOf(InsufficientEquityException.class);
    }

    @Test
    void rejectedHttpStatusUsesBodyText() {
        server.expect(requestTo("http://sidecar/vault-transfer"))
                .andRespond(withBadRequest().body("Vault is closed").contentType(MediaType.TEXT_PLAIN));

        assertThatThrownBy(() -> transferSidecarService.submit("0xvault", true, 10_000_000L))
                .isInstanceOf(LedgerRejectedException.class)
                .hasMessage("Vault is closed");
    }

    @Test
    void serverErrorIsTransportFailure() {
        server.expect(requestTo("http://sidecar/vault-transfer")).andRespond(withServerError());

        assertThatThrownBy(() -> transferSidecarService.submit("0xvault", true, 10_000_000L))
                .isInstanceOf(LedgerTransportException.class);
    }

    @Test
    void emptyResponseIsTransportFailure() {
        server.expect(requestTo("http://sidecar/vault-transfer")).andRespond(withSuccess());

        assertThatThrownBy(() -> transferSidecarService.submit("0xvault", true, 10_000_000L))
                .isInstanceOf(LedgerTransportException.class);
    }
}
