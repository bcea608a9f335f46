package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.exception.InvalidTransitionException;
import com.flagship.escrow_engine.money.CommissionRate;
import com.flagship.escrow_engine.money.CurrencyCode;
import com.flagship.escrow_engine.money.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ContractController.class)
class ContractControllerTest {

    private static final Instant NOW = Instant.parse("2026-09-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ContractService contractService;

    private UUID requester;
    private UUID worker;
    private Contract pending;

    @BeforeEach
    void setUp() {
        requester = UUID.randomUUID();
        worker = UUID.randomUUID();
        pending = Contract.draft(UUID.randomUUID(), null, requester, worker, "Roof repair",
                        Money.of(25000, CurrencyCode.EUR), Money.of(1250, CurrencyCode.EUR), CommissionRate.of("5.00"),
                        NOW, NOW.plus(Duration.ofDays(3)), true, null, null, NOW)
                .submit("111222", Duration.ofMinutes(30), NOW);
    }

    @Test
    @DisplayName("POST /api/contracts creates a draft for the calling requester")
    void testCreateContract_Returns201() throws Exception {
        Contract draft = Contract.draft(UUID.randomUUID(), null, requester, worker, "Roof repair",
                Money.of(25000, CurrencyCode.EUR), Money.of(1250, CurrencyCode.EUR), CommissionRate.of("5.00"),
                NOW, NOW.plus(Duration.ofDays(3)), true, null, null, NOW);
        when(contractService.createContract(any())).thenReturn(draft);

        String body = """
                {"worker_id":"%s","title":"Roof repair","amount":250.00,"currency":"EUR",
                 "start_date":"2026-09-01T09:00:00Z","end_date":"2026-09-04T09:00:00Z"}
                """.formatted(worker);

        mockMvc.perform(post("/api/contracts")
                        .header(ContractController.USER_HEADER, requester.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(header().exists("X-Correlation-ID"))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.requester_id").value(requester.toString()));

        ArgumentCaptor<CreateContractCommand> command = ArgumentCaptor.forClass(CreateContractCommand.class);
        verify(contractService).createContract(command.capture());
        assertEquals(requester, command.getValue().getRequesterId());
        assertEquals(25000, command.getValue().getBasePrice().getMinorUnits());
        assertEquals(CurrencyCode.EUR, command.getValue().getBasePrice().getCurrency());
        assertTrue(command.getValue().isEscrowEnabled());
    }

    @Test
    @DisplayName("Invalid create requests are rejected before the service is called")
    void testCreateContract_ValidationErrors() throws Exception {
        mockMvc.perform(post("/api/contracts")
                        .header(ContractController.USER_HEADER, requester.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"\",\"amount\":0,\"currency\":\"euro\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.worker_id").doesNotExist())
                .andExpect(jsonPath("$.details.workerId").exists());

        mockMvc.perform(post("/api/contracts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(contractService, never()).createContract(any());
    }

    @Test
    @DisplayName("The pairing code is never part of a contract response")
    void testGetContract_HidesPairingCode() throws Exception {
        when(contractService.getContract(pending.getId())).thenReturn(pending);

        mockMvc.perform(get("/api/contracts/{id}", pending.getId())
                        .header(ContractController.USER_HEADER, worker.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.pairing_code").doesNotExist());
    }

    @Test
    @DisplayName("Outsiders get 403 NOT_A_PARTY")
    void testGetContract_NotAParty() throws Exception {
        when(contractService.getContract(pending.getId())).thenReturn(pending);

        mockMvc.perform(get("/api/contracts/{id}", pending.getId())
                        .header(ContractController.USER_HEADER, UUID.randomUUID().toString()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_A_PARTY"));
    }

    @Test
    @DisplayName("Illegal transitions map to 409 INVALID_TRANSITION")
    void testApprove_InvalidTransition() throws Exception {
        when(contractService.approveCompletion(pending.getId(), requester))
                .thenThrow(new InvalidTransitionException("Contract is PENDING"));

        mockMvc.perform(post("/api/contracts/{id}/approve", pending.getId())
                        .header(ContractController.USER_HEADER, requester.toString()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("Pairing confirmation passes the submitted code through")
    void testConfirmPairing() throws Exception {
        when(contractService.confirmPairing(pending.getId(), worker, "111222")).thenReturn(pending);

        mockMvc.perform(post("/api/contracts/{id}/pairing/confirm", pending.getId())
                        .header(ContractController.USER_HEADER, worker.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"111222\"}"))
                .andExpect(status().isOk());

        verify(contractService).confirmPairing(pending.getId(), worker, "111222");
    }

    @Test
    @DisplayName("Extension price is converted in the contract currency")
    void testRequestExtension_ConvertsPrice() throws Exception {
        when(contractService.getContract(pending.getId())).thenReturn(pending);
        when(contractService.requestExtension(eq(pending.getId()), eq(worker), eq(2), any())).thenReturn(pending);

        mockMvc.perform(post("/api/contracts/{id}/extensions", pending.getId())
                        .header(ContractController.USER_HEADER, worker.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"days\":2,\"new_price\":300.00}"))
                .andExpect(status().isOk());

        verify(contractService).requestExtension(pending.getId(), worker, 2, Money.of(30000, CurrencyCode.EUR));
    }

    @Test
    @DisplayName("Delete without a body uses the default reason")
    void testDelete_DefaultReason() throws Exception {
        Contract cancelled = pending.cancel("x", NOW).softDelete(requester, "Deleted by party", NOW);
        when(contractService.softDelete(pending.getId(), requester, "Deleted by party")).thenReturn(cancelled);

        mockMvc.perform(delete("/api/contracts/{id}", pending.getId())
                        .header(ContractController.USER_HEADER, requester.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }
}
