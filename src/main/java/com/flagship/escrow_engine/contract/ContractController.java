package com.flagship.escrow_engine.contract;

import com.flagship.escrow_engine.contract.dto.ConfirmPairingRequest;
import com.flagship.escrow_engine.contract.dto.ContractResponse;
import com.flagship.escrow_engine.contract.dto.CreateContractRequest;
import com.flagship.escrow_engine.contract.dto.ExtensionDecisionRequest;
import com.flagship.escrow_engine.contract.dto.ExtensionRequest;
import com.flagship.escrow_engine.contract.dto.ReasonRequest;
import com.flagship.escrow_engine.contract.dto.ResolveDisputeRequest;
import com.flagship.escrow_engine.exception.ValidationException;
import com.flagship.escrow_engine.money.CurrencyCode;
import com.flagship.escrow_engine.money.Money;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Contract lifecycle endpoints. The acting member comes from the X-User-Id
 * header set by the authenticating gateway in front of this service.
 */
@RestController
@RequestMapping("/api/contracts")
@RequiredArgsConstructor
@Slf4j
public class ContractController {

    static final String USER_HEADER = "X-User-Id";

    private final ContractService contractService;

    @PostMapping
    public ResponseEntity<ContractResponse> createContract(
            @Valid @RequestBody CreateContractRequest request,
            @RequestHeader(USER_HEADER) UUID actor) {
        Money basePrice = Money.ofMajor(request.getAmount(), parseCurrency(request.getCurrency()));
        Contract contract = contractService.createContract(CreateContractCommand.builder()
            .requesterId(actor)
            .workerId(request.getWorkerId())
            .title(request.getTitle())
            .basePrice(basePrice)
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .escrowEnabled(request.getEscrowEnabled() == null || request.getEscrowEnabled())
            .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(ContractResponse.from(contract));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContractResponse> getContract(@PathVariable("id") UUID id,
                                                        @RequestHeader(USER_HEADER) UUID actor) {
        Contract contract = contractService.getContract(id);
        contract.partyOf(actor);
        return ResponseEntity.ok(ContractResponse.from(contract));
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<ContractResponse> submit(@PathVariable("id") UUID id,
                                                   @RequestHeader(USER_HEADER) UUID actor) {
        return ResponseEntity.ok(ContractResponse.from(contractService.submit(id, actor)));
    }

    @PostMapping("/{id}/pairing-code")
    public ResponseEntity<ContractResponse> regeneratePairingCode(@PathVariable("id") UUID id,
                                                                  @RequestHeader(USER_HEADER) UUID actor) {
        return ResponseEntity.ok(ContractResponse.from(contractService.regeneratePairingCode(id, actor)));
    }

    @PostMapping("/{id}/pairing/confirm")
    public ResponseEntity<ContractResponse> confirmPairing(@PathVariable("id") UUID id,
                                                           @RequestHeader(USER_HEADER) UUID actor,
                                                           @Valid @RequestBody ConfirmPairingRequest request) {
        return ResponseEntity.ok(ContractResponse.from(contractService.confirmPairing(id, actor, request.getCode())));
    }

    @PostMapping("/{id}/sign-off")
    public ResponseEntity<ContractResponse> signOff(@PathVariable("id") UUID id,
                                                    @RequestHeader(USER_HEADER) UUID actor) {
        return ResponseEntity.ok(ContractResponse.from(contractService.signOff(id, actor)));
    }

    @PostMapping("/{id}/work-complete")
    public ResponseEntity<ContractResponse> markWorkComplete(@PathVariable("id") UUID id,
                                                             @RequestHeader(USER_HEADER) UUID actor) {
        return ResponseEntity.ok(ContractResponse.from(contractService.markWorkComplete(id, actor)));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<ContractResponse> approve(@PathVariable("id") UUID id,
                                                    @RequestHeader(USER_HEADER) UUID actor) {
        return ResponseEntity.ok(ContractResponse.from(contractService.approveCompletion(id, actor)));
    }

    @PostMapping("/{id}/dispute")
    public ResponseEntity<ContractResponse> openDispute(@PathVariable("id") UUID id,
                                                        @RequestHeader(USER_HEADER) UUID actor,
                                                        @Valid @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(ContractResponse.from(contractService.openDispute(id, actor, request.getReason())));
    }

    @PostMapping("/{id}/dispute/resolve")
    public ResponseEntity<ContractResponse> resolveDispute(@PathVariable("id") UUID id,
                                                           @RequestHeader(USER_HEADER) UUID actor,
                                                           @Valid @RequestBody ResolveDisputeRequest request) {
        log.info("Dispute resolution requested: contractId={}, resolution={}, by={}", id, request.getResolution(), actor);
        return ResponseEntity.ok(ContractResponse.from(
            contractService.resolveDispute(id, actor, request.getResolution(), request.getNote())));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ContractResponse> cancel(@PathVariable("id") UUID id,
                                                   @RequestHeader(USER_HEADER) UUID actor,
                                                   @Valid @RequestBody(required = false) ReasonRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(ContractResponse.from(contractService.cancel(id, actor, reason)));
    }

    @PostMapping("/{id}/extensions")
    public ResponseEntity<ContractResponse> requestExtension(@PathVariable("id") UUID id,
                                                             @RequestHeader(USER_HEADER) UUID actor,
                                                             @Valid @RequestBody ExtensionRequest request) {
        Money newPrice = null;
        if (request.getNewPrice() != null) {
            newPrice = Money.ofMajor(request.getNewPrice(), contractService.getContract(id).getCurrency());
        }
        return ResponseEntity.ok(ContractResponse.from(
            contractService.requestExtension(id, actor, request.getDays(), newPrice)));
    }

    @PostMapping("/{id}/extensions/response")
    public ResponseEntity<ContractResponse> respondToExtension(@PathVariable("id") UUID id,
                                                               @RequestHeader(USER_HEADER) UUID actor,
                                                               @Valid @RequestBody ExtensionDecisionRequest request) {
        return ResponseEntity.ok(ContractResponse.from(
            contractService.respondToExtension(id, actor, request.getAccept())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ContractResponse> delete(@PathVariable("id") UUID id,
                                                   @RequestHeader(USER_HEADER) UUID actor,
                                                   @Valid @RequestBody(required = false) ReasonRequest request) {
        String reason = request != null && request.getReason() != null ? request.getReason() : "Deleted by party";
        return ResponseEntity.ok(ContractResponse.from(contractService.softDelete(id, actor, reason)));
    }

    static CurrencyCode parseCurrency(String currency) {
        try {
            return CurrencyCode.valueOf(currency.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid currency code: " + currency);
        }
    }
}
