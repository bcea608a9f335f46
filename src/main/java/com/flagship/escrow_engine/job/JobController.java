package com.flagship.escrow_engine.job;

import com.flagship.escrow_engine.contract.Contract;
import com.flagship.escrow_engine.contract.ContractService;
import com.flagship.escrow_engine.contract.dto.ContractResponse;
import com.flagship.escrow_engine.job.dto.ReallocateRequest;
import com.flagship.escrow_engine.job.dto.SelectWorkersRequest;
import com.flagship.escrow_engine.job.dto.WorkerAllocationRequest;
import com.flagship.escrow_engine.money.Money;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class JobController {

    private static final String USER_HEADER = "X-User-Id";

    private final WorkerAllocationService allocationService;
    private final ContractService contractService;

    @PostMapping("/api/jobs/{id}/workers")
    public ResponseEntity<List<ContractResponse>> selectWorkers(@PathVariable("id") UUID jobId,
                                                                @RequestHeader(USER_HEADER) UUID actor,
                                                                @Valid @RequestBody SelectWorkersRequest request) {
        List<WorkerAllocation> allocations = request.getWorkers().stream()
            .map(JobController::toAllocation)
            .toList();
        List<Contract> created = allocationService.selectWorkers(jobId, actor, allocations);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(created.stream().map(ContractResponse::from).toList());
    }

    @PostMapping("/api/contracts/{id}/allocation")
    public ResponseEntity<ContractResponse> reallocate(@PathVariable("id") UUID contractId,
                                                       @RequestHeader(USER_HEADER) UUID actor,
                                                       @Valid @RequestBody ReallocateRequest request) {
        Money amount = Money.ofMajor(request.getAmount(), contractService.getContract(contractId).getCurrency());
        return ResponseEntity.ok(ContractResponse.from(allocationService.reallocate(contractId, actor, amount)));
    }

    private static WorkerAllocation toAllocation(WorkerAllocationRequest item) {
        return WorkerAllocation.builder()
            .workerId(item.getWorkerId())
            .amount(item.getAmount())
            .percentage(item.getPercentage())
            .escrowEnabled(item.getEscrowEnabled() == null || item.getEscrowEnabled())
            .startDate(item.getStartDate())
            .endDate(item.getEndDate())
            .build();
    }
}
