package com.govledger.controller;

import com.govledger.domain.LedgerState;
import com.govledger.dto.ApiResponses;
import com.govledger.dto.TransferAdministratorRequest;
import com.govledger.security.AuthenticatedCaller;
import com.govledger.service.AccessControlService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for ledger-wide state: administrator and proposal count.
 *
 * GET    /governance                  → 200
 * POST   /governance/administrator    → 204 | 400 | 403
 */
@RestController
@RequestMapping("/governance")
@Tag(name = "Governance", description = "Administrator identity and ledger state")
public class GovernanceController {

    private final AccessControlService accessControlService;

    public GovernanceController(AccessControlService accessControlService) {
        this.accessControlService = accessControlService;
    }

    @GetMapping
    @Operation(summary = "Get ledger state", description = "Current administrator and proposal count")
    public ResponseEntity<ApiResponses.GovernanceStateResponse> getState() {
        LedgerState state = accessControlService.readState();
        return ResponseEntity.ok(new ApiResponses.GovernanceStateResponse(
                state.getAdministrator(), state.getProposalCount()));
    }

    @PostMapping("/administrator")
    @Operation(summary = "Transfer administrator",
               description = "Current administrator hands its rights to another address; takes effect immediately")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "204", description = "Administrator replaced"),
        @ApiResponse(responseCode = "400", description = "Empty target address"),
        @ApiResponse(responseCode = "403", description = "Caller is not the administrator")
    })
    public ResponseEntity<Void> transferAdministrator(
            @Valid @RequestBody TransferAdministratorRequest request,
            Authentication authentication) {
        accessControlService.transferAdministrator(
                request.getNewAdministrator(),
                AuthenticatedCaller.addressOf(authentication));
        return ResponseEntity.noContent().build();
    }
}
