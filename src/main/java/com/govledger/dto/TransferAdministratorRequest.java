package com.govledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class TransferAdministratorRequest {

    @NotBlank(message = "New administrator address is required")
    @Size(max = 128, message = "New administrator address must be at most 128 characters")
    private String newAdministrator;

    public TransferAdministratorRequest() {
    }

    public TransferAdministratorRequest(String newAdministrator) {
        this.newAdministrator = newAdministrator;
    }

    public String getNewAdministrator() {
        return newAdministrator;
    }

    public void setNewAdministrator(String newAdministrator) {
        this.newAdministrator = newAdministrator;
    }
}
