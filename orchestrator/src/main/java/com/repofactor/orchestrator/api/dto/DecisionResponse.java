package com.repofactor.orchestrator.api.dto;

/** Response body for POST /runs/decide. */
public record DecisionResponse(String stage, int retryCount, String action) {}
