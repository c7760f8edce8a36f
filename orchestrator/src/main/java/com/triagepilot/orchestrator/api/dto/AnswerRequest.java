package com.triagepilot.orchestrator.api.dto;

/**
 * Request body for POST /interviews/{id}/answer.
 */
public record AnswerRequest(String message) {}
