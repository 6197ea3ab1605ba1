package com.taskrelay.orchestrator.delegation;

/**
 * A cooperating agent that can run steps for us.
 *
 * @param agentId identity of the agent, recorded in delegate refs
 * @param baseUrl root of its agent inbox API
 */
public record Counterparty(String agentId, String baseUrl) {}
