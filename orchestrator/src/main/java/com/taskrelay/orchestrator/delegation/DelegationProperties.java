package com.taskrelay.orchestrator.delegation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings for handing steps to counterparty agents ({@code taskrelay.delegation.*}).
 *
 * @param callerIdentity  how this agent identifies itself to counterparties
 * @param callbackBaseUrl externally reachable root of this service; counterparties
 *                        post results to {@code {callbackBaseUrl}/subtasks/{remote_id}/result}
 * @param timeout         how long a delegated step may stay unresolved
 * @param text2speech     counterparty for the delegated text2speech step; when absent
 *                        the {@code text2speech-delegated} intent cannot be resolved
 */
@ConfigurationProperties(prefix = "taskrelay.delegation")
public record DelegationProperties(
        @DefaultValue("taskrelay-agent")       String        callerIdentity,
        @DefaultValue("http://localhost:8080") String        callbackBaseUrl,
        @DefaultValue("10m")                   Duration      timeout,
        CounterpartyConfig                                   text2speech) {

    public record CounterpartyConfig(String agentId, String baseUrl) {

        public Counterparty toCounterparty() {
            return new Counterparty(agentId, baseUrl);
        }
    }

    /** Base URL counterparties append {@code /{remote_id}/result} to. */
    public String callbackUrl() {
        return callbackBaseUrl + "/subtasks";
    }
}
