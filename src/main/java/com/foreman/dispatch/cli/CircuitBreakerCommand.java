package com.foreman.dispatch.cli;

import com.foreman.core.healing.HealingService;
import com.foreman.core.healing.HealingStats;
import com.foreman.core.resilience.CircuitState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: foreman circuit-breaker
 * <p>
 * Breaker state is held in memory, so a fresh process always reports CLOSED with
 * no attempts; the audit trail of earlier runs is in circuit-breaker.log.
 */
@Command(name = "circuit-breaker", aliases = "cb", mixinStandardHelpOptions = true,
        description = "Show the healing circuit breaker")
@Component
public class CircuitBreakerCommand implements Callable<Integer> {

    private final HealingService healingService;

    public CircuitBreakerCommand(HealingService healingService) {
        this.healingService = healingService;
    }

    @Override
    public Integer call() {
        HealingStats stats = healingService.getHealingStats();
        System.out.println("State:            " + stats.currentCircuitState());
        System.out.println("Healing attempts: " + stats.totalAttempts()
                + " (" + stats.successfulAttempts() + " ok, " + stats.failedAttempts() + " failed)");
        System.out.println("Times opened:     " + stats.circuitOpenCount());
        if (stats.currentCircuitState() == CircuitState.OPEN) {
            ConsoleOutput.warn("Circuit is OPEN: healing attempts are rejected until the cool-down ends");
        }
        return ExitCodes.SUCCESS;
    }
}
