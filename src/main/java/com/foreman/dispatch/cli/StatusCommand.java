package com.foreman.dispatch.cli;

import com.foreman.core.service.ModuleStats;
import com.foreman.core.service.ProjectStatus;
import com.foreman.core.service.StatusService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: foreman status
 * <p>
 * Overall and per-module progress plus the session phase and current task.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show project progress")
@Component
public class StatusCommand implements Callable<Integer> {

    private final StatusService statusService;

    public StatusCommand(StatusService statusService) {
        this.statusService = statusService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ProjectStatus status = statusService.getProjectStatus();

        System.out.println("Phase:        " + status.currentPhase());
        System.out.println("Current task: " + (status.currentTask() != null ? status.currentTask() : "-"));
        if (status.startedAt() != null) {
            System.out.println("Started:      " + status.startedAt());
            System.out.println("Updated:      " + status.updatedAt());
        }

        if (!status.hasActiveTasks()) {
            System.out.println();
            ConsoleOutput.info("No tasks yet. Run: foreman tasks create");
            return ExitCodes.SUCCESS;
        }

        System.out.println();
        ConsoleOutput.progress("overall", status.overall());
        for (ModuleStats module : status.byModule()) {
            ConsoleOutput.progress(module.module(), module.progress());
        }
        return ExitCodes.SUCCESS;
    }
}
