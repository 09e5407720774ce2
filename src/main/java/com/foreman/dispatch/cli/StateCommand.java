package com.foreman.dispatch.cli;

import com.foreman.core.model.Phase;
import com.foreman.core.model.SessionState;
import com.foreman.core.service.ArchiveResult;
import com.foreman.core.service.StateService;
import com.foreman.core.service.StateUpdate;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * CLI command: foreman state show|init|phase|clear|archive
 */
@Command(name = "state", mixinStandardHelpOptions = true, description = "Inspect and change the session state")
@Component
public class StateCommand {

    private final StateService stateService;

    public StateCommand(StateService stateService) {
        this.stateService = stateService;
    }

    @Command(name = "show", description = "Show the current session state")
    int show() {
        Optional<SessionState> state = stateService.getState();
        if (state.isEmpty()) {
            ConsoleOutput.info("No active session. Run: foreman state init");
            return ExitCodes.NOT_FOUND;
        }
        ConsoleOutput.state(state.get());
        return ExitCodes.SUCCESS;
    }

    @Command(name = "init", description = "Start a new session")
    int init(@Option(names = "--phase", defaultValue = "CLARIFY",
                     description = "Starting phase (default: ${DEFAULT-VALUE})") Phase phase) {
        boolean existed = stateService.exists();
        SessionState state = stateService.initializeState(phase);
        if (existed) {
            ConsoleOutput.warn("Session already exists in phase " + state.getPhase());
        } else {
            ConsoleOutput.success("Session started in phase " + state.getPhase());
        }
        return ExitCodes.SUCCESS;
    }

    @Command(name = "phase", description = "Move the session to another phase")
    int phase(@Parameters(index = "0", description = "Target phase") Phase target) {
        SessionState state = stateService.updateState(StateUpdate.phase(target));
        ConsoleOutput.success("Phase: " + state.getPhase());
        return ExitCodes.SUCCESS;
    }

    @Command(name = "clear", description = "Delete the session state")
    int clear() {
        stateService.clearState();
        ConsoleOutput.success("Session state cleared");
        return ExitCodes.SUCCESS;
    }

    @Command(name = "archive", description = "Move the finished session into the archive")
    int archive(@Option(names = "--force", description = "Archive even if the session is not complete") boolean force) {
        ArchiveResult result = stateService.archiveSession(force);
        if (result.blocked()) {
            ConsoleOutput.error(result.blockedReason());
            return ExitCodes.INVALID_STATE;
        }
        if (!result.archived()) {
            ConsoleOutput.info("Nothing to archive");
            return ExitCodes.SUCCESS;
        }
        ConsoleOutput.success("Archived " + String.join(", ", result.files()) + " to " + result.archivePath());
        return ExitCodes.SUCCESS;
    }
}
