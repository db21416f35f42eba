package com.apod.pipeline.etl.versioning;

import com.apod.pipeline.etl.model.CommandResult;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Answers commands from a script keyed on the arguments after the executable.
 */
class ScriptedCommandRunner extends CommandRunner {
    private final Function<String, CommandResult> script;
    private final List<String> executed = new ArrayList<>();

    ScriptedCommandRunner(Function<String, CommandResult> script) {
        this.script = script;
    }

    @Override
    public CommandResult run(Path workDir, Duration timeout, Map<String, String> env, List<String> command) {
        String args = String.join(" ", command.subList(1, command.size()));
        executed.add(args);
        CommandResult result = script.apply(args);
        return result == null ? ok("") : result;
    }

    List<String> executed() {
        return executed;
    }

    static CommandResult ok(String stdout) {
        return new CommandResult(List.of(), 0, stdout, "", Duration.ZERO, null, null);
    }

    static CommandResult exit(int code, String stderr) {
        return new CommandResult(List.of(), code, "", stderr, Duration.ZERO, null, null);
    }

    static CommandResult error(String errorCode, String message) {
        return new CommandResult(List.of(), -1, "", "", Duration.ZERO, errorCode, message);
    }
}
