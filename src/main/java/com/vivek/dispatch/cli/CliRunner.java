package com.vivek.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code vivek} command line once the Spring context is up and hands the command's
 * exit code back to {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * An exception that escapes a command is reported on one line and mapped to
 * {@link ExitCodes#ABORTED}; picocli usage errors keep picocli's own exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final VivekCommand rootCommand;
    private final IFactory factory;
    private int exitCode = ExitCodes.OK;

    public CliRunner(VivekCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        var commandLine = new CommandLine(rootCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    ConsoleOutput.error(cmd.getCommandName() + " failed: " + ConsoleOutput.rootCauseMessage(ex));
                    return ExitCodes.ABORTED;
                });
        exitCode = commandLine.execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
