package com.vivek.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Vivek.
 * Routes to subcommands: run, resume, status, history.
 */
@Command(
        name = "vivek",
        mixinStandardHelpOptions = true,
        version = "Vivek 0.1.0",
        description = "Plans a request into file-scoped work items and generates each one with a review loop",
        subcommands = {
                RunCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class VivekCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
