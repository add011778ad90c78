package com.newsroom.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for the newsroom orchestrator.
 * Routes to subcommands: health, templates, run.
 */
@Command(
        name = "newsroom",
        mixinStandardHelpOptions = true,
        version = "Newsroom Orchestrator 0.1.0",
        description = "Dependency-aware task orchestration for the newsroom content pipeline",
        subcommands = {
                HealthCommand.class,
                TemplatesCommand.class,
                RunCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class NewsroomCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // No subcommand given
        spec.commandLine().usage(System.out);
    }
}
