package com.newsroom.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final NewsroomCommand newsroomCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(NewsroomCommand newsroomCommand, IFactory factory) {
        this.newsroomCommand = newsroomCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        String[] commandArgs = commandArguments(args);
        exitCode = new CommandLine(newsroomCommand, factory).execute(commandArgs);
        log.debug("Command {} exited with {}", Arrays.toString(commandArgs), exitCode);
    }

    /**
     * Drops Spring property overrides such as {@code --newsroom.engine.max-concurrent-tasks=3};
     * Spring has already bound them and picocli would reject them as unknown options.
     */
    static String[] commandArguments(String... args) {
        return Arrays.stream(args)
                .filter(arg -> !isPropertyOverride(arg))
                .toArray(String[]::new);
    }

    private static boolean isPropertyOverride(String arg) {
        return arg.startsWith("--newsroom.") || arg.startsWith("--spring.") || arg.startsWith("--logging.");
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
