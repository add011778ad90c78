package com.newsroom.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.newsroom.core.engine.UnroutableTaskException;
import com.newsroom.core.pipeline.PipelineService;
import com.newsroom.core.pipeline.RunSummary;
import com.newsroom.core.pipeline.StandardWorkflowTemplates;
import com.newsroom.core.pipeline.WorkflowTemplate;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: newsroom run &lt;template&gt; [-p key=value]...
 * <p>
 * Runs a standard workflow template to completion and prints the run summary.
 * Exits with 1 when the run does not finalize.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a workflow template")
@Component
public class RunCommand implements Callable<Integer> {

    private final PipelineService pipelineService;

    @Parameters(index = "0", description = "Template to run")
    String template;

    @Option(names = {"-p", "--param"}, description = "Run parameter as key=value")
    Map<String, String> params = new LinkedHashMap<>();

    @Option(names = "--json", description = "Print the run summary as JSON")
    boolean json;

    public RunCommand(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Override
    public Integer call() throws JsonProcessingException {
        Optional<WorkflowTemplate> found = StandardWorkflowTemplates.find(template);
        if (found.isEmpty()) {
            ConsoleOutput.error("Unknown template: " + template);
            return 1;
        }
        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Running " + template + " with " + found.get().stages().size() + " stage(s)");
        }

        RunSummary summary;
        try {
            summary = pipelineService.run(found.get(), new LinkedHashMap<String, Object>(params));
        } catch (UnroutableTaskException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (json) {
            var mapper = new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                    .enable(SerializationFeature.INDENT_OUTPUT);
            System.out.println(mapper.writeValueAsString(summary));
            return summary.success() ? 0 : 1;
        }

        summary.artifactCounts().forEach((stage, count) -> ConsoleOutput.info(stage + ": " + count + " artifact(s)"));
        summary.recoveries().forEach(recovery -> ConsoleOutput.warn("Recovered: " + recovery));
        summary.warnings().forEach(ConsoleOutput::warn);
        summary.errors().forEach(ConsoleOutput::error);

        System.out.println("──────────────────────────────────");
        String totals = String.format("%d/%d stages, %d task(s) completed, %d failed, $%.2f, %s",
                summary.stagesCompleted(), found.get().stages().size(), summary.tasksCompleted(),
                summary.tasksFailed(), summary.totalCost(), ConsoleOutput.formatDuration(summary.totalDuration()));
        if (summary.success()) {
            ConsoleOutput.success("Run " + summary.runId() + " finalized: " + totals);
            return 0;
        }
        ConsoleOutput.error("Run " + summary.runId() + " failed at stage " + summary.failedStage() + ": " + totals);
        return 1;
    }
}
