package com.newsroom.dispatch.cli;

import com.newsroom.core.engine.RoutingTable;
import com.newsroom.core.pipeline.StandardWorkflowTemplates;
import com.newsroom.core.pipeline.WorkflowTemplate;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: newsroom templates [name]
 * <p>
 * Lists the built-in workflow templates, or the stages of one template, and flags stages whose
 * task type has no registered handler.
 */
@Command(name = "templates", mixinStandardHelpOptions = true, description = "List workflow templates")
@Component
public class TemplatesCommand implements Runnable {

    private final RoutingTable routingTable;

    @Parameters(index = "0", arity = "0..1", description = "Template to describe")
    String name;

    public TemplatesCommand(RoutingTable routingTable) {
        this.routingTable = routingTable;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (name != null) {
            StandardWorkflowTemplates.find(name).ifPresentOrElse(
                    this::describe,
                    () -> ConsoleOutput.error("Unknown template: " + name));
            return;
        }
        for (WorkflowTemplate template : StandardWorkflowTemplates.all()) {
            ConsoleOutput.info(String.format("%s (v%s): %s [%d stages, ~%s, ~$%.2f]",
                    template.name(), template.version(), template.description(), template.stages().size(),
                    ConsoleOutput.formatDuration(template.estimatedTotalDuration()), template.estimatedTotalCost()));
        }
    }

    private void describe(WorkflowTemplate template) {
        ConsoleOutput.info(template.name() + ": " + template.description());
        int index = 1;
        for (var stage : template.stages()) {
            String routing = routingTable.canRoute(stage.taskType()) ? "" : " (no handler)";
            ConsoleOutput.stage(index++, stage.stageId(), stage.taskType(),
                    stage.name() + ", " + stage.priority() + ", ~"
                            + ConsoleOutput.formatDuration(stage.estimatedDuration()) + routing);
        }
    }
}
