package com.newsroom.core.pipeline;

import com.newsroom.core.model.TaskPriority;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in workflows of the newsroom.
 */
public final class StandardWorkflowTemplates {

    public static final String DAILY_NEWS_PROCESSING = "daily-news-processing";
    public static final String BREAKING_NEWS_ALERT = "breaking-news-alert";
    public static final String WEEKLY_MAINTENANCE = "weekly-maintenance";

    private static final Map<String, WorkflowTemplate> TEMPLATES = new LinkedHashMap<>();

    static {
        register(dailyNewsProcessing());
        register(breakingNewsAlert());
        register(weeklyMaintenance());
    }

    private StandardWorkflowTemplates() {}

    private static void register(WorkflowTemplate template) {
        TEMPLATES.put(template.name(), template);
    }

    public static List<WorkflowTemplate> all() {
        return List.copyOf(TEMPLATES.values());
    }

    public static Optional<WorkflowTemplate> find(String name) {
        return Optional.ofNullable(TEMPLATES.get(name));
    }

    static WorkflowTemplate dailyNewsProcessing() {
        return new WorkflowTemplate(DAILY_NEWS_PROCESSING,
                "Complete daily news discovery, analysis, and reporting",
                "1.0",
                List.of(
                        StageDescriptor.builder("discovery", "news_discovery")
                                .name("RSS Feed Discovery")
                                .priority(TaskPriority.HIGH)
                                .estimatedDuration(Duration.ofMinutes(10))
                                .estimatedCost(0.05)
                                .taskMaxRetries(2)
                                .dependsOnPrevious(false)
                                .parameters(Map.of("max_articles", 150))
                                .gate(QualityGates.minArtifacts(1))
                                .build(),
                        StageDescriptor.builder("analysis", "content_analysis")
                                .name("Content Analysis Batch")
                                .priority(TaskPriority.HIGH)
                                .estimatedDuration(Duration.ofMinutes(30))
                                .estimatedCost(0.50)
                                .taskMaxRetries(1)
                                .parameters(Map.of("batch_size", 10))
                                .gate(QualityGates.allOf(
                                        QualityGates.minSuccessRate(0.8),
                                        QualityGates.minAverageScore("relevance_score", 0.6)))
                                .build(),
                        StageDescriptor.builder("report", "report_generation")
                                .name("Daily Report Generation")
                                .estimatedDuration(Duration.ofMinutes(5))
                                .estimatedCost(0.10)
                                .taskMaxRetries(1)
                                .parameters(Map.of("report_type", "daily"))
                                .gate(QualityGates.noHardErrors())
                                .build(),
                        StageDescriptor.builder("delivery", "email_delivery")
                                .name("Daily Report Delivery")
                                .estimatedDuration(Duration.ofMinutes(1))
                                .estimatedCost(0.0)
                                .taskMaxRetries(3)
                                .gate(QualityGates.noHardErrors())
                                .build()),
                Map.of("report_type", "daily"),
                List.of("daily", "scheduled"));
    }

    static WorkflowTemplate breakingNewsAlert() {
        return new WorkflowTemplate(BREAKING_NEWS_ALERT,
                "Immediate alert processing for breaking news",
                "1.0",
                List.of(
                        StageDescriptor.builder("evaluation", "alert_evaluation")
                                .name("Alert Evaluation")
                                .priority(TaskPriority.CRITICAL)
                                .estimatedDuration(Duration.ofSeconds(30))
                                .estimatedCost(0.02)
                                .retryDelay(Duration.ofSeconds(5))
                                .dependsOnPrevious(false)
                                .gate(QualityGates.noHardErrors())
                                .build(),
                        StageDescriptor.builder("delivery", "email_delivery")
                                .name("Alert Delivery")
                                .priority(TaskPriority.CRITICAL)
                                .estimatedDuration(Duration.ofSeconds(15))
                                .estimatedCost(0.0)
                                .taskMaxRetries(3)
                                .retryDelay(Duration.ofSeconds(5))
                                .gate(QualityGates.noHardErrors())
                                .build()),
                Map.of("report_type", "breaking"),
                List.of("alert", "urgent"));
    }

    static WorkflowTemplate weeklyMaintenance() {
        return new WorkflowTemplate(WEEKLY_MAINTENANCE,
                "Weekly cleanup and maintenance tasks",
                "1.0",
                List.of(
                        StageDescriptor.builder("cleanup", "data_cleanup")
                                .name("Database Cleanup")
                                .priority(TaskPriority.LOW)
                                .estimatedDuration(Duration.ofMinutes(30))
                                .dependsOnPrevious(false)
                                .gate(QualityGates.always())
                                .build(),
                        StageDescriptor.builder("cost-analysis", "cost_analysis")
                                .name("Weekly Cost Analysis")
                                .priority(TaskPriority.LOW)
                                .estimatedDuration(Duration.ofMinutes(5))
                                .gate(QualityGates.noHardErrors())
                                .build(),
                        StageDescriptor.builder("health-check", "health_check")
                                .name("System Health Assessment")
                                .estimatedDuration(Duration.ofMinutes(10))
                                .dependsOnPrevious(false)
                                .gate(QualityGates.noHardErrors())
                                .build()),
                Map.of(),
                List.of("maintenance", "weekly"));
    }
}
