package com.taskrunner.dispatch.cli;

import com.taskrunner.core.model.Node;
import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the taskrunner CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKRUNNER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKRUNNER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void taskStatus(TaskStatus status) {
        String label = "Status: " + status.wireName();
        switch (status) {
            case COMPLETED -> success(label);
            case FAILED, CANCELLED -> error(label);
            default -> info(label);
        }
    }

    public static void taskHeader() {
        System.out.printf("  %-36s %-12s %-20s %s%n", "TASK", "STATUS", "STEP", "TITLE");
        System.out.println("  " + "-".repeat(90));
    }

    public static void taskRow(Task task) {
        System.out.printf("  %-36s %-12s %-20s %s%n", task.id(), task.status().wireName(),
                task.executionStep().wireName(), truncate(task.title(), 30));
    }

    public static void nodeHeader() {
        System.out.printf("  %-36s %-12s %-8s %-8s %-10s %s%n", "NODE", "STATUS", "SIZE", "LOC", "HEALTH", "LOAD");
        System.out.println("  " + "-".repeat(90));
    }

    public static void nodeRow(Node node) {
        String load = node.hasMetrics()
                ? String.format("cpu %.0f%% mem %.0f%%", node.cpuPercent(), node.memoryPercent())
                : "-";
        System.out.printf("  %-36s %-12s %-8s %-8s %-10s %s%n", node.id(), node.status().wireName(),
                node.size() == null ? "-" : node.size().wireName(), node.location(), node.health().wireName(), load);
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
