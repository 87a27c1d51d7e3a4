package com.taskrunner.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: taskrunner serve
 * <p>
 * Starts the long-running server: REST API, alarm poller and sweepers. The web server is
 * enabled by {@link com.taskrunner.TaskRunnerApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli so the embedded server keeps the JVM alive.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the taskrunner HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached through --help style invocations
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("taskrunner server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Metrics:    http://localhost:" + port + "/actuator/prometheus");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
