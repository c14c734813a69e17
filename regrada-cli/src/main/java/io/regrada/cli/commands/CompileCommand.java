package io.regrada.cli.commands;

import io.regrada.cli.compile.HttpCompileService;
import io.regrada.cli.config.CompileServiceConfig;
import io.regrada.core.Regrada;
import io.regrada.core.compile.CompileOutcome;
import io.regrada.core.compile.CompileService;
import io.regrada.core.compile.CompileServiceException;
import io.regrada.core.compile.Diagnostic;
import io.regrada.core.graph.Graph;
import io.regrada.core.projection.ProjectionImporter;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.ConfigProvider;
import picocli.CommandLine;

/// Submits a choreography to the compile service and prints the result.
///
/// Each returned projection is imported as a graph and printed in source form
/// under its role label. A compile error prints its diagnostics with their
/// source ranges.
///
/// ### Settings
/// Options win over the `regrada.compile.*` configuration properties.
///
/// ### Usage
/// ```bash
/// regrada compile <source> [--url <url>] [--poll-attempts <n>] [--poll-interval-ms <ms>]
/// ```
///
/// @see CompileServiceConfig
@CommandLine.Command(name = "compile", description = "Type-check and project a choreography")
class CompileCommand extends SourceCommand {

    private static final Logger logger = Logger.getLogger(CompileCommand.class.getName());

    @CommandLine.Option(
            names = {"--url"},
            description = "Compile service base URL")
    private String url;

    @CommandLine.Option(
            names = {"--poll-attempts"},
            description = "Number of result polls before giving up")
    private Integer pollAttempts;

    @CommandLine.Option(
            names = {"--poll-interval-ms"},
            description = "Wait before each result poll, in milliseconds")
    private Long pollIntervalMs;

    @Override
    protected void execute() {
        String source;
        CompileServiceConfig config;
        try {
            source = readSource();
            parse(source);
            config = resolveConfig();
        } catch (Exception e) {
            System.err.println(" [FAIL] Compile failed: " + e.getMessage());
            return;
        }

        System.out.println("Compiling " + sourceFile + " with " + config.getUrl());
        try {
            CompileOutcome outcome = createCompileService(config).compile(source);
            if (outcome instanceof CompileOutcome.Completed completed) {
                printProjections(ProjectionImporter.importAll(completed.projections()));
            } else if (outcome instanceof CompileOutcome.Failed failed) {
                System.err.println(" [FAIL] Compile error:");
                for (Diagnostic diagnostic : failed.error().diagnostics()) {
                    System.err.println("   " + diagnostic);
                }
            } else {
                CompileOutcome.Pending pending = (CompileOutcome.Pending) outcome;
                System.err.println(" [WARN] No result after " + pending.attempts() + " poll(s); try again later");
            }
        } catch (CompileServiceException e) {
            logger.log(Level.SEVERE, "Compile service request failed", e);
            System.err.println(" [FAIL] " + e.getMessage());
        }
    }

    /// Merges the options over the configured settings.
    ///
    /// @return effective settings, never null
    protected CompileServiceConfig resolveConfig() {
        CompileServiceConfig.Builder builder = CompileServiceConfig.from(ConfigProvider.getConfig()).toBuilder();
        if (url != null && !url.isBlank()) {
            builder.url(url);
        }
        if (pollAttempts != null) {
            builder.pollAttempts(pollAttempts);
        }
        if (pollIntervalMs != null) {
            builder.pollIntervalMs(pollIntervalMs);
        }
        return builder.build();
    }

    /// Creates the client used for one compilation.
    protected CompileService createCompileService(CompileServiceConfig config) {
        return new HttpCompileService(config);
    }

    private void printProjections(Map<String, Graph> graphs) {
        System.out.println(" [OK] " + graphs.size() + " projection(s)");
        graphs.forEach((role, graph) -> {
            System.out.println();
            System.out.println("== " + role + " ==");
            System.out.println(Regrada.serialize(graph));
        });
    }
}
