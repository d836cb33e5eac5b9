package org.buildlens.cli.commands;

import com.typesafe.config.ConfigException;
import org.buildlens.bsp.client.JsonRpcBuildClient;
import org.buildlens.bsp.client.LoggingBuildClient;
import org.buildlens.bsp.client.NotificationDeliveryException;
import org.buildlens.bsp.protocol.BuildClient;
import org.buildlens.bsp.protocol.StatusCode;
import org.buildlens.cli.CommandLineInterface;
import org.buildlens.cli.config.ClientOptions;
import org.buildlens.replay.ReplayException;
import org.buildlens.replay.ReplayRunner;
import org.buildlens.replay.ReplayScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Replays a recorded compilation and emits the resulting notifications.
 * <p>
 * Exit codes: 0 if the task finished OK, 1 if it finished with errors, 2 if the script
 * or the options are invalid or the notifications could not be written.
 */
@Command(name = "replay",
        mixinStandardHelpOptions = true,
        description = "Replays a recorded compilation (JSON script) as build server notifications.")
public class ReplayCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplayCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERRORS = 1;
    static final int EXIT_INVALID_INPUT = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The replay script.")
    private File script;

    @Option(names = {"-f", "--format"}, description = "Output format: JSON or LOG (overrides buildlens.client.format).")
    private String format;

    @Option(names = "--pretty", description = "Indent JSON output.")
    private boolean pretty;

    @Option(names = {"-o", "--output"}, description = "Write notifications to this file instead of stdout.")
    private File output;

    @Override
    public Integer call() {
        ClientOptions options;
        try {
            options = resolveOptions();
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        if (!script.isFile()) {
            log.error("Replay script not found: {}", script.getAbsolutePath());
            return EXIT_INVALID_INPUT;
        }
        Path scriptPath = script.toPath().toAbsolutePath();

        ReplayRunner runner = new ReplayRunner();
        try {
            ReplayScript replayScript = runner.read(scriptPath);
            StatusCode status;
            if (output != null) {
                try (Writer writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
                    status = runner.replay(replayScript, scriptPath.getParent(), createClient(options, writer),
                            options.displayName());
                }
            } else {
                PrintWriter out = spec.commandLine().getOut();
                status = runner.replay(replayScript, scriptPath.getParent(), createClient(options, out),
                        options.displayName());
                out.flush();
                // PrintWriter swallows write failures
                if (out.checkError()) {
                    log.error("Failed to write notifications to stdout");
                    return EXIT_INVALID_INPUT;
                }
            }
            return status == StatusCode.OK ? EXIT_OK : EXIT_COMPILE_ERRORS;
        } catch (ReplayException e) {
            log.error("Replay failed: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (IOException e) {
            log.error("Failed to write notifications to {}: {}", output, e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (NotificationDeliveryException e) {
            log.error("Failed to deliver notifications: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        }
    }

    private ClientOptions resolveOptions() {
        ClientOptions options = ClientOptions.fromConfig(parent.getConfig());
        if (format != null) {
            options = options.withFormat(ClientOptions.Format.parse(format));
        }
        if (pretty) {
            options = options.withPrettyPrint(true);
        }
        return options;
    }

    private static BuildClient createClient(ClientOptions options, Writer writer) {
        return switch (options.format()) {
            case JSON -> new JsonRpcBuildClient(writer, options.prettyPrint());
            case LOG -> new LoggingBuildClient();
        };
    }
}
