package dev.providers.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.providers.backend.Provider;
import dev.providers.backend.ProviderFactory;
import dev.providers.backend.ProviderRegistry;
import dev.providers.engine.ProviderLoader;
import dev.providers.error.ConfigValidationException;
import dev.providers.error.ProviderException;
import dev.providers.model.ProviderResult;
import dev.providers.model.RunOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * CLI entry point: run one prompt through a configured provider and print the result as JSON.
 */
@Command(
    name = "agent-providers",
    mixinStandardHelpOptions = true,
    description = "Run a coding-assistance prompt through a local CLI tool, a chat-completion API, or a devserver."
)
public class AgentProvidersCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AgentProvidersCli.class);
    private static final ObjectWriter JSON = new ObjectMapper().writerWithDefaultPrettyPrinter();

    static final int EXIT_RUNTIME_ERROR = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Parameters(index = "0", arity = "0..1", description = "Prompt to send")
    private String prompt;

    @Option(names = "--config", defaultValue = "providers.json",
        description = "Providers config file (default: ${DEFAULT-VALUE})")
    private Path config;

    @Option(names = "--provider", description = "Name of the provider to run")
    private String provider;

    @Option(names = "--list", description = "List configured providers")
    private boolean list;

    @Option(names = "--schema", description = "JSON schema file for structured output")
    private Path schema;

    @Option(names = "--sandbox", description = "Sandbox mode passed through to local tools")
    private String sandbox;

    @Option(names = "--cwd", description = "Working directory for local tools")
    private Path cwd;

    @Option(names = "--timeout-ms", description = "Per-call timeout in milliseconds")
    private Long timeoutMs;

    @Option(names = "--verbose", description = "Log attempts, polls and process lifecycle")
    private boolean verbose;

    private final ProviderFactory factory;
    private final PrintStream out;
    private final PrintStream err;

    public AgentProvidersCli() {
        this(new ProviderFactory(), System.out, System.err);
    }

    AgentProvidersCli(ProviderFactory factory, PrintStream out, PrintStream err) {
        this.factory = factory;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (verbose) {
            var logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.providers");
            logger.setLevel(Level.DEBUG);
        }

        ProviderRegistry registry;
        try {
            registry = ProviderRegistry.of(ProviderLoader.loadFromFile(config).values(), factory);
        } catch (ConfigValidationException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            err.println("Error: cannot read config " + config + ": " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        if (list) {
            out.println("Configured providers:");
            for (Provider p : registry.all()) {
                out.printf("  %-16s %-10s %s%n", p.name(), p.kind(), p.descriptor().capabilities());
            }
            return 0;
        }

        if (provider == null || prompt == null) {
            err.println("Error: --provider and a prompt are required. Use --list to see available providers.");
            return EXIT_CONFIG_ERROR;
        }

        try {
            RunOptions options = buildOptions();
            ProviderResult result = registry.require(provider).run(prompt, options);
            out.println(JSON.writeValueAsString(result));
            return result.exitCode();
        } catch (ConfigValidationException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (ProviderException | CancellationException e) {
            log.debug("Run failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_RUNTIME_ERROR;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_RUNTIME_ERROR;
        }
    }

    private RunOptions buildOptions() {
        RunOptions options = RunOptions.defaults();
        if (schema != null) {
            JsonNode schemaNode;
            try {
                schemaNode = new ObjectMapper().readTree(Files.readString(schema));
            } catch (IOException e) {
                throw new ConfigValidationException("cannot read schema " + schema + ": " + e.getMessage(), e);
            }
            options = options.withOutputSchema(schemaNode);
        }
        if (sandbox != null) {
            options = options.withSandbox(sandbox);
        }
        if (cwd != null) {
            options = options.withCwd(cwd);
        }
        if (timeoutMs != null) {
            options = options.withTimeoutMs(timeoutMs);
        }
        return options;
    }
}
