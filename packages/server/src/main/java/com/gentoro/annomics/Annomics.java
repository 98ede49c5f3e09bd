package com.gentoro.annomics;

import com.gentoro.annomics.classify.ResultClassifier;
import com.gentoro.annomics.exception.EnvironmentException;
import com.gentoro.annomics.exception.ExceptionUtil;
import com.gentoro.annomics.exception.StateException;
import com.gentoro.annomics.job.JobSpec;
import com.gentoro.annomics.job.JobSpecBuilder;
import com.gentoro.annomics.logging.LoggingService;
import com.gentoro.annomics.mcp.McpProtocolHandler;
import com.gentoro.annomics.mcp.StdioTransport;
import com.gentoro.annomics.process.ExternalProcessSupervisor;
import com.gentoro.annomics.process.ProcessLauncher;
import com.gentoro.annomics.process.ProcessOutcome;
import com.gentoro.annomics.process.ProcessSupervisor;
import com.gentoro.annomics.process.RuntimeEnvironment;
import com.gentoro.annomics.process.RuntimeSettings;
import com.gentoro.annomics.tools.AnnotateGenomicRegionsTool;
import com.gentoro.annomics.tools.GetAnnotationSummaryTool;
import com.gentoro.annomics.tools.ListSupportedGenomesTool;
import com.gentoro.annomics.tools.ToolRegistry;
import com.gentoro.annomics.tools.ValidateBedFormatTool;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires configuration, the R runtime, the tool registry and the stdio transport together.
 *
 * <p>If the R runtime cannot be verified at startup the application either fails ({@code
 * annomics.runtime.require-environment: true}) or starts degraded, answering every tool call with
 * the startup error.
 */
public class Annomics {

  private static final org.slf4j.Logger log = LoggingService.getLogger(Annomics.class);

  private final StartupParameters startupParameters;
  private final ProcessLauncher launcher;
  private ConfigurationProvider configurationProvider;
  private ProcessSupervisor supervisor;
  private ToolRegistry registry;
  private McpProtocolHandler protocolHandler;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public Annomics(String[] applicationArgs) {
    this(applicationArgs, ProcessLauncher.system());
  }

  Annomics(String[] applicationArgs, ProcessLauncher launcher) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.launcher = launcher;
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider =
        new ConfigurationProvider(startupParameters.configFile(), startupParameters.overrides());
    LoggingService.applyConfiguration(configuration());

    EnvironmentException environmentFailure = null;
    try {
      RuntimeSettings settings = RuntimeSettings.fromConfiguration(configuration());
      this.supervisor = new ExternalProcessSupervisor(settings, launcher);
      RuntimeEnvironment.verify(settings, launcher);
    } catch (EnvironmentException e) {
      if (configuration().getBoolean("annomics.runtime.require-environment", true)) {
        shutdown();
        throw e;
      }
      log.warn("Starting in degraded mode, tool calls will fail: {}", e.getMessage());
      environmentFailure = e;
      if (supervisor == null) {
        supervisor = new UnavailableSupervisor(e);
      }
    }

    int defaultTimeout =
        configuration().getInt("annomics.job.default-timeout", JobSpec.DEFAULT_TIMEOUT_SECONDS);
    JobSpecBuilder jobSpecBuilder = new JobSpecBuilder(defaultTimeout);
    ResultClassifier classifier = new ResultClassifier();

    this.registry =
        new ToolRegistry()
            .register(new AnnotateGenomicRegionsTool(jobSpecBuilder, supervisor, classifier))
            .register(new ListSupportedGenomesTool())
            .register(new ValidateBedFormatTool())
            .register(new GetAnnotationSummaryTool(classifier))
            .freeze();
    this.protocolHandler = new McpProtocolHandler(registry, environmentFailure);
    log.info(
        "Annomics MCP server initialized with {} tools{}",
        registry.list().size(),
        environmentFailure == null ? "" : " (degraded)");
  }

  /** Serve on the process's stdin and stdout until stdin is closed. */
  public void serve() {
    serve(
        new InputStreamReader(System.in, StandardCharsets.UTF_8),
        new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
  }

  public void serve(Reader in, Writer out) {
    if (protocolHandler == null) {
      throw new StateException("Annomics has not been initialized");
    }
    try {
      new StdioTransport(in, out, protocolHandler).run();
    } finally {
      shutdown();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    if (supervisor != null) {
      try {
        supervisor.close();
      } catch (RuntimeException e) {
        log.warn(
            "Failed to stop process supervisor: {}", ExceptionUtil.toErrorDetails(e).message());
      }
    }
    log.info("Annomics MCP server stopped");
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Configuration has not been loaded yet");
    }
    return configurationProvider.config();
  }

  public ToolRegistry registry() {
    if (registry == null) {
      throw new StateException("Annomics has not been initialized");
    }
    return registry;
  }

  public boolean isDegraded() {
    return protocolHandler != null && protocolHandler.isDegraded();
  }

  /** Stand-in used when no annotation script could be located. */
  private static final class UnavailableSupervisor implements ProcessSupervisor {
    private final EnvironmentException cause;

    private UnavailableSupervisor(EnvironmentException cause) {
      this.cause = cause;
    }

    @Override
    public CompletableFuture<ProcessOutcome> run(JobSpec spec) {
      return CompletableFuture.failedFuture(cause);
    }

    @Override
    public void close() {}
  }
}
