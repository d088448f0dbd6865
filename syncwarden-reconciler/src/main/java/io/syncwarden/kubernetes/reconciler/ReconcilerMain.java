/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.javaoperatorsdk.operator.Operator;
import io.javaoperatorsdk.operator.monitoring.micrometer.MicrometerMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

import io.syncwarden.kubernetes.reconciler.backoff.ExponentialBackoff;
import io.syncwarden.kubernetes.reconciler.config.ConfigParser;
import io.syncwarden.kubernetes.reconciler.config.ReconcilerConfiguration;
import io.syncwarden.kubernetes.reconciler.events.Funnel;
import io.syncwarden.kubernetes.reconciler.events.Publisher;
import io.syncwarden.kubernetes.reconciler.events.PublisherGroup;
import io.syncwarden.kubernetes.reconciler.finalizer.FinalizerController;
import io.syncwarden.kubernetes.reconciler.finalizer.RSyncFinalizer;
import io.syncwarden.kubernetes.reconciler.hydrate.DeclaredFieldHydrator;
import io.syncwarden.kubernetes.reconciler.management.UnsupportedHttpMethodFilter;
import io.syncwarden.kubernetes.reconciler.namespace.NamespaceControllerState;
import io.syncwarden.kubernetes.reconciler.namespace.NamespaceEventReconciler;
import io.syncwarden.kubernetes.reconciler.parse.Applier;
import io.syncwarden.kubernetes.reconciler.parse.DefaultRunFunction;
import io.syncwarden.kubernetes.reconciler.parse.EventHandler;
import io.syncwarden.kubernetes.reconciler.parse.FileSystemSourceReader;
import io.syncwarden.kubernetes.reconciler.parse.PipelineOptions;
import io.syncwarden.kubernetes.reconciler.parse.ReconcilerState;
import io.syncwarden.kubernetes.reconciler.parse.Remediator;
import io.syncwarden.kubernetes.reconciler.parse.ServerSideApplier;
import io.syncwarden.kubernetes.reconciler.parse.SyncPipeline;
import io.syncwarden.kubernetes.reconciler.parse.YamlManifestParser;
import io.syncwarden.kubernetes.reconciler.pubsub.KafkaStatusMessagePublisher;
import io.syncwarden.kubernetes.reconciler.pubsub.StatusMessagePublisher;
import io.syncwarden.kubernetes.reconciler.status.ConflictReporter;
import io.syncwarden.kubernetes.reconciler.status.KubernetesRSyncStore;
import io.syncwarden.kubernetes.reconciler.status.RSyncStatusClient;
import io.syncwarden.kubernetes.reconciler.status.RSyncStore;
import io.syncwarden.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The {@code main} method entrypoint for a reconciler serving one RSync.
 */
public class ReconcilerMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconcilerMain.class);
    private static final String BIND_ADDRESS_VAR_NAME = "BIND_ADDRESS";
    private static final String NODE_NAME_VAR_NAME = "NODE_NAME";
    private static final int DEFAULT_MANAGEMENT_PORT = 8080;
    static final String HTTP_PATH_LIVEZ = "/livez";
    static final String HTTP_PATH_METRICS = "/metrics";

    /**
     * Name of the build_info metric. The {@code .info} suffix tells Micrometer this is an 'info' metric; Prometheus
     * sees it as {@code syncwarden_reconciler_build_info}.
     */
    private static final String BUILD_INFO_METRIC_NAME = "syncwarden_reconciler_build.info";

    private final ReconcilerConfiguration config;
    private final KubernetesClient client;
    private final HttpServer managementServer;
    private final Clock clock;
    private final Map<String, String> env;
    private @Nullable Operator operator;
    private @Nullable Funnel funnel;
    private @Nullable Remediator remediator;
    private @Nullable FinalizerController finalizerController;
    private @Nullable StatusMessagePublisher publisher;
    private volatile CompletableFuture<Void> funnelDone = new CompletableFuture<>();

    public ReconcilerMain(ReconcilerConfiguration config) throws IOException {
        this(config, new KubernetesClientBuilder().build(), createHttpServer(), Clock.systemUTC(), System.getenv());
    }

    @VisibleForTesting
    ReconcilerMain(ReconcilerConfiguration config, KubernetesClient client, HttpServer managementServer, Clock clock, Map<String, String> env) {
        this.config = Objects.requireNonNull(config);
        this.client = Objects.requireNonNull(client);
        this.managementServer = Objects.requireNonNull(managementServer);
        this.clock = Objects.requireNonNull(clock);
        this.env = Objects.requireNonNull(env);
        configurePrometheusMetrics(managementServer);
    }

    public static void main(String[] args) {
        try {
            var config = new ConfigParser().loadConfiguration(System.getenv());
            var main = new ReconcilerMain(config);
            Runtime.getRuntime().addShutdownHook(new Thread(main::stop, "syncwarden-shutdown"));
            main.start();
        }
        catch (Exception e) {
            LOGGER.error("Reconciler has thrown exception during startup. Will now exit.", e);
            System.exit(1);
        }
    }

    /**
     * Wires the control loop, starts it and returns. The funnel thread keeps the process running.
     */
    synchronized void start() {
        var metrics = new ReconcilerMetrics(Metrics.globalRegistry);
        RSyncStore store = config.isRootScoped()
                ? KubernetesRSyncStore.forRootSync(client, config.servedNamespace(), config.syncName())
                : KubernetesRSyncStore.forRepoSync(client, config.servedNamespace(), config.syncName(), config.rsyncNamespace());
        PipelineOptions options = PipelineOptions.from(config, env.getOrDefault(NODE_NAME_VAR_NAME, ""), clock);
        Applier applier = new ServerSideApplier(client);
        Remediator activeRemediator = Remediator.disabled();
        remediator = activeRemediator;
        StatusMessagePublisher messagePublisher = config.publishingConfiguration()
                .<StatusMessagePublisher> map(KafkaStatusMessagePublisher::new)
                .orElseGet(StatusMessagePublisher::noop);
        publisher = messagePublisher;
        var pipeline = new SyncPipeline(options,
                new FileSystemSourceReader(config.sourceRoot(), config.hydratedRoot(), config.repoRoot(), config.syncDir()),
                new YamlManifestParser(),
                new DeclaredFieldHydrator(),
                applier,
                activeRemediator,
                new RSyncStatusClient(store, metrics, config.reconcilerName()),
                new ConflictReporter(store, metrics, clock),
                messagePublisher,
                metrics);

        NamespaceControllerState namespaceState = null;
        if (config.dynamicNamespaceSelectorEnabled()) {
            namespaceState = new NamespaceControllerState();
            var namespaceOperator = new Operator(o -> {
                o.withMetrics(enablePrometheusMetrics());
                o.withKubernetesClient(client);
            });
            namespaceOperator.register(new NamespaceEventReconciler(namespaceState));
            operator = namespaceOperator;
        }

        List<Publisher> publishers = PublisherGroup.build(clock,
                config.pollingPeriod(),
                config.resyncPeriod(),
                config.statusUpdatePeriod(),
                namespaceState == null ? null : config.namespaceResyncPeriod(),
                ExponentialBackoff.forSyncRetries(config.retryPeriod()));
        var activeFunnel = new Funnel(publishers, new EventHandler(pipeline, new ReconcilerState(), namespaceState, new DefaultRunFunction()), clock);
        funnel = activeFunnel;

        var continueGate = new CompletableFuture<Void>();
        var finalizer = new RSyncFinalizer(store, applier, this::stopControllers, continueGate);
        var controller = new FinalizerController(store, finalizer,
                new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofMinutes(1), 2.0, 0.1, 10, new Random()));
        finalizerController = controller;

        addHttpGetHandler("/", () -> 404);
        managementServer.start();
        addHttpGetHandler(HTTP_PATH_LIVEZ, this::livezStatusCode);
        if (operator != null) {
            operator.start();
        }
        controller.start();
        funnelDone = activeFunnel.start();
        // the finalizer may only delete managed objects once no run can recreate them
        funnelDone.whenComplete((v, t) -> continueGate.complete(null));

        var versionInfo = VersionInfo.VERSION_INFO;
        LOGGER.atInfo().setMessage("Reconciler {} started for {} (version: {}, commit id: {})")
                .addArgument(config::reconcilerName)
                .addArgument(options::managerName)
                .addArgument(versionInfo::version)
                .addArgument(versionInfo::commitId)
                .log();
        versionInfoMetric(versionInfo);
    }

    /**
     * Stops the control loop and the remediator without waiting for them.
     */
    private void stopControllers() {
        LOGGER.info("Stopping the control loop and the remediator");
        if (funnel != null) {
            funnel.stop();
        }
        if (remediator != null) {
            remediator.pause();
        }
    }

    private void addHttpGetHandler(String path,
                                   IntSupplier statusCodeSupplier) {
        managementServer.createContext(path, exchange -> {
            try (exchange) {
                exchange.sendResponseHeaders(statusCodeSupplier.getAsInt(), -1);
            }
        }).getFilters().add(UnsupportedHttpMethodFilter.INSTANCE);
    }

    @VisibleForTesting
    int livezStatusCode() {
        int sc;
        try {
            boolean controlLoopAlive = !funnelDone.isDone() || (finalizerController != null && finalizerController.isFinalizing());
            boolean operatorHealthy = operator == null || operator.getRuntimeInfo().allEventSourcesAreHealthy();
            sc = controlLoopAlive && operatorHealthy ? 200 : 400;
        }
        catch (Exception e) {
            sc = 400;
            LOGGER.error("Ignoring exception caught while getting reconciler health info", e);
        }
        (sc != 200 ? LOGGER.atWarn() : LOGGER.atDebug()).log("Responding {} to GET {}", sc, HTTP_PATH_LIVEZ);
        return sc;
    }

    /**
     * Stops everything: the control loop first, waiting for the run in progress, then the watches and servers.
     */
    synchronized void stop() {
        if (funnel != null) {
            funnel.close();
        }
        if (remediator != null) {
            remediator.pause();
        }
        if (finalizerController != null) {
            finalizerController.close();
        }
        if (operator != null) {
            operator.stop();
        }
        if (publisher != null) {
            publisher.close();
        }
        managementServer.stop(0);
        client.close();
        LOGGER.info("Reconciler stopped.");
    }

    private MicrometerMetrics enablePrometheusMetrics() {
        return MicrometerMetrics.newPerResourceCollectingMicrometerMetricsBuilder(Metrics.globalRegistry)
                .withCleanUpDelayInSeconds(35)
                .withCleaningThreadNumber(1)
                .build();
    }

    private static void configurePrometheusMetrics(HttpServer managementServer) {
        final PrometheusMeterRegistry prometheusMeterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        final HttpContext metricsContext = managementServer.createContext(HTTP_PATH_METRICS,
                new MetricsHandler(prometheusMeterRegistry.getPrometheusRegistry()));
        metricsContext.getFilters().add(UnsupportedHttpMethodFilter.INSTANCE);
        Metrics.globalRegistry.add(prometheusMeterRegistry);
    }

    @VisibleForTesting
    static HttpServer createHttpServer() throws IOException {
        final Properties systemProps = System.getProperties();
        if (!systemProps.containsKey("sun.net.httpserver.maxReqTime")) {
            System.setProperty("sun.net.httpserver.maxReqTime", "60");
        }

        if (!systemProps.containsKey("sun.net.httpserver.maxRspTime")) {
            System.setProperty("sun.net.httpserver.maxRspTime", "120");
        }

        return HttpServer.create(getBindAddress(System.getenv()), 0);
    }

    @VisibleForTesting
    static InetSocketAddress getBindAddress(Map<String, String> envVars) {
        final String bindAddress = envVars.getOrDefault(BIND_ADDRESS_VAR_NAME, "0.0.0.0:" + DEFAULT_MANAGEMENT_PORT);
        String bindToInterface;
        int bindToPort;
        int separator = bindAddress.lastIndexOf(':');
        if (separator >= 0) {
            bindToInterface = bindAddress.substring(0, separator);
            try {
                bindToPort = Integer.parseInt(bindAddress.substring(separator + 1));
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException(BIND_ADDRESS_VAR_NAME + " has an invalid port: " + bindAddress, e);
            }
        }
        else if (!bindAddress.isEmpty()) {
            LOGGER.warn("{} env var is set but does not contain `:` assuming hostname only and binding to default port ({})",
                    BIND_ADDRESS_VAR_NAME,
                    DEFAULT_MANAGEMENT_PORT);
            bindToInterface = bindAddress;
            bindToPort = DEFAULT_MANAGEMENT_PORT;
        }
        else {
            bindToInterface = "0.0.0.0";
            bindToPort = DEFAULT_MANAGEMENT_PORT;
        }

        LOGGER.info("Starting management server on: {}:{}", bindToInterface, bindToPort);
        return new InetSocketAddress(bindToInterface, bindToPort);
    }

    private static void versionInfoMetric(VersionInfo versionInfo) {
        Gauge.builder(BUILD_INFO_METRIC_NAME, () -> 1.0)
                .description("Reports Syncwarden reconciler version information")
                .tag("version", versionInfo.version())
                .tag("commit_id", versionInfo.commitId())
                .strongReference(true)
                .register(Metrics.globalRegistry);
    }
}
