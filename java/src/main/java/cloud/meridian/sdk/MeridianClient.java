package cloud.meridian.sdk;

import cloud.meridian.sdk.http.HttpRequestExecutor;
import cloud.meridian.sdk.http.RequestExecutor;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;
import cloud.meridian.sdk.services.AssetService;
import cloud.meridian.sdk.services.BucketService;
import cloud.meridian.sdk.services.CaseInstanceService;
import cloud.meridian.sdk.services.EntityService;
import cloud.meridian.sdk.services.ProcessInstanceService;
import cloud.meridian.sdk.services.ProcessService;
import cloud.meridian.sdk.services.QueueService;
import cloud.meridian.sdk.services.TaskService;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for Meridian platform APIs. The client holds no mutable state and is safe to share between
 * threads: create one per tenant and reuse it.
 * </p>
 *
 * <h2>Listing resources</h2>
 * <p>
 * Every {@code getAll}-style method accepts {@link cloud.meridian.sdk.pagination.ListOptions}. Without pagination
 * input the call returns everything the endpoint answers in a single response. With a page size, a cursor or a page
 * number it returns one page plus a cursor for the next one:
 * </p>
 *
 * <pre>{@code
 * ListResponse<Asset> first = client.assets().getAll(ListOptions.builder().pageSize(100).build());
 * PaginatedResponse<Asset> page = first.asPaginated();
 * while (page.hasNextPage()) {
 *     page = client.assets().getAll(ListOptions.builder().cursor(page.nextCursor()).build()).asPaginated();
 * }
 * }</pre>
 */
public final class MeridianClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(MeridianClient.class.getName());

    private final Config config;
    private final PaginationOrchestrator pagination;
    private final AssetService assets;
    private final BucketService buckets;
    private final QueueService queues;
    private final ProcessService processes;
    private final TaskService tasks;
    private final ProcessInstanceService processInstances;
    private final CaseInstanceService caseInstances;
    private final EntityService entities;

    /**
     * Constructs a client using the supplied configuration.
     *
     * @param config caller-supplied configuration; defaults are applied to a copy, so later builder changes do not
     *               affect this client.
     */
    public MeridianClient(Config config) {
        this(config, null);
    }

    /**
     * Constructs a client that sends requests through {@code executor}, for custom transports and tests.
     */
    public MeridianClient(Config config, RequestExecutor executor) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        RequestExecutor resolved = executor == null ? new HttpRequestExecutor(this.config) : executor;
        this.pagination = new PaginationOrchestrator(resolved);
        this.assets = new AssetService(pagination);
        this.buckets = new BucketService(pagination);
        this.queues = new QueueService(pagination);
        this.processes = new ProcessService(pagination);
        this.tasks = new TaskService(pagination);
        this.processInstances = new ProcessInstanceService(pagination);
        this.caseInstances = new CaseInstanceService(pagination);
        this.entities = new EntityService(pagination);
        LOGGER.fine(() -> String.format(Locale.ROOT, "[meridian-sdk] client ready for %s", this.config.getTenantUrl()));
    }

    public Config getConfig() {
        return config;
    }

    public AssetService assets() {
        return assets;
    }

    public BucketService buckets() {
        return buckets;
    }

    public QueueService queues() {
        return queues;
    }

    public ProcessService processes() {
        return processes;
    }

    public TaskService tasks() {
        return tasks;
    }

    public ProcessInstanceService processInstances() {
        return processInstances;
    }

    public CaseInstanceService caseInstances() {
        return caseInstances;
    }

    public EntityService entities() {
        return entities;
    }

    /**
     * Shared list runner, for resources this client has no dedicated service for.
     */
    public PaginationOrchestrator pagination() {
        return pagination;
    }

    /**
     * Closes the client. The underlying {@link java.net.http.HttpClient} needs no explicit shutdown, so this is a
     * no-op kept for try-with-resources use.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }
}
