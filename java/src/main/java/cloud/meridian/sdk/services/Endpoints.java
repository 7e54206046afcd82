package cloud.meridian.sdk.services;

/**
 * Resource paths, relative to the tenant root. Each backend is reached through its own service prefix.
 */
public final class Endpoints {

    public static final String ORCHESTRATOR_BASE = "orchestrator_";
    public static final String PROCESS_INSIGHTS_BASE = "pims_";
    public static final String DATA_FABRIC_BASE = "datafabric_";

    private static final String ODATA = ORCHESTRATOR_BASE + "/odata";
    private static final String ODATA_ACTIONS = "Meridian.Server.OData";

    public static final String ASSETS_BY_FOLDER = ODATA + "/Assets/" + ODATA_ACTIONS + ".GetFiltered";
    public static final String ASSETS_ACROSS_FOLDERS = ODATA + "/Assets/" + ODATA_ACTIONS + ".GetAssetsAcrossFolders";

    public static final String BUCKETS_BY_FOLDER = ODATA + "/Buckets";
    public static final String BUCKETS_ACROSS_FOLDERS = ODATA + "/Buckets/" + ODATA_ACTIONS + ".GetBucketsAcrossFolders";

    public static final String QUEUES_BY_FOLDER = ODATA + "/QueueDefinitions";
    public static final String QUEUES_ACROSS_FOLDERS =
        ODATA + "/QueueDefinitions/" + ODATA_ACTIONS + ".GetQueuesAcrossFolders";

    public static final String PROCESSES = ODATA + "/Releases";

    public static final String TASKS_ACROSS_FOLDERS = ODATA + "/Tasks/" + ODATA_ACTIONS + ".GetTasksAcrossFolders";
    public static final String TASKS_ACROSS_FOLDERS_ADMIN =
        ODATA + "/Tasks/" + ODATA_ACTIONS + ".GetTasksAcrossFoldersForAdmin";

    public static final String PROCESS_INSTANCES = PROCESS_INSIGHTS_BASE + "/api/v1/instances";

    private Endpoints() {
    }

    public static String bucketFiles(long bucketId) {
        return ORCHESTRATOR_BASE + "/api/Buckets/" + bucketId + "/ListFiles";
    }

    public static String taskUsers(long folderId) {
        return ODATA + "/Tasks/" + ODATA_ACTIONS + ".GetTaskUsers(organizationUnitId=" + folderId + ")";
    }

    public static String entityRecords(String entityId) {
        return DATA_FABRIC_BASE + "/api/EntityService/entity/" + entityId + "/read";
    }
}
