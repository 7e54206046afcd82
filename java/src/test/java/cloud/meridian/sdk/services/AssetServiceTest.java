package cloud.meridian.sdk.services;

import cloud.meridian.sdk.http.Headers;
import cloud.meridian.sdk.http.RecordingExecutor;
import cloud.meridian.sdk.model.Asset;
import cloud.meridian.sdk.pagination.ListOptions;
import cloud.meridian.sdk.pagination.ListResponse;
import cloud.meridian.sdk.pagination.PaginatedResponse;
import cloud.meridian.sdk.pagination.PaginationOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AssetServiceTest {

    private static final String ASSETS = "{\"@odata.count\":3,\"value\":[{\"Id\":11,\"Key\":\"k-11\",\"Name\":\"ApiUrl\","
        + "\"ValueType\":\"Text\",\"Value\":\"https://example.test\",\"CreationTime\":\"2024-03-01T10:15:30Z\","
        + "\"LastModificationTime\":null,\"FoldersCount\":2}]}";

    private RecordingExecutor executor;
    private AssetService service;

    @BeforeEach
    void setUp() {
        executor = new RecordingExecutor();
        service = new AssetService(new PaginationOrchestrator(executor));
    }

    @Test
    void listsAcrossFoldersAndMapsPascalCaseFields() throws Exception {
        executor.respondWith(ASSETS);

        ListResponse<Asset> response = service.getAll();

        assertEquals(Endpoints.ASSETS_ACROSS_FOLDERS, executor.lastCall().path());
        Asset asset = response.items().get(0);
        assertEquals(11L, asset.id());
        assertEquals("ApiUrl", asset.name());
        assertEquals("Text", asset.valueType());
        assertEquals(Instant.parse("2024-03-01T10:15:30Z"), asset.createdTime());
        assertNull(asset.lastModifiedTime());
        assertEquals(2, asset.foldersCount());
    }

    @Test
    void folderScopedPageUsesFolderEndpointAndODataParameters() throws Exception {
        executor.respondWith(ASSETS);

        PaginatedResponse<Asset> page = service.getAll(ListOptions.builder()
            .folderId(5L)
            .pageSize(1)
            .filter("ValueType eq 'Text'")
            .build()).asPaginated();

        RecordingExecutor.Call call = executor.lastCall();
        assertEquals(Endpoints.ASSETS_BY_FOLDER, call.path());
        assertEquals(Map.of(Headers.FOLDER_ID, "5"), call.spec().headers());
        assertEquals(Map.of("$filter", "ValueType eq 'Text'"), call.spec().params());
        assertEquals(Map.of("$top", 1, "$count", true), call.wireParams());
        assertEquals(3, page.totalPages());
        assertTrue(page.hasNextPage());
    }
}
