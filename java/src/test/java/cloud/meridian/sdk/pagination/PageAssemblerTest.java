package cloud.meridian.sdk.pagination;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageAssemblerTest {

    @Test
    void firstOffsetPageOfKnownTotal() throws Exception {
        PageInfo info = new PageInfo(true, 100, 1, 10, null);

        PaginatedResponse<String> page = PageAssembler.createPaginatedResponse(info, PaginationType.OFFSET, List.of("a"));

        assertTrue(page.hasNextPage());
        assertNull(page.previousCursor());
        assertEquals(10, page.totalPages());
        assertEquals(1, page.currentPage());
        assertTrue(page.supportsPageJump());
        assertEquals(CursorData.offset(2, 10), CursorCodec.decode(page.nextCursor().value()));
    }

    @Test
    void lastOffsetPageOfKnownTotal() throws Exception {
        PageInfo info = new PageInfo(false, 100, 10, 10, null);

        PaginatedResponse<String> page = PageAssembler.createPaginatedResponse(info, PaginationType.OFFSET, List.of("z"));

        assertFalse(page.hasNextPage());
        assertNull(page.nextCursor());
        assertEquals(CursorData.offset(9, 10), CursorCodec.decode(page.previousCursor().value()));
        assertEquals(10, page.totalPages());
    }

    @Test
    void totalPagesRoundsUp() {
        PageInfo info = new PageInfo(true, 101, 1, 10, null);

        assertEquals(11, PageAssembler.createPaginatedResponse(info, PaginationType.OFFSET, List.of()).totalPages());
    }

    @Test
    void offsetHasMoreUsesTotalWhenKnown() {
        assertTrue(PageAssembler.hasMorePages(PaginationType.OFFSET, new PaginationDetectionInfo(100, 10, 9, 10, null)));
        assertFalse(PageAssembler.hasMorePages(PaginationType.OFFSET, new PaginationDetectionInfo(100, 10, 10, 10, null)));
        assertFalse(PageAssembler.hasMorePages(PaginationType.OFFSET, new PaginationDetectionInfo(0, 10, 1, 0, null)));
    }

    @Test
    void offsetHasMoreFallsBackToFullPage() {
        assertTrue(PageAssembler.hasMorePages(PaginationType.OFFSET, new PaginationDetectionInfo(null, 10, 1, 10, null)));
        assertFalse(PageAssembler.hasMorePages(PaginationType.OFFSET, new PaginationDetectionInfo(null, 10, 1, 7, null)));
        assertTrue(PageAssembler.hasMorePages(PaginationType.OFFSET, new PaginationDetectionInfo(null, null, 1, 50, null)));
    }

    @Test
    void tokenHasMoreFollowsToken() {
        assertTrue(PageAssembler.hasMorePages(PaginationType.TOKEN, new PaginationDetectionInfo(null, 10, 1, 10, "t")));
        assertFalse(PageAssembler.hasMorePages(PaginationType.TOKEN, new PaginationDetectionInfo(500, 10, 1, 10, null)));
        assertFalse(PageAssembler.hasMorePages(PaginationType.TOKEN, new PaginationDetectionInfo(null, 10, 1, 10, "")));
    }

    @Test
    void tokenPagesNeverOfferPageJumpOrPreviousCursor() throws Exception {
        PageInfo info = new PageInfo(true, null, null, 10, "next");

        PaginatedResponse<String> page = PageAssembler.createPaginatedResponse(info, PaginationType.TOKEN, List.of("a"));

        assertFalse(page.supportsPageJump());
        assertNull(page.previousCursor());
        assertNull(page.currentPage());
        assertNull(page.totalPages());
        assertEquals(CursorData.token("next", 10), CursorCodec.decode(page.nextCursor().value()));
    }

    @Test
    void tokenPageWithoutTokenHasNoCursor() {
        PageInfo info = new PageInfo(true, null, null, 10, null);

        PaginatedResponse<String> page = PageAssembler.createPaginatedResponse(info, PaginationType.TOKEN, List.of("a"));

        assertTrue(page.hasNextPage());
        assertNull(page.nextCursor());
    }

    @Test
    void assemblingTwiceGivesEqualResponses() {
        PageInfo info = new PageInfo(true, 42, 2, 10, null);
        List<String> items = List.of("x", "y");

        assertEquals(
            PageAssembler.createPaginatedResponse(info, PaginationType.OFFSET, items),
            PageAssembler.createPaginatedResponse(info, PaginationType.OFFSET, items));
    }
}
