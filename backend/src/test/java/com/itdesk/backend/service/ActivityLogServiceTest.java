package com.itdesk.backend.service;

import com.itdesk.backend.domain.ActivityLog;
import com.itdesk.backend.dto.ActivityLogDTOs.ActivityLogPage;
import com.itdesk.backend.repository.ActivityLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActivityLogServiceTest {

    @Mock
    private ActivityLogRepository activityLogRepository;

    private ActivityLogService activityLogService;

    @BeforeEach
    void setUp() {
        activityLogService = new ActivityLogService(activityLogRepository);
    }

    private Pageable searchWith(Integer page, Integer limit) {
        when(activityLogRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of()));

        activityLogService.search(null, null, null, null, null, page, limit);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(activityLogRepository).findAll(any(Specification.class), pageable.capture());
        return pageable.getValue();
    }

    @Test
    void searchDefaultsToFirstPageOfFifty() {
        Pageable pageable = searchWith(null, null);

        assertThat(pageable.getPageNumber()).isZero();
        assertThat(pageable.getPageSize()).isEqualTo(50);
        assertThat(pageable.getSort().getOrderFor("createdAt").getDirection()).isEqualTo(Sort.Direction.DESC);
    }

    @Test
    void searchCapsLimitAtFiveHundred() {
        assertThat(searchWith(1, 5000).getPageSize()).isEqualTo(500);
    }

    @Test
    void pagesAreOneBased() {
        ActivityLog entry = new ActivityLog();
        entry.setAction("login");
        when(activityLogRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(entry), Pageable.ofSize(25).withPage(2), 120));

        ActivityLogPage page = activityLogService.search(null, "login", null, null, null, 3, 25);

        assertThat(page.page()).isEqualTo(3);
        assertThat(page.limit()).isEqualTo(25);
        assertThat(page.total()).isEqualTo(120);
        assertThat(page.logs()).containsExactly(entry);
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(activityLogRepository).findAll(any(Specification.class), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isEqualTo(2);
    }

    @Test
    void exportWritesHeaderAndOneRowPerEntry() throws Exception {
        ActivityLog entry = new ActivityLog();
        entry.setCreatedAt(LocalDateTime.of(2024, 6, 3, 9, 30));
        entry.setUserId(UUID.fromString("00000000-0000-0000-0000-000000000001"));
        entry.setAction("api_call");
        entry.setResource("tickets");
        entry.setMethod("GET");
        entry.setEndpoint("/api/tickets");
        entry.setDuration(12L);
        when(activityLogRepository.findAll(any(Specification.class), any(Sort.class))).thenReturn(List.of(entry));

        String csv = new String(activityLogService.exportCsv(null, null, null, null, null).readAllBytes(),
                StandardCharsets.UTF_8);

        String[] lines = csv.split("\r\n");
        assertThat(lines[0]).isEqualTo(String.join(",", ActivityLogService.EXPORT_HEADER));
        assertThat(lines).hasSize(2);
        assertThat(lines[1]).startsWith("2024-06-03T09:30,00000000-0000-0000-0000-000000000001,api_call,tickets,,GET,/api/tickets,true,,12,");
    }

    @Test
    void recordSwallowsRepositoryFailure() {
        when(activityLogRepository.save(any(ActivityLog.class)))
                .thenThrow(new DataAccessResourceFailureException("database down"));
        ActivityLog entry = new ActivityLog();
        entry.setAction("api_call");

        assertThatCode(() -> activityLogService.record(entry)).doesNotThrowAnyException();
    }
}
