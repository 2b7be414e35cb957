package com.itdesk.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.itdesk.backend.config.WebConfig;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.Role;
import com.itdesk.backend.domain.enums.TicketPriority;
import com.itdesk.backend.domain.enums.TicketStatus;
import com.itdesk.backend.dto.TicketDTOs.CreateTicketRequest;
import com.itdesk.backend.dto.TicketDTOs.TicketPage;
import com.itdesk.backend.dto.TicketDTOs.UpdateTicketRequest;
import com.itdesk.backend.dto.TicketResponse;
import com.itdesk.backend.exception.GlobalExceptionHandler;
import com.itdesk.backend.exception.ResourceNotFoundException;
import com.itdesk.backend.repository.TicketFilter;
import com.itdesk.backend.service.TicketService;
import jakarta.validation.Validation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.format.support.DefaultFormattingConversionService;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("TicketController")
class TicketControllerTest {

    @Mock
    private TicketService ticketService;

    private MockMvc mockMvc;
    private User employee;

    @BeforeEach
    void setUp() {
        DefaultFormattingConversionService conversionService = new DefaultFormattingConversionService();
        new WebConfig().addFormatters(conversionService);

        TicketController controller = new TicketController(ticketService,
                new ObjectMapper().findAndRegisterModules(),
                Validation.buildDefaultValidatorFactory().getValidator());

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .setConversionService(conversionService)
                .build();

        employee = new User();
        employee.setId(UUID.randomUUID());
        employee.setEmployeeId("EMP004");
        employee.setUsername("michael.chen");
        employee.setName("Michael Chen");
        employee.setRole(Role.EMPLOYEE);
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(employee, null, employee.getAuthorities()));
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private TicketResponse sampleResponse() {
        LocalDateTime createdAt = LocalDateTime.of(2024, 6, 3, 9, 0);
        return new TicketResponse(UUID.randomUUID(), "TKT-001", "VPN down", "Cannot connect", "network",
                TicketPriority.CRITICAL, TicketStatus.OPEN, "EMP004", "Michael Chen", "michael@company.com",
                null, "Sales", null, null, employee.getId(), createdAt, createdAt, null,
                createdAt.plusHours(1), null);
    }

    @Nested
    @DisplayName("GET /api/tickets")
    class ListTickets {

        @Test
        void parsesLowercaseFiltersAndPaging() throws Exception {
            when(ticketService.list(eq(employee), any(TicketFilter.class), eq(2), isNull()))
                    .thenReturn(new TicketPage(List.of(sampleResponse()), 21, 2, 20));

            mockMvc.perform(get("/api/tickets")
                            .param("status", "in_progress")
                            .param("priority", "critical")
                            .param("search", "vpn")
                            .param("page", "2"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total").value(21))
                    .andExpect(jsonPath("$.tickets[0].ticketNumber").value("TKT-001"))
                    .andExpect(jsonPath("$.tickets[0].priority").value("critical"))
                    .andExpect(jsonPath("$.tickets[0].status").value("open"));

            ArgumentCaptor<TicketFilter> filter = ArgumentCaptor.forClass(TicketFilter.class);
            verify(ticketService).list(eq(employee), filter.capture(), eq(2), isNull());
            assertThat(filter.getValue().status()).isEqualTo(TicketStatus.IN_PROGRESS);
            assertThat(filter.getValue().priority()).isEqualTo(TicketPriority.CRITICAL);
            assertThat(filter.getValue().search()).isEqualTo("vpn");
        }

        @Test
        void unknownStatusIsMalformed() throws Exception {
            mockMvc.perform(get("/api/tickets").param("status", "bogus"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Malformed request"));
        }
    }

    @Nested
    @DisplayName("POST /api/tickets")
    class CreateTicket {

        @Test
        void createsFromJson() throws Exception {
            when(ticketService.create(eq(employee), any(CreateTicketRequest.class), anyList()))
                    .thenReturn(sampleResponse());

            mockMvc.perform(post("/api/tickets")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\":\"VPN down\",\"description\":\"Cannot connect\","
                                    + "\"category\":\"network\",\"priority\":\"critical\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.ticketNumber").value("TKT-001"))
                    .andExpect(jsonPath("$.slaDeadline").value("2024-06-03T10:00:00"));
        }

        @Test
        void missingTitleIsRejected() throws Exception {
            mockMvc.perform(post("/api/tickets")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"description\":\"Cannot connect\",\"category\":\"network\",\"priority\":\"low\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Invalid request data"))
                    .andExpect(jsonPath("$.errors[0].field").value("title"));

            verify(ticketService, never()).create(any(), any(), any());
        }

        @Test
        void createsFromMultipartWithAttachments() throws Exception {
            when(ticketService.create(eq(employee), any(CreateTicketRequest.class), anyList()))
                    .thenReturn(sampleResponse());

            MockMultipartFile ticket = new MockMultipartFile("ticket", "", MediaType.APPLICATION_JSON_VALUE,
                    ("{\"title\":\"VPN down\",\"description\":\"Cannot connect\","
                            + "\"category\":\"network\",\"priority\":\"critical\"}").getBytes(StandardCharsets.UTF_8));
            MockMultipartFile screenshot = new MockMultipartFile("attachments", "error.png", "image/png",
                    new byte[]{1, 2, 3});

            mockMvc.perform(multipart("/api/tickets").file(ticket).file(screenshot))
                    .andExpect(status().isCreated());

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<MultipartFile>> files = ArgumentCaptor.forClass(List.class);
            ArgumentCaptor<CreateTicketRequest> request = ArgumentCaptor.forClass(CreateTicketRequest.class);
            verify(ticketService).create(eq(employee), request.capture(), files.capture());
            assertThat(request.getValue().priority()).isEqualTo(TicketPriority.CRITICAL);
            assertThat(files.getValue()).extracting(MultipartFile::getOriginalFilename)
                    .containsExactly("error.png");
        }

        @Test
        void unreadableTicketPartIsRejected() throws Exception {
            MockMultipartFile ticket = new MockMultipartFile("ticket", "", MediaType.APPLICATION_JSON_VALUE,
                    "{not json".getBytes(StandardCharsets.UTF_8));

            mockMvc.perform(multipart("/api/tickets").file(ticket))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Invalid ticket data"));
        }
    }

    @Nested
    @DisplayName("PATCH /api/tickets/{id}")
    class UpdateTicket {

        @Test
        void forbiddenUpdateMapsTo403() throws Exception {
            UUID id = UUID.randomUUID();
            when(ticketService.update(eq(employee), eq(id), any(UpdateTicketRequest.class)))
                    .thenThrow(new AccessDeniedException("You can only update your own tickets"));

            mockMvc.perform(patch("/api/tickets/{id}", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"status\":\"closed\"}"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.message").value("You can only update your own tickets"));
        }

        @Test
        void missingTicketMapsTo404() throws Exception {
            UUID id = UUID.randomUUID();
            when(ticketService.update(eq(employee), eq(id), any(UpdateTicketRequest.class)))
                    .thenThrow(ResourceNotFoundException.of("Ticket"));

            mockMvc.perform(patch("/api/tickets/{id}", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"priority\":\"high\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("Ticket not found"));
        }
    }
}
