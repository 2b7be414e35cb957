package com.itdesk.backend.repository;

import com.itdesk.backend.domain.Attachment;
import com.itdesk.backend.domain.AuditLog;
import com.itdesk.backend.domain.Comment;
import com.itdesk.backend.domain.Ticket;
import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.Role;
import com.itdesk.backend.domain.enums.TicketPriority;
import com.itdesk.backend.domain.enums.TicketStatus;
import com.itdesk.backend.service.TicketLifecycle;
import com.itdesk.backend.service.TicketNumberGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Sort;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({TicketNumberGenerator.class, TicketLifecycle.class, TicketRepositoryTest.FixedClock.class})
class TicketRepositoryTest {

    static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 2, 14, 0);

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        }
    }

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private TicketRepository ticketRepository;

    @Autowired
    private CommentRepository commentRepository;

    @Autowired
    private AttachmentRepository attachmentRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private TicketNumberGenerator numberGenerator;

    @Autowired
    private TicketLifecycle lifecycle;

    private User employee;
    private User agent;

    @BeforeEach
    void setUp() {
        employee = entityManager.persist(user("EMP100", "ana", Role.EMPLOYEE));
        agent = entityManager.persist(user("EMP200", "sam", Role.AGENT));
    }

    private User user(String employeeId, String username, Role role) {
        User user = new User();
        user.setEmployeeId(employeeId);
        user.setUsername(username);
        user.setPassword("$2a$10$hash");
        user.setName(username.toUpperCase());
        user.setEmail(username + "@company.com");
        user.setDepartment("IT");
        user.setRole(role);
        return user;
    }

    private Ticket ticket(User creator, String title, TicketPriority priority, String department) {
        return ticketRepository.save(draft(creator, title, priority, department));
    }

    private Ticket draft(User creator, String title, TicketPriority priority, String department) {
        Ticket ticket = new Ticket();
        ticket.setTitle(title);
        ticket.setDescription("Details for " + title);
        ticket.setCategory("hardware");
        ticket.setPriority(priority);
        ticket.setCreatedBy(creator);
        ticket.setEmployeeId(creator.getEmployeeId());
        ticket.setEmployeeName(creator.getName());
        ticket.setEmployeeEmail(creator.getEmail());
        ticket.setEmployeeDepartment(department);
        lifecycle.initialize(ticket, numberGenerator.next());
        return ticket;
    }

    @Test
    @DisplayName("sequential creates on an empty table yield TKT-001 then TKT-002")
    void ticketNumbersAreSequential() {
        Ticket first = ticket(employee, "Laptop", TicketPriority.LOW, "IT");
        Ticket second = ticket(employee, "Mouse", TicketPriority.LOW, "IT");

        assertThat(first.getTicketNumber()).isEqualTo("TKT-001");
        assertThat(second.getTicketNumber()).isEqualTo("TKT-002");
        assertThat(ticketRepository.findById(second.getId())).map(Ticket::getTicketNumber).contains("TKT-002");
    }

    @Test
    void deletingTicketRemovesCommentsAttachmentsAndAuditLogs() {
        Ticket ticket = ticket(employee, "Printer", TicketPriority.MEDIUM, "IT");

        Comment comment = new Comment();
        comment.setTicket(ticket);
        comment.setUser(agent);
        comment.setContent("Looking into it");
        ticket.getComments().add(comment);

        Attachment attachment = new Attachment();
        attachment.setTicket(ticket);
        attachment.setFilename(UUID.randomUUID() + ".png");
        attachment.setOriginalName("error.png");
        attachment.setMimeType("image/png");
        attachment.setSize(120);
        attachment.setUploadedBy(employee);
        ticket.getAttachments().add(attachment);

        AuditLog audit = new AuditLog();
        audit.setTicket(ticket);
        audit.setUserId(employee.getId());
        audit.setAction("created");
        ticket.getAuditLogs().add(audit);

        ticketRepository.saveAndFlush(ticket);
        assertThat(commentRepository.findByTicketIdOrderByCreatedAtAsc(ticket.getId())).hasSize(1);

        ticketRepository.delete(ticket);
        entityManager.flush();

        assertThat(commentRepository.findAll()).isEmpty();
        assertThat(attachmentRepository.findAll()).isEmpty();
        assertThat(auditLogRepository.findAll()).isEmpty();
    }

    @Test
    void filtersCombineAndSearchIsCaseInsensitive() {
        ticket(employee, "VPN keeps dropping", TicketPriority.HIGH, "Finance");
        ticket(employee, "New keyboard", TicketPriority.LOW, "Finance");
        ticket(agent, "VPN certificate", TicketPriority.HIGH, "IT");

        TicketFilter filter = new TicketFilter(null, TicketPriority.HIGH, null, null, null, "vpn");
        assertThat(ticketRepository.findAll(TicketSpecifications.matching(filter))).hasSize(2);

        TicketFilter scoped = filter.withCreatedBy(employee.getId());
        List<Ticket> own = ticketRepository.findAll(TicketSpecifications.matching(scoped));
        assertThat(own).extracting(Ticket::getTitle).containsExactly("VPN keeps dropping");

        TicketFilter byDepartment = new TicketFilter(null, null, "Finance", null, null, null);
        assertThat(ticketRepository.count(TicketSpecifications.matching(byDepartment))).isEqualTo(2);
    }

    @Test
    void breachCountsOnlyOverdueUnresolvedTickets() {
        Ticket overdue = ticket(employee, "Server down", TicketPriority.CRITICAL, "IT");
        Ticket resolvedLate = ticket(employee, "Email bounce", TicketPriority.CRITICAL, "IT");
        resolvedLate.setStatus(TicketStatus.RESOLVED);
        ticket(employee, "Monitor flicker", TicketPriority.LOW, "IT");
        ticketRepository.flush();

        LocalDateTime twoHoursLater = NOW.plusHours(2);
        List<Ticket> breached = ticketRepository.findAll(TicketSpecifications.slaBreachedAt(twoHoursLater));

        assertThat(breached).containsExactly(overdue);
        assertThat(ticketRepository.count(TicketSpecifications.slaBreachedAt(NOW.plusMinutes(30)))).isZero();
    }

    @Test
    void unassignAllFromClearsAssignee() {
        Ticket ticket = ticket(employee, "Access request", TicketPriority.MEDIUM, "IT");
        ticket.setAssignedTo(agent);
        ticketRepository.saveAndFlush(ticket);

        int updated = ticketRepository.unassignAllFrom(agent.getId());
        entityManager.clear();

        assertThat(updated).isEqualTo(1);
        assertThat(ticketRepository.findById(ticket.getId()).orElseThrow().getAssignedTo()).isNull();
        assertThat(ticketRepository.existsByCreatedById(employee.getId())).isTrue();
        assertThat(ticketRepository.existsByCreatedById(agent.getId())).isFalse();
    }

    @Test
    void listingSortsNewestFirst() {
        Ticket older = draft(employee, "Older", TicketPriority.LOW, "IT");
        older.setCreatedAt(NOW.minusDays(1));
        older = ticketRepository.save(older);
        Ticket newer = ticket(employee, "Newer", TicketPriority.LOW, "IT");
        ticketRepository.flush();

        List<Ticket> sorted = ticketRepository.findAll(
                TicketSpecifications.matching(TicketFilter.none()), Sort.by(Sort.Direction.DESC, "createdAt"));

        assertThat(sorted).containsExactly(newer, older);
    }
}
