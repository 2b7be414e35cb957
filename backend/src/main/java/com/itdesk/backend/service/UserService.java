package com.itdesk.backend.service;

import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.Role;
import com.itdesk.backend.dto.UserDTOs.BulkCreateResult;
import com.itdesk.backend.dto.UserDTOs.BulkDeleteResult;
import com.itdesk.backend.dto.UserDTOs.CreateUserRequest;
import com.itdesk.backend.dto.UserDTOs.RowError;
import com.itdesk.backend.dto.UserDTOs.UpdateUserRequest;
import com.itdesk.backend.dto.UserResponse;
import com.itdesk.backend.exception.BadRequestException;
import com.itdesk.backend.exception.ConflictException;
import com.itdesk.backend.exception.ResourceNotFoundException;
import com.itdesk.backend.repository.AttachmentRepository;
import com.itdesk.backend.repository.CommentRepository;
import com.itdesk.backend.repository.TicketRepository;
import com.itdesk.backend.repository.UserRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    static final String[] IMPORT_HEADER = {
        "employeeId", "password", "name", "email", "mobile", "department", "designation", "role"
    };
    static final String[] EXPORT_HEADER = {
        "employeeId", "username", "name", "email", "mobile", "department", "designation", "role", "createdAt"
    };

    private final UserRepository userRepository;
    private final TicketRepository ticketRepository;
    private final CommentRepository commentRepository;
    private final AttachmentRepository attachmentRepository;
    private final PasswordEncoder passwordEncoder;
    private final Validator validator;

    @Transactional(readOnly = true)
    public List<UserResponse> list() {
        return userRepository.findAllByOrderByNameAsc().stream().map(UserResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public UserResponse get(UUID id) {
        return UserResponse.from(find(id));
    }

    @Transactional
    public UserResponse create(CreateUserRequest request) {
        String username = usernameFor(request);
        if (userRepository.existsByEmployeeId(request.employeeId())) {
            throw new ConflictException("Employee ID already exists");
        }
        if (userRepository.existsByUsername(username)) {
            throw new ConflictException("Username already exists");
        }
        User user = userRepository.save(newUser(request, username));
        log.info("User {} created with role {}", user.getUsername(), user.getRole().toJson());
        return UserResponse.from(user);
    }

    /** Atualização parcial; a senha só é trocada quando vier preenchida. */
    @Transactional
    public UserResponse update(UUID id, UpdateUserRequest request) {
        User user = find(id);

        if (notBlank(request.employeeId()) && !request.employeeId().equals(user.getEmployeeId())) {
            if (userRepository.existsByEmployeeId(request.employeeId())) {
                throw new ConflictException("Employee ID already exists");
            }
            user.setEmployeeId(request.employeeId());
        }
        if (notBlank(request.username()) && !request.username().equals(user.getUsername())) {
            if (userRepository.existsByUsername(request.username())) {
                throw new ConflictException("Username already exists");
            }
            user.setUsername(request.username());
        }
        if (notBlank(request.password())) {
            user.setPassword(passwordEncoder.encode(request.password()));
        }
        if (notBlank(request.name())) user.setName(request.name());
        if (notBlank(request.email())) user.setEmail(request.email());
        if (request.mobile() != null) user.setMobile(request.mobile());
        if (request.department() != null) user.setDepartment(request.department());
        if (request.designation() != null) user.setDesignation(request.designation());
        if (request.role() != null) user.setRole(request.role());

        return UserResponse.from(userRepository.save(user));
    }

    @Transactional
    public void resetPassword(UUID id, String password) {
        User user = find(id);
        user.setPassword(passwordEncoder.encode(password));
        userRepository.save(user);
        log.info("Password reset for user {}", user.getUsername());
    }

    /**
     * Remove o usuário e tira as atribuições de chamados dele. Quem abriu chamados
     * ou comentou não pode ser removido, para não quebrar o histórico.
     */
    @Transactional
    public void delete(User actor, UUID id) {
        if (actor.getId().equals(id)) {
            throw new BadRequestException("Cannot delete your own account");
        }
        User user = find(id);
        removeUser(user);
    }

    @Transactional
    public BulkCreateResult bulkCreate(List<CreateUserRequest> requests) {
        List<PendingRow> rows = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            rows.add(new PendingRow(i, requests.get(i), List.of()));
        }
        return createRows(rows);
    }

    /**
     * Remove por matrícula, uma a uma. Quem não pode ser removido vai para
     * {@code conflicts} e o lote continua; a própria conta é ignorada.
     */
    @Transactional
    public BulkDeleteResult bulkDelete(User actor, List<String> employeeIds) {
        int deleted = 0;
        List<String> notFound = new ArrayList<>();
        List<String> conflicts = new ArrayList<>();
        for (String employeeId : employeeIds) {
            User user = userRepository.findByEmployeeId(employeeId).orElse(null);
            if (user == null) {
                notFound.add(employeeId);
                continue;
            }
            if (user.getId().equals(actor.getId())) {
                continue;
            }
            try {
                removeUser(user);
                deleted++;
            } catch (ConflictException e) {
                log.warn("Bulk delete skipped {}: {}", employeeId, e.getMessage());
                conflicts.add(employeeId);
            }
        }
        return new BulkDeleteResult("Deleted " + deleted + " users", deleted, notFound, conflicts);
    }

    /** Importa usuários de CSV com o mesmo tratamento por linha do cadastro em lote. */
    @Transactional
    public BulkCreateResult importCsv(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException("CSV file is required");
        }
        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreHeaderCase(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();

        List<PendingRow> rows = new ArrayList<>();
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, format)) {

            int index = 0;
            for (CSVRecord record : parser) {
                List<String> errors = new ArrayList<>();
                Role role = null;
                String roleValue = column(record, "role");
                try {
                    role = Role.fromValue(roleValue);
                } catch (IllegalArgumentException e) {
                    errors.add("role: invalid value '" + roleValue + "'");
                }
                CreateUserRequest request = new CreateUserRequest(
                        column(record, "employeeId"),
                        column(record, "username"),
                        column(record, "password"),
                        column(record, "name"),
                        column(record, "email"),
                        column(record, "mobile"),
                        column(record, "department"),
                        column(record, "designation"),
                        role);
                rows.add(new PendingRow(index++, request, errors));
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new BadRequestException("Invalid CSV file: " + e.getMessage());
        }

        if (rows.isEmpty()) {
            throw new BadRequestException("CSV file has no user rows");
        }
        return createRows(rows);
    }

    public ByteArrayInputStream importTemplate() {
        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                .setHeader(IMPORT_HEADER)
                .build();
        return CsvSupport.write(format, printer -> {
            printer.printRecord("EMP100", "ChangeMe123", "Jane Doe", "jane.doe@company.com",
                    "+1-555-0100", "Finance", "Analyst", "user");
        });
    }

    @Transactional(readOnly = true)
    public ByteArrayInputStream exportCsv() {
        List<User> users = userRepository.findAllByOrderByNameAsc();
        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                .setHeader(EXPORT_HEADER)
                .build();
        return CsvSupport.write(format, printer -> {
            for (User user : users) {
                printer.printRecord(
                        user.getEmployeeId(),
                        user.getUsername(),
                        user.getName(),
                        user.getEmail(),
                        user.getMobile(),
                        user.getDepartment(),
                        user.getDesignation(),
                        user.getRole().toJson(),
                        user.getCreatedAt());
            }
        });
    }

    private BulkCreateResult createRows(List<PendingRow> rows) {
        List<UserResponse> created = new ArrayList<>();
        List<RowError> errors = new ArrayList<>();
        Set<String> seenEmployeeIds = new HashSet<>();
        Set<String> seenUsernames = new HashSet<>();

        for (PendingRow row : rows) {
            CreateUserRequest request = row.request();
            List<String> problems = new ArrayList<>(row.errors());
            for (ConstraintViolation<CreateUserRequest> violation : validator.validate(request)) {
                problems.add(violation.getPropertyPath() + ": " + violation.getMessage());
            }

            String username = usernameFor(request);
            if (notBlank(request.employeeId())
                    && (!seenEmployeeIds.add(request.employeeId()) || userRepository.existsByEmployeeId(request.employeeId()))) {
                problems.add("employeeId: already exists");
            }
            if (notBlank(username) && (!seenUsernames.add(username) || userRepository.existsByUsername(username))) {
                problems.add("username: already exists");
            }

            if (!problems.isEmpty()) {
                errors.add(new RowError(row.index(), rowData(request), problems));
                continue;
            }
            created.add(UserResponse.from(userRepository.save(newUser(request, username))));
        }

        log.info("Bulk user creation: {} created, {} rejected", created.size(), errors.size());
        String message = "Created " + created.size() + " of " + rows.size() + " users";
        return new BulkCreateResult(message, created, errors);
    }

    private void removeUser(User user) {
        if (ticketRepository.existsByCreatedById(user.getId())
                || commentRepository.existsByUserId(user.getId())
                || attachmentRepository.existsByUploadedById(user.getId())) {
            throw new ConflictException("User " + user.getEmployeeId() + " has tickets or comments and cannot be deleted");
        }
        int unassigned = ticketRepository.unassignAllFrom(user.getId());
        userRepository.delete(user);
        log.info("User {} deleted ({} tickets unassigned)", user.getUsername(), unassigned);
    }

    private User newUser(CreateUserRequest request, String username) {
        User user = new User();
        user.setEmployeeId(request.employeeId());
        user.setUsername(username);
        user.setPassword(passwordEncoder.encode(request.password()));
        user.setName(request.name());
        user.setEmail(request.email());
        user.setMobile(request.mobile());
        user.setDepartment(request.department());
        user.setDesignation(request.designation());
        user.setRole(request.role() != null ? request.role() : Role.EMPLOYEE);
        return user;
    }

    private User find(UUID id) {
        return userRepository.findById(id).orElseThrow(() -> ResourceNotFoundException.of("User"));
    }

    private static String usernameFor(CreateUserRequest request) {
        return notBlank(request.username()) ? request.username() : request.employeeId();
    }

    private static Map<String, String> rowData(CreateUserRequest request) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("employeeId", request.employeeId());
        data.put("username", request.username());
        data.put("name", request.name());
        data.put("email", request.email());
        data.put("role", request.role() != null ? request.role().toJson() : null);
        return data;
    }

    private static String column(CSVRecord record, String name) {
        if (!record.isMapped(name) || !record.isSet(name)) {
            return null;
        }
        String value = record.get(name);
        return value == null || value.isBlank() ? null : value;
    }

    private record PendingRow(int index, CreateUserRequest request, List<String> errors) {}

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
