package com.itdesk.backend.config;

import com.itdesk.backend.domain.User;
import com.itdesk.backend.domain.enums.Role;
import com.itdesk.backend.repository.UserRepository;
import com.itdesk.backend.service.TicketNumberGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
@Slf4j
public class DataInitializer {

    @Value("${itdesk.admin.employee-id:EMP001}")
    private String adminEmployeeId;

    @Value("${itdesk.admin.username:admin}")
    private String adminUsername;

    @Value("${itdesk.admin.password}")
    private String adminPassword;

    @Value("${itdesk.admin.name:Administrator}")
    private String adminName;

    @Value("${itdesk.admin.email:admin@company.com}")
    private String adminEmail;

    @Value("${itdesk.bootstrap.sample-users:false}")
    private boolean sampleUsers;

    @Bean
    CommandLineRunner initDatabase(UserRepository userRepository, PasswordEncoder passwordEncoder,
                                   TicketNumberGenerator ticketNumberGenerator) {
        return args -> {
            ticketNumberGenerator.ensureInitialized();

            // Admin só é criado quando ainda não existe; senha não é sobrescrita depois
            if (userRepository.findByUsername(adminUsername).isPresent()) {
                return;
            }

            User admin = new User();
            admin.setEmployeeId(adminEmployeeId);
            admin.setUsername(adminUsername);
            admin.setPassword(passwordEncoder.encode(adminPassword));
            admin.setName(adminName);
            admin.setEmail(adminEmail);
            admin.setRole(Role.ADMIN);
            admin.setDepartment("IT");
            admin.setDesignation("System Administrator");
            userRepository.save(admin);
            log.info("Bootstrap admin '{}' ({}) created", adminUsername, adminEmployeeId);

            if (sampleUsers) {
                createSample(userRepository, passwordEncoder, "EMP002", "john.smith", "John Smith",
                        "IT", "Support Agent", Role.AGENT);
                createSample(userRepository, passwordEncoder, "EMP003", "sarah.johnson", "Sarah Johnson",
                        "IT", "Support Agent", Role.AGENT);
                createSample(userRepository, passwordEncoder, "EMP004", "michael.chen", "Michael Chen",
                        "HR", "HR Specialist", Role.EMPLOYEE);
                log.info("Sample users created");
            }
        };
    }

    private void createSample(UserRepository userRepository, PasswordEncoder passwordEncoder, String employeeId,
                              String username, String name, String department, String designation, Role role) {
        if (userRepository.existsByEmployeeId(employeeId) || userRepository.existsByUsername(username)) {
            return;
        }
        User user = new User();
        user.setEmployeeId(employeeId);
        user.setUsername(username);
        user.setPassword(passwordEncoder.encode("password123"));
        user.setName(name);
        user.setEmail(username + "@company.com");
        user.setDepartment(department);
        user.setDesignation(designation);
        user.setRole(role);
        userRepository.save(user);
    }
}
