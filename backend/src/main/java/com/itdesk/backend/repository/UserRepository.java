package com.itdesk.backend.repository;

import com.itdesk.backend.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    // Login aceita username ou matrícula (employeeId)
    Optional<User> findByUsernameOrEmployeeId(String username, String employeeId);

    Optional<User> findByUsername(String username);

    Optional<User> findByEmployeeId(String employeeId);

    boolean existsByUsername(String username);

    boolean existsByEmployeeId(String employeeId);

    List<User> findAllByOrderByNameAsc();
}
