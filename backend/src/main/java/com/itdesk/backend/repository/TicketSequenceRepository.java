package com.itdesk.backend.repository;

import com.itdesk.backend.domain.TicketSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface TicketSequenceRepository extends JpaRepository<TicketSequence, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM TicketSequence s WHERE s.name = :name")
    Optional<TicketSequence> findByNameForUpdate(@Param("name") String name);
}
