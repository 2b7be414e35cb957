package com.itdesk.backend.repository;

import com.itdesk.backend.domain.Ticket;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TicketRepository extends JpaRepository<Ticket, UUID>, JpaSpecificationExecutor<Ticket> {

    /**
     * Lê o chamado com lock de escrita: o status antigo capturado aqui é o mesmo
     * que será sobrescrito no commit.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Ticket t WHERE t.id = :id")
    Optional<Ticket> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByCreatedById(UUID userId);

    @Modifying
    @Query("UPDATE Ticket t SET t.assignedTo = null WHERE t.assignedTo.id = :userId")
    int unassignAllFrom(@Param("userId") UUID userId);
}
