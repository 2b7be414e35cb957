package com.itdesk.backend.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contador nomeado que gera os números de chamado (TKT-001, TKT-002...).
 * A linha é lida com lock pessimista na mesma transação do insert do chamado.
 */
@Data
@Entity
@Table(name = "ticket_sequences")
@NoArgsConstructor
@AllArgsConstructor
public class TicketSequence {

    public static final String TICKETS = "tickets";

    @Id
    @Column(length = 64)
    private String name;

    @Column(name = "last_value", nullable = false)
    private long lastValue;

    public long next() {
        return ++lastValue;
    }
}
