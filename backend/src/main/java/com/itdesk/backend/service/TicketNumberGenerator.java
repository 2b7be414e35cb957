package com.itdesk.backend.service;

import com.itdesk.backend.domain.TicketSequence;
import com.itdesk.backend.repository.TicketRepository;
import com.itdesk.backend.repository.TicketSequenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Gera números de chamado sequenciais. O contador é travado (SELECT ... FOR UPDATE)
 * até o commit da transação que insere o chamado, então criações concorrentes
 * esperam umas pelas outras em vez de repetir o número.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TicketNumberGenerator {

    private final TicketSequenceRepository sequenceRepository;
    private final TicketRepository ticketRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public String next() {
        TicketSequence sequence = sequenceRepository.findByNameForUpdate(TicketSequence.TICKETS)
                .orElseGet(this::createSequence);
        long value = sequence.next();
        sequenceRepository.save(sequence);
        return TicketLifecycle.formatTicketNumber(value);
    }

    /**
     * Garante que o contador exista, partindo da quantidade atual de chamados
     * (bases que já tinham chamados antes do contador).
     */
    @Transactional
    public void ensureInitialized() {
        if (sequenceRepository.existsById(TicketSequence.TICKETS)) {
            return;
        }
        long existing = ticketRepository.count();
        sequenceRepository.save(new TicketSequence(TicketSequence.TICKETS, existing));
        log.info("Ticket number sequence initialized at {}", existing);
    }

    private TicketSequence createSequence() {
        TicketSequence created = sequenceRepository.saveAndFlush(
                new TicketSequence(TicketSequence.TICKETS, ticketRepository.count()));
        // relê com lock para serializar com quem chegou junto
        return sequenceRepository.findByNameForUpdate(TicketSequence.TICKETS).orElse(created);
    }
}
