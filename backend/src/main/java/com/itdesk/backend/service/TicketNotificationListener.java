package com.itdesk.backend.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Só repassa eventos de transações que realmente fizeram commit. */
@Component
@RequiredArgsConstructor
public class TicketNotificationListener {

    private final NotificationDispatcher dispatcher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTicketEvent(TicketNotificationEvent event) {
        dispatcher.dispatch(event);
    }
}
