package com.lending.dialog.application.port.in;

import com.lending.dialog.domain.entity.InboundEvent;

/**
 * Primary (inbound) port: entry point for every user message.
 * <p>
 * For one event the engine:
 * <ol>
 * <li><b>Loads</b> the identity's session under the per-identity lock</li>
 * <li><b>Decides</b> journey, pending step and validation outcome</li>
 * <li><b>Persists</b> the next session, then emits the prompts</li>
 * </ol>
 * </p>
 */
public interface HandleInboundEventUseCase {

    /**
     * Processes one inbound event.
     *
     * @param event the inbound event
     * @return what happened and which prompts were emitted
     * @throws com.lending.dialog.application.exception.SessionStoreException if the
     *         session cannot be loaded or saved; the caller should redeliver
     */
    DialogOutcome handle(InboundEvent event);
}
