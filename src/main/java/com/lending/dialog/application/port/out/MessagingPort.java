package com.lending.dialog.application.port.out;

import com.lending.dialog.domain.entity.PromptSpec;

/**
 * Secondary (outbound) port: delivers prompts to the user's channel.
 * <p>
 * Channel rendering (buttons, list rows, templates) is the adapter's concern.
 * </p>
 */
public interface MessagingPort {

    /**
     * Sends one prompt.
     *
     * @param identity user identity
     * @param prompt   channel-agnostic prompt
     * @throws RuntimeException on delivery failure; the orchestrator logs and continues
     */
    void sendPrompt(String identity, PromptSpec prompt);
}
