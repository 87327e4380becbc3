package com.lending.dialog.application.port.in;

import java.util.List;

import com.lending.dialog.domain.entity.PromptSpec;
import com.lending.dialog.domain.entity.Session;

/**
 * Result of handling one inbound event.
 *
 * @param kind    what happened
 * @param prompts prompts emitted to the user, in order (empty on TIMED_OUT)
 * @param session session as persisted, or the loaded one when nothing was saved
 */
public record DialogOutcome(Kind kind, List<PromptSpec> prompts, Session session) {

    public enum Kind {
        /** Input accepted, or a journey was entered or left */
        ADVANCED,
        /** Input rejected; same step re-prompted with a hint */
        VALIDATION_FAILED,
        /** No journey matched at the top-level menu */
        ROUTING_MISS,
        /** Decision or support gateway failed; session not saved */
        GATEWAY_FAILED,
        /** Deadline passed during a gateway call; nothing persisted or sent */
        TIMED_OUT,
        /** Stored session violated its invariant and was reset */
        STATE_RESET,
        /** Session was reset after inactivity */
        SESSION_RESET
    }

    public DialogOutcome {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        prompts = prompts != null ? List.copyOf(prompts) : List.of();
    }

    public boolean persisted() {
        return kind != Kind.GATEWAY_FAILED && kind != Kind.TIMED_OUT;
    }
}
