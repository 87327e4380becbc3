package com.lending.dialog.domain.valueobject;

/**
 * Top-level conversation tracks a user can be in.
 * <p>
 * The active journey decides which step table governs transitions.
 * NONE means the user is at the top-level menu.
 * </p>
 *
 * <pre>
 * Journeys:
 *   NONE ──[get loan]──→ ONBOARDING ──[approved]──→ POST_LOAN
 *   NONE ──[support]───→ SUPPORT (re-entrant)
 *   NONE ──[kyc]───────→ KYC ──→ POST_LOAN | NONE
 * </pre>
 */
public enum Journey {

    /** Top-level menu, no pending step */
    NONE,

    /** Loan application: profile, offers, KYC, mandate, agreement, decision */
    ONBOARDING,

    /** Question answering and agent escalation */
    SUPPORT,

    /** Standalone KYC re-verification */
    KYC,

    /** Menu for users with a disbursed loan */
    POST_LOAN;

    /**
     * Checks if the user is inside a journey with a pending step.
     *
     * @return true for every journey except NONE
     */
    public boolean isActive() {
        return this != NONE;
    }

    /**
     * Re-entrant journeys never reach a terminal step on their own.
     *
     * @return true for SUPPORT and POST_LOAN
     */
    public boolean isReentrant() {
        return this == SUPPORT || this == POST_LOAN;
    }
}
