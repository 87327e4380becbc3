package com.lending.dialog.domain.valueobject;

/**
 * Addressable positions across all journeys.
 * <p>
 * A step id on its own carries no successor. Ordering is defined per journey
 * by the journey definition, so the same id (e.g. KYC_ACK) can appear in
 * more than one journey.
 * </p>
 */
public enum StepId {

    LANGUAGE_SELECT,
    INTENT_CONFIRM,
    NAME,
    DOB,
    EMPLOYMENT,
    INCOME,
    PURPOSE,
    CONSENT,
    OFFER_GENERATION,
    OFFER_SELECTION,
    KYC_ACK,
    SELFIE_ACK,
    BANK_DETAILS,
    NACH_ACK,
    AGREEMENT_ACK,
    FINAL_DECISION,
    SUPPORT_QUERY,
    POST_LOAN_MENU;

    /**
     * Lenient lookup used when reconstructing stored sessions.
     *
     * @param name stored step name, may be null
     * @return matching step, or null if the name is unknown
     */
    public static StepId fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return StepId.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
