package com.lending.dialog.domain.entity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.lending.dialog.domain.valueobject.Journey;
import com.lending.dialog.domain.valueobject.Language;
import com.lending.dialog.domain.valueobject.StepId;

/**
 * Conversation state for one user identity.
 * <p>
 * <b>IMMUTABLE:</b> every mutation returns a NEW instance. The orchestrator
 * builds the next session from the loaded one and hands it to the session
 * store only once the whole transition has succeeded, so an aborted
 * transition leaves the stored session untouched.
 * </p>
 *
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>identity is non-null, non-blank</li>
 * <li>journey is non-null; currentStep is null iff journey is NONE</li>
 * <li>answers, flags and offers are never null (empty when absent)</li>
 * <li>language is null until the user picks one, then survives resets</li>
 * </ul>
 */
public final class Session {

    public static final String FLAG_CONSENT_GIVEN = "consentGiven";
    public static final String FLAG_OFFERS_GENERATED = "offersGenerated";
    public static final String FLAG_OFFER_ACCEPTED = "offerAccepted";
    public static final String FLAG_KYC_COMPLETED = "kycCompleted";
    public static final String FLAG_SELFIE_RECEIVED = "selfieReceived";
    public static final String FLAG_NACH_COMPLETED = "nachCompleted";
    public static final String FLAG_AGREEMENT_SIGNED = "agreementSigned";
    public static final String FLAG_DECISION_COMPLETE = "decisionComplete";
    public static final String FLAG_LOAN_DISBURSED = "loanDisbursed";

    public static final String ANSWER_FULL_NAME = "full_name";
    public static final String ANSWER_DOB = "dob";
    public static final String ANSWER_EMPLOYMENT = "employment_status";
    public static final String ANSWER_MONTHLY_INCOME = "monthly_income";
    public static final String ANSWER_PURPOSE = "purpose";
    public static final String ANSWER_CHOSEN_OFFER = "chosen_offer";
    public static final String ANSWER_BANK_DETAILS = "bank_details";
    public static final String ANSWER_SUPPORT_QUESTION = "support_question";

    private final String identity;
    private final Journey journey;
    private final StepId currentStep;
    private final Map<String, Object> answers;
    private final Map<String, Boolean> flags;
    private final Language language;
    private final List<Offer> offers;
    private final Instant createdAt;
    private final Instant lastActivityAt;
    private final long version;

    // ─────────────────── Private Constructor ───────────────────

    private Session(String identity, Journey journey, StepId currentStep,
            Map<String, Object> answers, Map<String, Boolean> flags,
            Language language, List<Offer> offers,
            Instant createdAt, Instant lastActivityAt, long version) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be null or blank");
        }
        if (journey == null) {
            throw new IllegalArgumentException("journey cannot be null");
        }
        if (journey == Journey.NONE && currentStep != null) {
            throw new IllegalArgumentException("currentStep must be null when journey is NONE, got: " + currentStep);
        }
        if (lastActivityAt == null) {
            throw new IllegalArgumentException("lastActivityAt cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0, got: " + version);
        }

        this.identity = identity;
        this.journey = journey;
        this.currentStep = currentStep;
        this.answers = answers != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(answers))
                : Collections.emptyMap();
        this.flags = flags != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(flags))
                : Collections.emptyMap();
        this.language = language;
        this.offers = offers != null
                ? Collections.unmodifiableList(new ArrayList<>(offers))
                : Collections.emptyList();
        this.createdAt = createdAt != null ? createdAt : lastActivityAt;
        this.lastActivityAt = lastActivityAt;
        this.version = version;
    }

    // ─────────────────── Factory Methods ───────────────────

    /**
     * Creates the default session for an identity seen for the first time.
     *
     * @param identity user identity (e.g. phone number)
     * @param now      time of the first inbound event
     * @return session at the top-level menu
     */
    public static Session start(String identity, Instant now) {
        return new Session(identity, Journey.NONE, null, null, null, null, null, now, now, 0L);
    }

    /**
     * Reconstructs a session from stored data. Does not check the step against
     * the journey definition; the orchestrator does that after loading.
     */
    public static Session reconstruct(String identity, Journey journey, StepId currentStep,
            Map<String, Object> answers, Map<String, Boolean> flags,
            Language language, List<Offer> offers,
            Instant createdAt, Instant lastActivityAt, long version) {
        return new Session(identity, journey, currentStep, answers, flags,
                language, offers, createdAt, lastActivityAt, version);
    }

    // ─────────────────── Transitions ───────────────────

    /**
     * Enters a journey at the given step.
     *
     * @throws IllegalArgumentException if journey is NONE (use {@link #toMenu()})
     */
    public Session enter(Journey newJourney, StepId step) {
        if (newJourney == null || newJourney == Journey.NONE) {
            throw new IllegalArgumentException("enter requires an active journey, got: " + newJourney);
        }
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null when entering " + newJourney);
        }
        return copy(newJourney, step, answers, flags, language, offers, lastActivityAt);
    }

    /**
     * Moves to another step inside the current journey.
     */
    public Session moveTo(StepId step) {
        if (!journey.isActive()) {
            throw new IllegalStateException("Cannot move to " + step + " while journey is NONE for " + identity);
        }
        return copy(journey, step, answers, flags, language, offers, lastActivityAt);
    }

    /**
     * Leaves the active journey and returns to the top-level menu. Collected
     * data is kept.
     */
    public Session toMenu() {
        return copy(Journey.NONE, null, answers, flags, language, offers, lastActivityAt);
    }

    /**
     * Drops everything a previous application collected. Only the disbursement
     * flag survives so post-loan routing keeps working.
     */
    public Session clearApplication() {
        Map<String, Boolean> kept = new LinkedHashMap<>();
        if (flag(FLAG_LOAN_DISBURSED)) {
            kept.put(FLAG_LOAN_DISBURSED, Boolean.TRUE);
        }
        return copy(journey, currentStep, null, kept, language, null, lastActivityAt);
    }

    /**
     * Staleness reset: journey NONE, no answers, flags or offers. Language is kept.
     */
    public Session reset() {
        return copy(Journey.NONE, null, null, null, language, null, lastActivityAt);
    }

    public Session withAnswer(String field, Object value) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("answer field cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("answer value cannot be null for field " + field);
        }
        Map<String, Object> updated = new LinkedHashMap<>(answers);
        updated.put(field, value);
        return copy(journey, currentStep, updated, flags, language, offers, lastActivityAt);
    }

    public Session withFlag(String name, boolean value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("flag name cannot be null or blank");
        }
        Map<String, Boolean> updated = new LinkedHashMap<>(flags);
        updated.put(name, value);
        return copy(journey, currentStep, answers, updated, language, offers, lastActivityAt);
    }

    public Session withLanguage(Language newLanguage) {
        return copy(journey, currentStep, answers, flags, newLanguage, offers, lastActivityAt);
    }

    public Session withOffers(List<Offer> newOffers) {
        return copy(journey, currentStep, answers, flags, language, newOffers, lastActivityAt);
    }

    public Session touch(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        return copy(journey, currentStep, answers, flags, language, offers, now);
    }

    /**
     * Returns a copy carrying the given store version. Used by session stores only.
     */
    public Session withVersion(long newVersion) {
        return new Session(identity, journey, currentStep, answers, flags,
                language, offers, createdAt, lastActivityAt, newVersion);
    }

    private Session copy(Journey newJourney, StepId newStep,
            Map<String, Object> newAnswers, Map<String, Boolean> newFlags,
            Language newLanguage, List<Offer> newOffers, Instant newLastActivity) {
        return new Session(identity, newJourney, newStep, newAnswers, newFlags,
                newLanguage, newOffers, createdAt, newLastActivity, version);
    }

    // ─────────────────── Query Methods ───────────────────

    public boolean flag(String name) {
        return Boolean.TRUE.equals(flags.get(name));
    }

    public Optional<Object> answer(String field) {
        return Optional.ofNullable(answers.get(field));
    }

    public boolean hasOffers() {
        return !offers.isEmpty();
    }

    /**
     * Offer the user picked, if any.
     */
    public Optional<Offer> chosenOffer() {
        Object chosen = answers.get(ANSWER_CHOSEN_OFFER);
        if (!(chosen instanceof Integer)) {
            return Optional.empty();
        }
        int index = (Integer) chosen;
        return offers.stream().filter(o -> o.getIndex() == index).findFirst();
    }

    public boolean isInJourney() {
        return journey.isActive();
    }

    // ─────────────────── Getters ───────────────────

    public String getIdentity() {
        return identity;
    }

    public Journey getJourney() {
        return journey;
    }

    public StepId getCurrentStep() {
        return currentStep;
    }

    public Map<String, Object> getAnswers() {
        return answers;
    }

    public Map<String, Boolean> getFlags() {
        return flags;
    }

    public Language getLanguage() {
        return language;
    }

    public List<Offer> getOffers() {
        return offers;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public long getVersion() {
        return version;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Session that = (Session) o;
        return version == that.version
                && Objects.equals(identity, that.identity)
                && journey == that.journey
                && currentStep == that.currentStep
                && language == that.language
                && Objects.equals(answers, that.answers)
                && Objects.equals(flags, that.flags)
                && Objects.equals(offers, that.offers)
                && Objects.equals(lastActivityAt, that.lastActivityAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, journey, currentStep, language, answers, flags, offers, lastActivityAt, version);
    }

    @Override
    public String toString() {
        return "Session{identity='" + identity
                + "', journey=" + journey
                + ", currentStep=" + currentStep
                + ", language=" + language
                + ", answers=" + answers.keySet()
                + ", flags=" + flags
                + ", offers=" + offers.size()
                + ", lastActivityAt=" + lastActivityAt
                + ", version=" + version + "}";
    }
}
