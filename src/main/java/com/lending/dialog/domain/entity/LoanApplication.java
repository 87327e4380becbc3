package com.lending.dialog.domain.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.Period;
import java.util.Objects;

/**
 * Read-only projection of onboarding answers handed to the decision gateway.
 * <p>
 * The requested amount is the chosen offer's amount when the user picked
 * one; before offers exist it is {@code min(500000, 2 x monthlyIncome)}.
 * </p>
 */
public final class LoanApplication {

    static final BigDecimal REQUEST_CEILING = new BigDecimal("500000.00");

    private final String identity;
    private final String fullName;
    private final LocalDate dateOfBirth;
    private final int age;
    private final String employment;
    private final BigDecimal monthlyIncome;
    private final String purpose;
    private final boolean consent;
    private final BigDecimal requestedAmount;

    public LoanApplication(String identity, String fullName, LocalDate dateOfBirth, int age,
            String employment, BigDecimal monthlyIncome, String purpose, boolean consent,
            BigDecimal requestedAmount) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be null or blank");
        }
        if (monthlyIncome == null) {
            throw new IllegalArgumentException("monthlyIncome cannot be null for " + identity);
        }
        this.identity = identity;
        this.fullName = fullName;
        this.dateOfBirth = dateOfBirth;
        this.age = age;
        this.employment = employment;
        this.monthlyIncome = monthlyIncome;
        this.purpose = purpose;
        this.consent = consent;
        this.requestedAmount = requestedAmount;
    }

    /**
     * Builds the projection from a session's answers.
     *
     * @param session session carrying onboarding answers
     * @param today   reference date for the age computation
     * @throws IllegalArgumentException if the income answer is missing
     */
    public static LoanApplication from(Session session, LocalDate today) {
        Object incomeAnswer = session.getAnswers().get(Session.ANSWER_MONTHLY_INCOME);
        if (!(incomeAnswer instanceof BigDecimal)) {
            throw new IllegalArgumentException("monthly_income missing for " + session.getIdentity());
        }
        BigDecimal income = (BigDecimal) incomeAnswer;

        LocalDate dob = session.answer(Session.ANSWER_DOB)
                .filter(LocalDate.class::isInstance)
                .map(LocalDate.class::cast)
                .orElse(null);
        int age = dob != null ? Period.between(dob, today).getYears() : 0;

        BigDecimal requested = session.chosenOffer()
                .map(Offer::getAmount)
                .orElseGet(() -> income.multiply(BigDecimal.valueOf(2)).min(REQUEST_CEILING));

        return new LoanApplication(
                session.getIdentity(),
                stringAnswer(session, Session.ANSWER_FULL_NAME),
                dob,
                age,
                stringAnswer(session, Session.ANSWER_EMPLOYMENT),
                income,
                stringAnswer(session, Session.ANSWER_PURPOSE),
                session.flag(Session.FLAG_CONSENT_GIVEN),
                requested.setScale(2, RoundingMode.HALF_UP));
    }

    private static String stringAnswer(Session session, String field) {
        return session.answer(field).map(Object::toString).orElse(null);
    }

    // ─────────────────── Getters ───────────────────

    public String getIdentity() {
        return identity;
    }

    public String getFullName() {
        return fullName;
    }

    public LocalDate getDateOfBirth() {
        return dateOfBirth;
    }

    public int getAge() {
        return age;
    }

    public String getEmployment() {
        return employment;
    }

    public BigDecimal getMonthlyIncome() {
        return monthlyIncome;
    }

    public String getPurpose() {
        return purpose;
    }

    public boolean isConsent() {
        return consent;
    }

    public BigDecimal getRequestedAmount() {
        return requestedAmount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        LoanApplication that = (LoanApplication) o;
        return age == that.age && consent == that.consent
                && identity.equals(that.identity)
                && Objects.equals(fullName, that.fullName)
                && Objects.equals(dateOfBirth, that.dateOfBirth)
                && Objects.equals(employment, that.employment)
                && monthlyIncome.compareTo(that.monthlyIncome) == 0
                && Objects.equals(purpose, that.purpose)
                && Objects.equals(requestedAmount, that.requestedAmount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, fullName, dateOfBirth, age, employment, purpose, consent);
    }

    @Override
    public String toString() {
        return "LoanApplication{identity='" + identity + "', age=" + age
                + ", employment=" + employment + ", monthlyIncome=" + monthlyIncome
                + ", purpose=" + purpose + ", requestedAmount=" + requestedAmount + "}";
    }
}
