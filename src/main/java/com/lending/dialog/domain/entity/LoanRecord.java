package com.lending.dialog.domain.entity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Persisted outcome of an onboarding: one row per identity, updated in place
 * when the user applies again.
 */
public final class LoanRecord {

    public static final String STATUS_APPROVED = "approved";
    public static final String STATUS_DECLINED = "declined";

    private final String identity;
    private final String referenceId;
    private final String status;
    private final String fullName;
    private final BigDecimal approvedAmount;
    private final BigDecimal apr;
    private final int termMonths;
    private final String purpose;
    private final String employment;
    private final BigDecimal monthlyIncome;
    private final String reason;
    private final Instant createdAt;
    private final Instant updatedAt;

    public LoanRecord(String identity, String referenceId, String status, String fullName,
            BigDecimal approvedAmount, BigDecimal apr, int termMonths, String purpose,
            String employment, BigDecimal monthlyIncome, String reason,
            Instant createdAt, Instant updatedAt) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be null or blank");
        }
        if (referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException("referenceId cannot be null or blank");
        }
        if (!STATUS_APPROVED.equals(status) && !STATUS_DECLINED.equals(status)) {
            throw new IllegalArgumentException("status must be approved or declined, got: " + status);
        }
        this.identity = identity;
        this.referenceId = referenceId;
        this.status = status;
        this.fullName = fullName;
        this.approvedAmount = approvedAmount;
        this.apr = apr;
        this.termMonths = termMonths;
        this.purpose = purpose;
        this.employment = employment;
        this.monthlyIncome = monthlyIncome;
        this.reason = reason;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt != null ? updatedAt : createdAt;
    }

    /**
     * Builds the record written after the final decision.
     */
    public static LoanRecord of(LoanApplication application, FinalDecision decision, Instant now) {
        return new LoanRecord(
                application.getIdentity(),
                decision.getReferenceId(),
                decision.isApproved() ? STATUS_APPROVED : STATUS_DECLINED,
                application.getFullName(),
                decision.getApprovedAmount(),
                decision.getApr(),
                decision.getTermMonths(),
                application.getPurpose(),
                application.getEmployment(),
                application.getMonthlyIncome(),
                decision.getReason(),
                now,
                now);
    }

    public boolean isApproved() {
        return STATUS_APPROVED.equals(status);
    }

    // ─────────────────── Getters ───────────────────

    public String getIdentity() {
        return identity;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public String getStatus() {
        return status;
    }

    public String getFullName() {
        return fullName;
    }

    public BigDecimal getApprovedAmount() {
        return approvedAmount;
    }

    public BigDecimal getApr() {
        return apr;
    }

    public int getTermMonths() {
        return termMonths;
    }

    public String getPurpose() {
        return purpose;
    }

    public String getEmployment() {
        return employment;
    }

    public BigDecimal getMonthlyIncome() {
        return monthlyIncome;
    }

    public String getReason() {
        return reason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        LoanRecord that = (LoanRecord) o;
        return identity.equals(that.identity) && referenceId.equals(that.referenceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, referenceId);
    }

    @Override
    public String toString() {
        return "LoanRecord{identity='" + identity + "', ref=" + referenceId + ", status=" + status
                + ", amount=" + approvedAmount + "}";
    }
}
