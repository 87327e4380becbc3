package com.lending.dialog.domain.entity;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Final credit decision: approved with terms, or rejected with a reason.
 */
public final class FinalDecision {

    private final boolean approved;
    private final String referenceId;
    private final BigDecimal approvedAmount;
    private final BigDecimal apr;
    private final int termMonths;
    private final String reason;

    private FinalDecision(boolean approved, String referenceId, BigDecimal approvedAmount,
            BigDecimal apr, int termMonths, String reason) {
        if (referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException("referenceId cannot be null or blank");
        }
        this.approved = approved;
        this.referenceId = referenceId;
        this.approvedAmount = approvedAmount;
        this.apr = apr;
        this.termMonths = termMonths;
        this.reason = reason;
    }

    public static FinalDecision approved(String referenceId, BigDecimal approvedAmount,
            BigDecimal apr, int termMonths) {
        if (approvedAmount == null || approvedAmount.signum() <= 0) {
            throw new IllegalArgumentException("approvedAmount must be positive, got: " + approvedAmount);
        }
        if (termMonths < 1) {
            throw new IllegalArgumentException("termMonths must be >= 1, got: " + termMonths);
        }
        return new FinalDecision(true, referenceId, approvedAmount, apr, termMonths, null);
    }

    public static FinalDecision rejected(String referenceId, String reason) {
        return new FinalDecision(false, referenceId, null, null, 0, reason);
    }

    public boolean isApproved() {
        return approved;
    }

    public String getReferenceId() {
        return referenceId;
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

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        FinalDecision that = (FinalDecision) o;
        return approved == that.approved && referenceId.equals(that.referenceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(approved, referenceId);
    }

    @Override
    public String toString() {
        return approved
                ? "FinalDecision{approved, ref=" + referenceId + ", amount=" + approvedAmount
                        + ", apr=" + apr + ", termMonths=" + termMonths + "}"
                : "FinalDecision{rejected, ref=" + referenceId + ", reason=" + reason + "}";
    }
}
