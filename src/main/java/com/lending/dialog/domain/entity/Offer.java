package com.lending.dialog.domain.entity;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable loan offer returned by the decision gateway.
 * <p>
 * {@code index} is the 1-based selection key shown to the user. The gateway
 * returns offers best-first; the orchestrator re-indexes them after applying
 * the presentation cap.
 * </p>
 */
public final class Offer {

    private final int index;
    private final String offerId;
    private final BigDecimal amount;
    private final BigDecimal apr;
    private final int termMonths;
    private final BigDecimal processingFeePercent;
    private final BigDecimal monthlyEmi;

    public Offer(int index, String offerId, BigDecimal amount, BigDecimal apr, int termMonths,
            BigDecimal processingFeePercent, BigDecimal monthlyEmi) {
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1, got: " + index);
        }
        if (offerId == null || offerId.isBlank()) {
            throw new IllegalArgumentException("offerId cannot be null or blank");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive, got: " + amount);
        }
        if (apr == null || apr.signum() < 0) {
            throw new IllegalArgumentException("apr must be >= 0, got: " + apr);
        }
        if (termMonths < 1) {
            throw new IllegalArgumentException("termMonths must be >= 1, got: " + termMonths);
        }

        this.index = index;
        this.offerId = offerId;
        this.amount = amount;
        this.apr = apr;
        this.termMonths = termMonths;
        this.processingFeePercent = processingFeePercent != null ? processingFeePercent : BigDecimal.ZERO;
        this.monthlyEmi = monthlyEmi != null ? monthlyEmi : BigDecimal.ZERO;
    }

    /**
     * Returns a copy with a new selection index.
     */
    public Offer withIndex(int newIndex) {
        return new Offer(newIndex, offerId, amount, apr, termMonths, processingFeePercent, monthlyEmi);
    }

    /** Option id used for the selection button of this offer. */
    public String optionId() {
        return "offer_select_" + index;
    }

    public int getIndex() {
        return index;
    }

    public String getOfferId() {
        return offerId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getApr() {
        return apr;
    }

    public int getTermMonths() {
        return termMonths;
    }

    public BigDecimal getProcessingFeePercent() {
        return processingFeePercent;
    }

    public BigDecimal getMonthlyEmi() {
        return monthlyEmi;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Offer offer = (Offer) o;
        return index == offer.index
                && termMonths == offer.termMonths
                && Objects.equals(offerId, offer.offerId)
                && amount.compareTo(offer.amount) == 0
                && apr.compareTo(offer.apr) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, offerId, termMonths, amount.stripTrailingZeros(), apr.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "Offer{index=" + index + ", offerId='" + offerId + "', amount=" + amount
                + ", apr=" + apr + ", termMonths=" + termMonths + "}";
    }
}
