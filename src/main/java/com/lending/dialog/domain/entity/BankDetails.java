package com.lending.dialog.domain.entity;

import java.util.Objects;

/**
 * Disbursement account captured during onboarding.
 */
public final class BankDetails {

    private final String ifsc;
    private final String accountNumber;

    public BankDetails(String ifsc, String accountNumber) {
        if (ifsc == null || ifsc.isBlank()) {
            throw new IllegalArgumentException("ifsc cannot be null or blank");
        }
        if (accountNumber == null || accountNumber.isBlank()) {
            throw new IllegalArgumentException("accountNumber cannot be null or blank");
        }
        this.ifsc = ifsc;
        this.accountNumber = accountNumber;
    }

    /**
     * Account number with all but the last four digits hidden.
     */
    public String maskedAccountNumber() {
        int visible = Math.min(4, accountNumber.length());
        return "X".repeat(accountNumber.length() - visible)
                + accountNumber.substring(accountNumber.length() - visible);
    }

    public String getIfsc() {
        return ifsc;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        BankDetails that = (BankDetails) o;
        return ifsc.equals(that.ifsc) && accountNumber.equals(that.accountNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ifsc, accountNumber);
    }

    @Override
    public String toString() {
        return "BankDetails{ifsc='" + ifsc + "', account='" + maskedAccountNumber() + "'}";
    }
}
