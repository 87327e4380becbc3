package com.lending.dialog.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.lending.dialog.domain.entity.BankDetails;
import com.lending.dialog.domain.entity.PromptOption;
import com.lending.dialog.domain.entity.ValidationResult;
import com.lending.dialog.domain.valueobject.FieldKind;
import com.lending.dialog.domain.valueobject.ValidationError;

class FieldValidatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private final FieldValidator validator = new FieldValidator(CLOCK, 18, 75);

    // ─────────────────── Dates ───────────────────

    @ParameterizedTest
    @ValueSource(strings = { "20-05-1990", "20/05/1990", "20.05.1990", "1990-05-20", "20-5-1990", "20/5/1990" })
    void testDate_AcceptedFormats(String input) {
        // When
        ValidationResult result = validator.validate(FieldKind.DATE, input, FieldValidator.Context.empty());

        // Then
        assertTrue(result.isValid());
        assertEquals(LocalDate.of(1990, 5, 20), result.getValue());
    }

    @Test
    void testDate_EveryFormatRoundTrips() {
        LocalDate dob = LocalDate.of(1988, 11, 3);
        for (DateTimeFormatter format : FieldValidator.DATE_FORMATS) {
            ValidationResult result = validator.validate(FieldKind.DATE, format.format(dob),
                    FieldValidator.Context.empty());

            assertEquals(dob, result.getValue(), "format " + format);
        }
    }

    @Test
    void testDate_ImpossibleDateRejected() {
        ValidationResult result = validator.validate(FieldKind.DATE, "31-02-1990", FieldValidator.Context.empty());

        assertEquals(ValidationError.UNPARSEABLE, result.getError());
    }

    @Test
    void testDate_AgeWindow() {
        assertEquals(ValidationError.UNDERAGE,
                validator.validate(FieldKind.DATE, "16-01-2008", FieldValidator.Context.empty()).getError());
        assertTrue(validator.validate(FieldKind.DATE, "15-01-2008", FieldValidator.Context.empty()).isValid());
        assertEquals(ValidationError.OVERAGE,
                validator.validate(FieldKind.DATE, "01-01-1940", FieldValidator.Context.empty()).getError());
        assertEquals(ValidationError.FUTURE_DATE,
                validator.validate(FieldKind.DATE, "01-01-2027", FieldValidator.Context.empty()).getError());
    }

    // ─────────────────── Amounts ───────────────────

    @Test
    void testNumeric_CurrencyNoiseStripped() {
        // When
        ValidationResult result = validator.validate(FieldKind.NUMERIC, "₹25,000", FieldValidator.Context.empty());

        // Then
        assertTrue(result.isValid());
        assertEquals(new BigDecimal("25000.00"), result.getValue());
    }

    @Test
    void testNumeric_RejectsNegativeAndText() {
        assertEquals(ValidationError.NON_POSITIVE,
                validator.validate(FieldKind.NUMERIC, "-500", FieldValidator.Context.empty()).getError());
        assertEquals(ValidationError.NON_POSITIVE,
                validator.validate(FieldKind.NUMERIC, "0", FieldValidator.Context.empty()).getError());
        assertEquals(ValidationError.NOT_NUMERIC,
                validator.validate(FieldKind.NUMERIC, "fifty thousand", FieldValidator.Context.empty()).getError());
        assertEquals(ValidationError.EMPTY,
                validator.validate(FieldKind.NUMERIC, "   ", FieldValidator.Context.empty()).getError());
    }

    @ParameterizedTest
    @ValueSource(strings = { "1e999999999", "5E4", "0x1F", "12.5.3" })
    void testNumeric_ExponentAndOddFormsAreNotNumeric(String input) {
        ValidationResult result = validator.validate(FieldKind.NUMERIC, input, FieldValidator.Context.empty());

        assertEquals(ValidationError.NOT_NUMERIC, result.getError());
    }

    @Test
    void testNumeric_RoundsToZeroIsNonPositive() {
        assertEquals(ValidationError.NON_POSITIVE,
                validator.validate(FieldKind.NUMERIC, "0.001", FieldValidator.Context.empty()).getError());
        assertEquals(ValidationError.NON_POSITIVE,
                validator.validate(FieldKind.NUMERIC, "0.004", FieldValidator.Context.empty()).getError());
        assertEquals(new BigDecimal("0.01"),
                validator.validate(FieldKind.NUMERIC, "0.005", FieldValidator.Context.empty()).getValue());
    }

    @ParameterizedTest
    @ValueSource(strings = { "50000rs", "50000 Rs.", "Rs.50,000", "INR 50000", "50000inr" })
    void testNumeric_CurrencyTokenAnywhere(String input) {
        ValidationResult result = validator.validate(FieldKind.NUMERIC, input, FieldValidator.Context.empty());

        assertEquals(new BigDecimal("50000.00"), result.getValue());
    }

    // ─────────────────── Yes / No ───────────────────

    @ParameterizedTest
    @ValueSource(strings = { "yes", "Yes!", "ok", "I agree", "haan", "हाँ", "consent_yes" })
    void testBoolean_Affirmative(String input) {
        ValidationResult result = validator.validate(FieldKind.BOOLEAN, input, FieldValidator.Context.empty());

        assertEquals(Boolean.TRUE, result.getValue());
    }

    @ParameterizedTest
    @ValueSource(strings = { "no", "Nahi", "नहीं", "agree_no" })
    void testBoolean_Negative(String input) {
        ValidationResult result = validator.validate(FieldKind.BOOLEAN, input, FieldValidator.Context.empty());

        assertEquals(Boolean.FALSE, result.getValue());
    }

    @Test
    void testBoolean_Ambiguous() {
        ValidationResult result = validator.validate(FieldKind.BOOLEAN, "maybe later", FieldValidator.Context.empty());

        assertEquals(ValidationError.AMBIGUOUS, result.getError());
    }

    // ─────────────────── Choices ───────────────────

    @Test
    void testChoice_ByIdLabelOrPosition() {
        // Given
        FieldValidator.Context context = FieldValidator.Context.withOptions(List.of(
                new PromptOption("emp_salaried", "Salaried"),
                new PromptOption("emp_self_employed", "Self-Employed"),
                new PromptOption("emp_others", "Others")));

        // Then
        assertEquals("emp_others", validator.validate(FieldKind.CHOICE, "emp_others", context).getValue());
        assertEquals("emp_self_employed", validator.validate(FieldKind.CHOICE, "self-employed", context).getValue());
        assertEquals("emp_salaried", validator.validate(FieldKind.CHOICE, "1", context).getValue());
        assertEquals(ValidationError.UNKNOWN_OPTION, validator.validate(FieldKind.CHOICE, "4", context).getError());
        assertEquals(ValidationError.UNKNOWN_OPTION,
                validator.validate(FieldKind.CHOICE, "student", context).getError());
    }

    // ─────────────────── Name, bank details, documents ───────────────────

    @Test
    void testName_WhitespaceCollapsed() {
        ValidationResult result = validator.validate(FieldKind.NAME, "  Jane \t  Doe ", FieldValidator.Context.empty());

        assertEquals("Jane Doe", result.getValue());
    }

    @Test
    void testBankDetails() {
        // When
        ValidationResult ok = validator.validate(FieldKind.BANK_DETAILS, "hdfc0001234 123456789012",
                FieldValidator.Context.empty());

        // Then
        assertEquals(new BankDetails("HDFC0001234", "123456789012"), ok.getValue());
        assertEquals(ValidationError.MALFORMED_BANK_DETAILS, validator.validate(FieldKind.BANK_DETAILS,
                "HDFC1234 123", FieldValidator.Context.empty()).getError());
        assertEquals(ValidationError.MALFORMED_BANK_DETAILS, validator.validate(FieldKind.BANK_DETAILS,
                "123456789012", FieldValidator.Context.empty()).getError());
    }

    @Test
    void testDocument_RequiresMedia() {
        assertFalse(validator.validate(FieldKind.DOCUMENT, "here it is", FieldValidator.Context.empty()).isValid());
        assertEquals("media-42",
                validator.validate(FieldKind.DOCUMENT, null, new FieldValidator.Context(null, "media-42")).getValue());
    }
}
