package com.lending.dialog.application.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.lending.dialog.domain.entity.BankDetails;
import com.lending.dialog.domain.entity.PromptOption;
import com.lending.dialog.domain.entity.ValidationResult;
import com.lending.dialog.domain.valueobject.FieldKind;
import com.lending.dialog.domain.valueobject.ValidationError;

/**
 * Parses raw user input into typed answer values.
 * <p>
 * Never throws for malformed input: every rejection is a
 * {@link ValidationResult#invalid(ValidationError)} the orchestrator turns
 * into a localized hint.
 * </p>
 *
 * <p>
 * <b>Thread-safe:</b> no mutable state; "today" comes from the injected clock.
 * </p>
 */
public class FieldValidator {

    private static final Logger log = Logger.getLogger(FieldValidator.class.getName());

    /** Strict patterns; {@code uuuu} so STRICT resolution accepts plain years. */
    static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("dd-MM-uuuu"),
            strict("dd/MM/uuuu"),
            strict("dd.MM.uuuu"),
            strict("uuuu-MM-dd"),
            strict("d-M-uuuu"),
            strict("d/M/uuuu"));

    private static final Pattern CURRENCY_NOISE = Pattern.compile("(?i)(₹|rs\\.?|inr|\\$|,|_|\\s)");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern IFSC = Pattern.compile("^[A-Z]{4}0[A-Z0-9]{6}$");
    private static final Pattern ACCOUNT = Pattern.compile("^\\d{9,18}$");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!?\\s]+$");

    private static final Set<String> AFFIRMATIVE = Set.of(
            "yes", "y", "yeah", "yep", "ok", "okay", "sure", "agree", "i agree", "accept",
            "consent", "haan", "haanji", "han", "ha", "ji", "हाँ", "हां", "जी", "जी हाँ", "ठीक है",
            "consent_yes", "agree_yes");
    private static final Set<String> NEGATIVE = Set.of(
            "no", "n", "nah", "na", "nope", "stop", "reject", "decline", "nahi", "nahin",
            "नहीं", "ना", "consent_no", "agree_no");

    private final Clock clock;
    private final int minAge;
    private final int maxAge;

    public FieldValidator(Clock clock, int minAge, int maxAge) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (minAge < 0 || maxAge < minAge) {
            throw new IllegalArgumentException("invalid age window " + minAge + ".." + maxAge);
        }
        this.clock = clock;
        this.minAge = minAge;
        this.maxAge = maxAge;
    }

    /**
     * Validates raw input for a field kind.
     *
     * @param kind    validator selected by the step
     * @param raw     option id or typed text, may be null
     * @param context currently valid options and attachment
     * @return typed value or validation error
     */
    public ValidationResult validate(FieldKind kind, String raw, Context context) {
        Context ctx = context != null ? context : Context.empty();
        String input = raw != null ? raw.trim() : "";

        return switch (kind) {
            case NAME -> validateName(input);
            case TEXT -> input.isEmpty()
                    ? ValidationResult.invalid(ValidationError.EMPTY)
                    : ValidationResult.ok(input);
            case DATE -> validateDate(input);
            case NUMERIC -> validateNumeric(input);
            case BOOLEAN -> validateBoolean(input);
            case CHOICE -> validateChoice(input, ctx.options());
            case DOCUMENT -> ctx.mediaId() != null && !ctx.mediaId().isBlank()
                    ? ValidationResult.ok(ctx.mediaId())
                    : ValidationResult.invalid(ValidationError.MISSING_DOCUMENT);
            case BANK_DETAILS -> validateBankDetails(input);
            case NONE -> ValidationResult.ok(Boolean.TRUE);
        };
    }

    // ─────────────────── Field Rules ───────────────────

    private ValidationResult validateName(String input) {
        String collapsed = input.replaceAll("\\s+", " ");
        if (collapsed.isEmpty()) {
            return ValidationResult.invalid(ValidationError.EMPTY);
        }
        return ValidationResult.ok(collapsed);
    }

    private ValidationResult validateDate(String input) {
        if (input.isEmpty()) {
            return ValidationResult.invalid(ValidationError.EMPTY);
        }
        LocalDate dob = parseDate(input);
        if (dob == null) {
            return ValidationResult.invalid(ValidationError.UNPARSEABLE);
        }
        LocalDate today = LocalDate.now(clock);
        if (dob.isAfter(today)) {
            return ValidationResult.invalid(ValidationError.FUTURE_DATE);
        }
        int age = Period.between(dob, today).getYears();
        if (age < minAge) {
            return ValidationResult.invalid(ValidationError.UNDERAGE);
        }
        if (age > maxAge) {
            return ValidationResult.invalid(ValidationError.OVERAGE);
        }
        return ValidationResult.ok(dob);
    }

    private static LocalDate parseDate(String input) {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(input, format);
            } catch (DateTimeParseException e) {
                log.finest(String.format("action=date_format_miss pattern=%s", format));
            }
        }
        return null;
    }

    private ValidationResult validateNumeric(String input) {
        String cleaned = CURRENCY_NOISE.matcher(input).replaceAll("");
        if (cleaned.isEmpty()) {
            return ValidationResult.invalid(input.isEmpty() ? ValidationError.EMPTY : ValidationError.NOT_NUMERIC);
        }
        // Exponent notation is rejected before BigDecimal can expand it.
        if (!PLAIN_DECIMAL.matcher(cleaned).matches()) {
            return ValidationResult.invalid(ValidationError.NOT_NUMERIC);
        }
        BigDecimal amount = new BigDecimal(cleaned).setScale(2, RoundingMode.HALF_UP);
        if (amount.signum() <= 0) {
            return ValidationResult.invalid(ValidationError.NON_POSITIVE);
        }
        return ValidationResult.ok(amount);
    }

    private ValidationResult validateBoolean(String input) {
        if (input.isEmpty()) {
            return ValidationResult.invalid(ValidationError.EMPTY);
        }
        String normalized = TRAILING_PUNCTUATION.matcher(input.toLowerCase(Locale.ROOT)).replaceAll("");
        if (AFFIRMATIVE.contains(normalized)) {
            return ValidationResult.ok(Boolean.TRUE);
        }
        if (NEGATIVE.contains(normalized)) {
            return ValidationResult.ok(Boolean.FALSE);
        }
        return ValidationResult.invalid(ValidationError.AMBIGUOUS);
    }

    private ValidationResult validateChoice(String input, List<PromptOption> options) {
        if (input.isEmpty()) {
            return ValidationResult.invalid(ValidationError.EMPTY);
        }
        for (PromptOption option : options) {
            if (option.optionId().equals(input)) {
                return ValidationResult.ok(option.optionId());
            }
        }
        for (PromptOption option : options) {
            if (option.label().equalsIgnoreCase(input)) {
                return ValidationResult.ok(option.optionId());
            }
        }
        if (input.matches("\\d{1,2}")) {
            int position = Integer.parseInt(input);
            if (position >= 1 && position <= options.size()) {
                return ValidationResult.ok(options.get(position - 1).optionId());
            }
        }
        return ValidationResult.invalid(ValidationError.UNKNOWN_OPTION);
    }

    private ValidationResult validateBankDetails(String input) {
        if (input.isEmpty()) {
            return ValidationResult.invalid(ValidationError.EMPTY);
        }
        String[] tokens = input.split("[\\s,;]+");
        if (tokens.length != 2) {
            return ValidationResult.invalid(ValidationError.MALFORMED_BANK_DETAILS);
        }
        String ifsc = tokens[0].toUpperCase(Locale.ROOT);
        String account = tokens[1];
        if (!IFSC.matcher(ifsc).matches() || !ACCOUNT.matcher(account).matches()) {
            return ValidationResult.invalid(ValidationError.MALFORMED_BANK_DETAILS);
        }
        return ValidationResult.ok(new BankDetails(ifsc, account));
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    // ─────────────────── Context ───────────────────

    /**
     * What the current step accepts besides the raw text.
     *
     * @param options currently valid options for CHOICE fields
     * @param mediaId attachment id for DOCUMENT fields
     */
    public record Context(List<PromptOption> options, String mediaId) {

        public Context {
            options = options != null ? List.copyOf(options) : Collections.emptyList();
        }

        public static Context empty() {
            return new Context(null, null);
        }

        public static Context withOptions(List<PromptOption> options) {
            return new Context(options, null);
        }
    }
}
