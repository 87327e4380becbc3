package com.lending.dialog.domain.entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.lending.dialog.domain.valueobject.FieldKind;
import com.lending.dialog.domain.valueobject.InputKind;
import com.lending.dialog.domain.valueobject.StepEffect;
import com.lending.dialog.domain.valueobject.StepId;

/**
 * Static description of one step in a journey.
 * <p>
 * A step declares what it expects (input kind and validator), where the
 * parsed value goes (answer key, flag or conversation language), which step
 * follows and what side effect runs on arrival. Instances are built once by
 * the journey definition and shared across all sessions.
 * </p>
 */
public final class JourneyStep {

    /**
     * Where a validated value is written.
     */
    public enum Target {
        /** {@code answers[targetName]} */
        ANSWER,
        /** {@code flags[targetName]} */
        FLAG,
        /** session language */
        LANGUAGE,
        /** value is only used for routing */
        NONE
    }

    private final StepId id;
    private final InputKind inputKind;
    private final FieldKind fieldKind;
    private final Target target;
    private final String targetName;
    private final String completionFlag;
    private final StepId next;
    private final StepEffect effect;
    private final Map<String, String> options;
    private final boolean reentrant;
    private final boolean requiresAffirmative;
    private final String promptKey;
    private final String acknowledgementKey;

    private JourneyStep(Builder b) {
        if (b.id == null) {
            throw new IllegalArgumentException("step id cannot be null");
        }
        if (b.inputKind == null || b.fieldKind == null) {
            throw new IllegalArgumentException("inputKind and fieldKind are required for " + b.id);
        }
        if ((b.target == Target.ANSWER || b.target == Target.FLAG)
                && (b.targetName == null || b.targetName.isBlank())) {
            throw new IllegalArgumentException("targetName is required for " + b.target + " target on " + b.id);
        }
        if (b.reentrant && b.next != null) {
            throw new IllegalArgumentException("re-entrant step " + b.id + " cannot have a successor");
        }
        if (b.promptKey == null || b.promptKey.isBlank()) {
            throw new IllegalArgumentException("promptKey is required for " + b.id);
        }
        this.id = b.id;
        this.inputKind = b.inputKind;
        this.fieldKind = b.fieldKind;
        this.target = b.target;
        this.targetName = b.targetName;
        this.completionFlag = b.completionFlag;
        this.next = b.next;
        this.effect = b.effect;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(b.options));
        this.reentrant = b.reentrant;
        this.requiresAffirmative = b.requiresAffirmative;
        this.promptKey = b.promptKey;
        this.acknowledgementKey = b.acknowledgementKey;
    }

    public static Builder builder(StepId id) {
        return new Builder(id);
    }

    // ─────────────────── Behavior Methods ───────────────────

    public boolean isAutomatic() {
        return !inputKind.expectsUserInput();
    }

    public boolean isTerminal() {
        return next == null && !reentrant;
    }

    /**
     * Canonical value stored for a static option id, e.g. {@code emp_salaried -> Salaried}.
     */
    public Optional<String> valueOf(String optionId) {
        return Optional.ofNullable(options.get(optionId));
    }

    public boolean hasStaticOptions() {
        return !options.isEmpty();
    }

    // ─────────────────── Getters ───────────────────

    public StepId getId() {
        return id;
    }

    public InputKind getInputKind() {
        return inputKind;
    }

    public FieldKind getFieldKind() {
        return fieldKind;
    }

    public Target getTarget() {
        return target;
    }

    public String getTargetName() {
        return targetName;
    }

    public Optional<String> getCompletionFlag() {
        return Optional.ofNullable(completionFlag);
    }

    public Optional<StepId> getNext() {
        return Optional.ofNullable(next);
    }

    public StepEffect getEffect() {
        return effect;
    }

    /** Static option ids mapped to their canonical values, in display order. */
    public Map<String, String> getOptions() {
        return options;
    }

    public boolean isReentrant() {
        return reentrant;
    }

    public boolean isRequiresAffirmative() {
        return requiresAffirmative;
    }

    public String getPromptKey() {
        return promptKey;
    }

    /** Message sent once the step's input is accepted, if any. */
    public Optional<String> getAcknowledgementKey() {
        return Optional.ofNullable(acknowledgementKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        JourneyStep that = (JourneyStep) o;
        return id == that.id && next == that.next && target == that.target
                && Objects.equals(targetName, that.targetName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, next, target, targetName);
    }

    @Override
    public String toString() {
        return "JourneyStep{id=" + id + ", input=" + inputKind + ", field=" + fieldKind
                + ", target=" + target + (targetName != null ? ":" + targetName : "")
                + ", next=" + next + ", effect=" + effect + "}";
    }

    // ─────────────────── Builder ───────────────────

    public static final class Builder {

        private final StepId id;
        private InputKind inputKind = InputKind.FREE_TEXT;
        private FieldKind fieldKind = FieldKind.TEXT;
        private Target target = Target.NONE;
        private String targetName;
        private String completionFlag;
        private StepId next;
        private StepEffect effect = StepEffect.NONE;
        private final Map<String, String> options = new LinkedHashMap<>();
        private boolean reentrant;
        private boolean requiresAffirmative;
        private String promptKey;
        private String acknowledgementKey;

        private Builder(StepId id) {
            this.id = id;
        }

        public Builder input(InputKind inputKind, FieldKind fieldKind) {
            this.inputKind = inputKind;
            this.fieldKind = fieldKind;
            return this;
        }

        public Builder answer(String field) {
            this.target = Target.ANSWER;
            this.targetName = field;
            return this;
        }

        public Builder flag(String flag) {
            this.target = Target.FLAG;
            this.targetName = flag;
            return this;
        }

        public Builder language() {
            this.target = Target.LANGUAGE;
            this.targetName = null;
            return this;
        }

        public Builder completes(String flag) {
            this.completionFlag = flag;
            return this;
        }

        public Builder next(StepId next) {
            this.next = next;
            return this;
        }

        public Builder effect(StepEffect effect) {
            this.effect = effect;
            return this;
        }

        public Builder option(String optionId, String value) {
            this.options.put(optionId, value);
            return this;
        }

        public Builder reentrant() {
            this.reentrant = true;
            return this;
        }

        public Builder requiresAffirmative() {
            this.requiresAffirmative = true;
            return this;
        }

        public Builder prompt(String promptKey) {
            this.promptKey = promptKey;
            return this;
        }

        public Builder acknowledge(String acknowledgementKey) {
            this.acknowledgementKey = acknowledgementKey;
            return this;
        }

        public JourneyStep build() {
            return new JourneyStep(this);
        }
    }
}
