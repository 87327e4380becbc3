package com.lending.dialog.domain.entity;

/**
 * Selectable option of a CHOICE prompt: stable id plus localized label.
 */
public record PromptOption(String optionId, String label) {

    public PromptOption {
        if (optionId == null || optionId.isBlank()) {
            throw new IllegalArgumentException("optionId cannot be null or blank");
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
    }
}
