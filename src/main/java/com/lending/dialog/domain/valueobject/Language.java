package com.lending.dialog.domain.valueobject;

/**
 * Conversation languages supported by the prompt catalog.
 */
public enum Language {

    EN("English"),
    HI("हिंदी");

    private final String displayName;

    Language(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a stored language code, falling back to null for unknown values.
     *
     * @param code stored code such as "EN" or "hi"
     * @return language, or null if the code is blank or unknown
     */
    public static Language fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (Language language : values()) {
            if (language.name().equalsIgnoreCase(code.trim())) {
                return language;
            }
        }
        return null;
    }

    /**
     * Language used to render prompts when the user has not chosen one yet.
     */
    public static Language orDefault(Language language) {
        return language != null ? language : EN;
    }
}
