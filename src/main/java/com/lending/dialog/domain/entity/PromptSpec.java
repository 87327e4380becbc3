package com.lending.dialog.domain.entity;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Channel-agnostic outbound message.
 * <p>
 * Adapters decide how a CHOICE renders (buttons, list rows or a numbered
 * text menu); the core only states the body and the selectable ids.
 * </p>
 */
public final class PromptSpec {

    public enum Kind {
        TEXT,
        CHOICE,
        DOCUMENT
    }

    private final Kind kind;
    private final String body;
    private final List<PromptOption> options;
    private final String documentUrl;
    private final String documentName;

    private PromptSpec(Kind kind, String body, List<PromptOption> options,
            String documentUrl, String documentName) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("body cannot be null or blank");
        }
        if (kind == Kind.CHOICE && (options == null || options.isEmpty())) {
            throw new IllegalArgumentException("CHOICE prompt requires at least one option");
        }
        if (kind == Kind.DOCUMENT && (documentUrl == null || documentUrl.isBlank())) {
            throw new IllegalArgumentException("DOCUMENT prompt requires a documentUrl");
        }
        this.kind = kind;
        this.body = body;
        this.options = options != null ? List.copyOf(options) : Collections.emptyList();
        this.documentUrl = documentUrl;
        this.documentName = documentName;
    }

    // ─────────────────── Factory Methods ───────────────────

    public static PromptSpec text(String body) {
        return new PromptSpec(Kind.TEXT, body, null, null, null);
    }

    public static PromptSpec choice(String body, List<PromptOption> options) {
        return new PromptSpec(Kind.CHOICE, body, options, null, null);
    }

    public static PromptSpec document(String body, String documentUrl, String documentName) {
        return new PromptSpec(Kind.DOCUMENT, body, null, documentUrl, documentName);
    }

    // ─────────────────── Getters ───────────────────

    public Kind getKind() {
        return kind;
    }

    public String getBody() {
        return body;
    }

    public List<PromptOption> getOptions() {
        return options;
    }

    public Optional<String> getDocumentUrl() {
        return Optional.ofNullable(documentUrl);
    }

    public Optional<String> getDocumentName() {
        return Optional.ofNullable(documentName);
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        PromptSpec that = (PromptSpec) o;
        return kind == that.kind
                && body.equals(that.body)
                && options.equals(that.options)
                && Objects.equals(documentUrl, that.documentUrl)
                && Objects.equals(documentName, that.documentName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, body, options, documentUrl, documentName);
    }

    @Override
    public String toString() {
        return "PromptSpec{kind=" + kind + ", body='" + body + "', options=" + options
                + (documentUrl != null ? ", documentUrl='" + documentUrl + "'" : "") + "}";
    }
}
