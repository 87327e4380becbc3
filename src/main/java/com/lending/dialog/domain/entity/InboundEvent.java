package com.lending.dialog.domain.entity;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable inbound message from the messaging channel.
 * <p>
 * A user either types text, taps an option (button or list row), or sends an
 * attachment. The channel adapter maps each of these onto the same event.
 * </p>
 *
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>eventId and identity are non-null, non-blank</li>
 * <li>at least one of text, selectedOptionId or mediaId is present</li>
 * <li>receivedAt is non-null</li>
 * <li>deadline is optional</li>
 * </ul>
 */
public final class InboundEvent {

    private final String eventId;
    private final String identity;
    private final String text;
    private final String selectedOptionId;
    private final String mediaId;
    private final Instant receivedAt;
    private final Instant deadline;

    /**
     * Full constructor with validation.
     */
    public InboundEvent(String eventId, String identity, String text, String selectedOptionId,
            String mediaId, Instant receivedAt, Instant deadline) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId cannot be null or blank");
        }
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be null or blank");
        }
        if (isBlank(text) && isBlank(selectedOptionId) && isBlank(mediaId)) {
            throw new IllegalArgumentException("event " + eventId + " carries no text, option or media");
        }
        if (receivedAt == null) {
            throw new IllegalArgumentException("receivedAt cannot be null");
        }

        this.eventId = eventId;
        this.identity = identity;
        this.text = text;
        this.selectedOptionId = isBlank(selectedOptionId) ? null : selectedOptionId.trim();
        this.mediaId = isBlank(mediaId) ? null : mediaId.trim();
        this.receivedAt = receivedAt;
        this.deadline = deadline;
    }

    // ─────────────────── Factory Methods ───────────────────

    /** Typed text message. */
    public static InboundEvent text(String identity, String text, Instant receivedAt) {
        return new InboundEvent(UUID.randomUUID().toString(), identity, text, null, null, receivedAt, null);
    }

    /** Tap on a button or list row. */
    public static InboundEvent option(String identity, String optionId, Instant receivedAt) {
        return new InboundEvent(UUID.randomUUID().toString(), identity, null, optionId, null, receivedAt, null);
    }

    /** Attachment such as a selfie image. */
    public static InboundEvent media(String identity, String mediaId, Instant receivedAt) {
        return new InboundEvent(UUID.randomUUID().toString(), identity, null, null, mediaId, receivedAt, null);
    }

    // ─────────────────── Behavior Methods ───────────────────

    /**
     * Raw input for validation: the selected option id wins over typed text.
     *
     * @return option id, else text, else empty string
     */
    public String rawInput() {
        if (selectedOptionId != null) {
            return selectedOptionId;
        }
        return text != null ? text : "";
    }

    /**
     * Lower-cased, trimmed raw input with inner whitespace collapsed. Used for
     * keyword and switch matching.
     */
    public String normalizedInput() {
        return rawInput().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public boolean hasOption() {
        return selectedOptionId != null;
    }

    public boolean hasMedia() {
        return mediaId != null;
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ─────────────────── Getters ───────────────────

    public String getEventId() {
        return eventId;
    }

    public String getIdentity() {
        return identity;
    }

    public String getText() {
        return text;
    }

    public String getSelectedOptionId() {
        return selectedOptionId;
    }

    public String getMediaId() {
        return mediaId;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public Instant getDeadline() {
        return deadline;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        InboundEvent that = (InboundEvent) o;
        return Objects.equals(eventId, that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "InboundEvent{eventId='" + eventId
                + "', identity='" + identity
                + "', option=" + selectedOptionId
                + ", hasText=" + (text != null)
                + ", hasMedia=" + (mediaId != null)
                + ", receivedAt=" + receivedAt + "}";
    }
}
