package com.lending.dialog.adapters.out.redis;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lending.dialog.application.exception.SessionStoreException;
import com.lending.dialog.application.exception.StateCorruptionException;
import com.lending.dialog.application.port.out.SessionStore;
import com.lending.dialog.bootstrap.config.DialogProperties;
import com.lending.dialog.domain.entity.BankDetails;
import com.lending.dialog.domain.entity.Offer;
import com.lending.dialog.domain.entity.Session;
import com.lending.dialog.domain.valueobject.Journey;
import com.lending.dialog.domain.valueobject.Language;
import com.lending.dialog.domain.valueobject.StepId;

/**
 * Redis implementation of the SessionStore outbound port.
 * <p>
 * Key pattern: {@code dialog:session:{identity}} (a hash with {@code version}
 * and {@code payload} fields)
 * TTL: configurable, refreshed on every save
 * Serialization: JSON via Jackson
 * Concurrency: compare-and-set on {@code version} in a Lua script
 * </p>
 */
@Component
public class RedisSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

    static final String FIELD_VERSION = "version";
    static final String FIELD_PAYLOAD = "payload";

    // ARGV: expected version, new version, payload, ttl seconds. Version 0 means "must not exist".
    private static final String CAS_SCRIPT = ""
            + "local current = redis.call('HGET', KEYS[1], 'version')\n"
            + "if current == false then current = '0' end\n"
            + "if current ~= ARGV[1] then return 0 end\n"
            + "redis.call('HSET', KEYS[1], 'version', ARGV[2], 'payload', ARGV[3])\n"
            + "redis.call('EXPIRE', KEYS[1], ARGV[4])\n"
            + "return 1";

    private static final DefaultRedisScript<Long> SAVE_SCRIPT = new DefaultRedisScript<>(CAS_SCRIPT, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final long ttlSeconds;

    public RedisSessionStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
            DialogProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getRedis().getSessionPrefix();
        this.ttlSeconds = properties.getRedis().getSessionTtl().getSeconds();
    }

    @Override
    public Optional<Session> load(String identity) {
        String key = buildKey(identity);
        Map<Object, Object> entries;
        try {
            entries = redisTemplate.opsForHash().entries(key);
        } catch (DataAccessException e) {
            log.error("action=session_load_error identity={} error={}", identity, e.getMessage());
            throw new SessionStoreException(identity, "Failed to load session for " + identity, e);
        }

        if (entries == null || entries.isEmpty()) {
            log.debug("action=session_not_found identity={}", identity);
            return Optional.empty();
        }

        long version = parseVersion(identity, entries.get(FIELD_VERSION));
        Object payload = entries.get(FIELD_PAYLOAD);
        if (payload == null) {
            throw new StateCorruptionException(identity, version, "Session payload missing for " + identity);
        }

        try {
            SessionDto dto = objectMapper.readValue(payload.toString(), SessionDto.class);
            Session session = dto.toDomain(version);
            log.debug("action=session_retrieved identity={} journey={} step={} version={}",
                    identity, session.getJourney(), session.getCurrentStep(), version);
            return Optional.of(session);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("action=session_deserialize_error identity={} version={} error={}",
                    identity, version, e.getMessage());
            throw new StateCorruptionException(identity, version,
                    "Failed to deserialize session for " + identity + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(Session session) {
        String identity = session.getIdentity();
        String json;
        try {
            json = objectMapper.writeValueAsString(SessionDto.fromDomain(session));
        } catch (JsonProcessingException e) {
            log.error("action=session_serialize_error identity={} error={}", identity, e.getMessage());
            throw new SessionStoreException(identity, "Failed to serialize session for " + identity, e);
        }

        long expected = session.getVersion();
        Long applied;
        try {
            applied = redisTemplate.execute(SAVE_SCRIPT, List.of(buildKey(identity)),
                    String.valueOf(expected), String.valueOf(expected + 1), json, String.valueOf(ttlSeconds));
        } catch (DataAccessException e) {
            log.error("action=session_save_error identity={} error={}", identity, e.getMessage());
            throw new SessionStoreException(identity, "Failed to save session for " + identity, e);
        }

        if (applied == null || applied == 0L) {
            log.warn("action=session_version_conflict identity={} expectedVersion={}", identity, expected);
            throw new SessionStoreException(identity,
                    "Session for " + identity + " changed since version " + expected);
        }
        log.debug("action=session_saved identity={} journey={} step={} version={}",
                identity, session.getJourney(), session.getCurrentStep(), expected + 1);
    }

    private long parseVersion(String identity, Object raw) {
        if (raw == null) {
            return 0L;
        }
        try {
            return Long.parseLong(raw.toString());
        } catch (NumberFormatException e) {
            throw new StateCorruptionException(identity, 0L, "Unreadable session version: " + raw, e);
        }
    }

    private String buildKey(String identity) {
        return keyPrefix + identity;
    }

    // ─────────────────── Inner DTOs ───────────────────

    /**
     * Serialization DTO for Session → Redis JSON. Typed answers are stored
     * as strings and parsed back by field name.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SessionDto {

        @JsonProperty("identity")
        private String identity;

        @JsonProperty("journey")
        private String journey;

        @JsonProperty("current_step")
        private String currentStep;

        @JsonProperty("answers")
        private Map<String, String> answers;

        @JsonProperty("flags")
        private Map<String, Boolean> flags;

        @JsonProperty("language")
        private String language;

        @JsonProperty("offers")
        private List<OfferDto> offers;

        @JsonProperty("created_at")
        private String createdAt;

        @JsonProperty("last_activity_at")
        private String lastActivityAt;

        public SessionDto() {
        } // Jackson

        public static SessionDto fromDomain(Session session) {
            SessionDto dto = new SessionDto();
            dto.identity = session.getIdentity();
            dto.journey = session.getJourney().name();
            dto.currentStep = session.getCurrentStep() != null ? session.getCurrentStep().name() : null;
            dto.answers = new LinkedHashMap<>();
            session.getAnswers().forEach((field, value) -> dto.answers.put(field, encodeAnswer(value)));
            dto.flags = new LinkedHashMap<>(session.getFlags());
            dto.language = session.getLanguage() != null ? session.getLanguage().name() : null;
            dto.offers = new ArrayList<>();
            session.getOffers().forEach(offer -> dto.offers.add(OfferDto.fromDomain(offer)));
            dto.createdAt = session.getCreatedAt().toString();
            dto.lastActivityAt = session.getLastActivityAt().toString();
            return dto;
        }

        /**
         * @throws RuntimeException if a stored enum name, date or number is unreadable
         */
        public Session toDomain(long version) {
            Map<String, Object> typedAnswers = new LinkedHashMap<>();
            if (answers != null) {
                answers.forEach((field, value) -> typedAnswers.put(field, decodeAnswer(field, value)));
            }
            List<Offer> domainOffers = new ArrayList<>();
            if (offers != null) {
                offers.forEach(offer -> domainOffers.add(offer.toDomain()));
            }
            return Session.reconstruct(
                    identity,
                    Journey.valueOf(journey),
                    currentStep != null ? StepId.valueOf(currentStep) : null,
                    typedAnswers,
                    flags,
                    Language.fromCode(language),
                    domainOffers,
                    createdAt != null ? Instant.parse(createdAt) : null,
                    Instant.parse(lastActivityAt),
                    version);
        }

        static String encodeAnswer(Object value) {
            if (value instanceof BankDetails) {
                BankDetails bank = (BankDetails) value;
                return bank.getIfsc() + " " + bank.getAccountNumber();
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).toPlainString();
            }
            return String.valueOf(value);
        }

        static Object decodeAnswer(String field, String value) {
            if (value == null) {
                return null;
            }
            switch (field) {
                case Session.ANSWER_DOB:
                    return LocalDate.parse(value);
                case Session.ANSWER_MONTHLY_INCOME:
                    return new BigDecimal(value);
                case Session.ANSWER_CHOSEN_OFFER:
                    return Integer.valueOf(value);
                case Session.ANSWER_BANK_DETAILS: {
                    String[] parts = value.split(" ");
                    if (parts.length != 2) {
                        throw new IllegalArgumentException("bank details must be 'IFSC ACCOUNT'");
                    }
                    return new BankDetails(parts[0], parts[1]);
                }
                default:
                    return value;
            }
        }

        // Getters/Setters for Jackson
        public String getIdentity() {
            return identity;
        }

        public void setIdentity(String identity) {
            this.identity = identity;
        }

        public String getJourney() {
            return journey;
        }

        public void setJourney(String journey) {
            this.journey = journey;
        }

        public String getCurrentStep() {
            return currentStep;
        }

        public void setCurrentStep(String currentStep) {
            this.currentStep = currentStep;
        }

        public Map<String, String> getAnswers() {
            return answers;
        }

        public void setAnswers(Map<String, String> answers) {
            this.answers = answers;
        }

        public Map<String, Boolean> getFlags() {
            return flags;
        }

        public void setFlags(Map<String, Boolean> flags) {
            this.flags = flags;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public List<OfferDto> getOffers() {
            return offers;
        }

        public void setOffers(List<OfferDto> offers) {
            this.offers = offers;
        }

        public String getCreatedAt() {
            return createdAt;
        }

        public void setCreatedAt(String createdAt) {
            this.createdAt = createdAt;
        }

        public String getLastActivityAt() {
            return lastActivityAt;
        }

        public void setLastActivityAt(String lastActivityAt) {
            this.lastActivityAt = lastActivityAt;
        }
    }

    /**
     * Serialization DTO for one presented offer.
     */
    public record OfferDto(
            @JsonProperty("index") int index,
            @JsonProperty("offer_id") String offerId,
            @JsonProperty("amount") BigDecimal amount,
            @JsonProperty("apr") BigDecimal apr,
            @JsonProperty("term_months") int termMonths,
            @JsonProperty("processing_fee_percent") BigDecimal processingFeePercent,
            @JsonProperty("monthly_emi") BigDecimal monthlyEmi) {

        static OfferDto fromDomain(Offer offer) {
            return new OfferDto(offer.getIndex(), offer.getOfferId(), offer.getAmount(), offer.getApr(),
                    offer.getTermMonths(), offer.getProcessingFeePercent(), offer.getMonthlyEmi());
        }

        Offer toDomain() {
            return new Offer(index, offerId, amount, apr, termMonths, processingFeePercent, monthlyEmi);
        }
    }
}
