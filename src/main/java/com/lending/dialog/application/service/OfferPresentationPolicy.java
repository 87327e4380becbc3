package com.lending.dialog.application.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.lending.dialog.application.port.out.AuditSink;
import com.lending.dialog.domain.entity.Offer;

/**
 * Caps the offers shown to a user.
 * <p>
 * The gateway returns offers best-first. When it returns more than the cap,
 * the lowest-ranked ones are dropped, the drop is logged at WARNING and
 * audited as {@code offers_truncated}. Kept offers are re-indexed 1..n so
 * selection keys always match what the user sees.
 * </p>
 */
public class OfferPresentationPolicy {

    private static final Logger log = Logger.getLogger(OfferPresentationPolicy.class.getName());

    public static final String AUDIT_OFFERS_TRUNCATED = "offers_truncated";

    private final int cap;
    private final AuditSink auditSink;

    public OfferPresentationPolicy(int cap, AuditSink auditSink) {
        if (cap < 1) {
            throw new IllegalArgumentException("cap must be >= 1, got: " + cap);
        }
        if (auditSink == null) {
            throw new IllegalArgumentException("auditSink cannot be null");
        }
        this.cap = cap;
        this.auditSink = auditSink;
    }

    /**
     * @param identity user the offers belong to
     * @param offers   offers in gateway order
     * @param now      audit timestamp
     * @return at most {@code cap} offers, indexed from 1
     */
    public List<Offer> present(String identity, List<Offer> offers, Instant now) {
        List<Offer> kept = offers.size() > cap ? offers.subList(0, cap) : offers;

        if (offers.size() > cap) {
            List<String> droppedIds = offers.subList(cap, offers.size()).stream().map(Offer::getOfferId).toList();
            log.warning(String.format("action=offers_truncated identity=%s returned=%d shown=%d dropped=%s",
                    identity, offers.size(), cap, droppedIds));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("returned", offers.size());
            payload.put("shown", cap);
            payload.put("dropped", droppedIds);
            try {
                auditSink.record(identity, AUDIT_OFFERS_TRUNCATED, payload, now);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, String.format("action=audit_failed identity=%s kind=%s error=%s",
                        identity, AUDIT_OFFERS_TRUNCATED, e.getMessage()), e);
            }
        }

        List<Offer> indexed = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            indexed.add(kept.get(i).withIndex(i + 1));
        }
        return indexed;
    }

    public int getCap() {
        return cap;
    }
}
