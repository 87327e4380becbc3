package com.lending.dialog.adapters.out.decision;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.lending.dialog.application.exception.GatewayFailureException;
import com.lending.dialog.application.port.out.DecisionPort;
import com.lending.dialog.bootstrap.config.DialogProperties;
import com.lending.dialog.domain.entity.FinalDecision;
import com.lending.dialog.domain.entity.LoanApplication;
import com.lending.dialog.domain.entity.Offer;
import com.lending.dialog.domain.entity.Session;

/**
 * Local credit rules implementing the DecisionPort outbound port.
 * <p>
 * Eligibility: monthly income at or above the configured minimum. The
 * eligible amount is {@code min(income × 10, 150000)}; three offers are cut
 * from 60% of it:
 * </p>
 *
 * <pre>
 *   OFFER1  base          6 months  18% APR  3.0% fee
 *   OFFER2  base × 1.15   9 months  21% APR  2.5% fee
 *   OFFER3  base × 1.35  12 months  24% APR  2.0% fee
 * </pre>
 *
 * EMI uses the standard amortization formula, rounded up to the rupee.
 */
@Component
public class RuleBasedDecisionGateway implements DecisionPort {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedDecisionGateway.class);

    static final BigDecimal MAX_ELIGIBLE_AMOUNT = new BigDecimal("150000");
    private static final BigDecimal INCOME_MULTIPLIER = BigDecimal.TEN;
    private static final BigDecimal BASE_SHARE = new BigDecimal("0.6");

    private record Tier(String offerId, BigDecimal multiplier, int termMonths, BigDecimal apr, BigDecimal fee) {
    }

    private static final List<Tier> TIERS = List.of(
            new Tier("OFFER1", BigDecimal.ONE, 6, new BigDecimal("18.0"), new BigDecimal("3.0")),
            new Tier("OFFER2", new BigDecimal("1.15"), 9, new BigDecimal("21.0"), new BigDecimal("2.5")),
            new Tier("OFFER3", new BigDecimal("1.35"), 12, new BigDecimal("24.0"), new BigDecimal("2.0")));

    private final BigDecimal minMonthlyIncome;

    public RuleBasedDecisionGateway(DialogProperties properties) {
        this.minMonthlyIncome = properties.getDecision().getMinMonthlyIncome();
    }

    @Override
    public List<Offer> proposeOffers(LoanApplication application) {
        if (!eligible(application.getMonthlyIncome())) {
            log.info("action=offers_declined identity={} income={} minIncome={}",
                    application.getIdentity(), application.getMonthlyIncome(), minMonthlyIncome);
            return List.of();
        }
        List<Offer> offers = offersFor(application.getMonthlyIncome());
        log.info("action=offers_proposed identity={} count={} maxAmount={}",
                application.getIdentity(), offers.size(), eligibleAmount(application.getMonthlyIncome()));
        return offers;
    }

    @Override
    public FinalDecision finalDecision(String identity, Map<String, Object> answers) {
        Object rawIncome = answers.get(Session.ANSWER_MONTHLY_INCOME);
        if (!(rawIncome instanceof BigDecimal)) {
            throw new GatewayFailureException("decision", "monthly income missing for " + identity);
        }
        BigDecimal income = (BigDecimal) rawIncome;
        String referenceId = newReference();

        if (!eligible(income)) {
            log.info("action=final_declined identity={} ref={}", identity, referenceId);
            return FinalDecision.rejected(referenceId, "Income below eligibility threshold");
        }

        List<Offer> offers = offersFor(income);
        Object chosen = answers.get(Session.ANSWER_CHOSEN_OFFER);
        Offer selected = offers.get(0);
        if (chosen instanceof Integer) {
            int index = (Integer) chosen;
            if (index >= 1 && index <= offers.size()) {
                selected = offers.get(index - 1);
            }
        }
        log.info("action=final_approved identity={} ref={} amount={} termMonths={}",
                identity, referenceId, selected.getAmount(), selected.getTermMonths());
        return FinalDecision.approved(referenceId, selected.getAmount(), selected.getApr(), selected.getTermMonths());
    }

    // ─────────────────── Rules ───────────────────

    private boolean eligible(BigDecimal income) {
        return income != null && income.compareTo(minMonthlyIncome) >= 0;
    }

    static BigDecimal eligibleAmount(BigDecimal income) {
        return income.multiply(INCOME_MULTIPLIER).setScale(0, RoundingMode.DOWN).min(MAX_ELIGIBLE_AMOUNT);
    }

    static List<Offer> offersFor(BigDecimal income) {
        BigDecimal base = eligibleAmount(income).multiply(BASE_SHARE).setScale(0, RoundingMode.DOWN);
        List<Offer> offers = new ArrayList<>();
        int index = 1;
        for (Tier tier : TIERS) {
            BigDecimal amount = base.multiply(tier.multiplier()).setScale(0, RoundingMode.DOWN);
            offers.add(new Offer(index++, tier.offerId(), amount, tier.apr(), tier.termMonths(), tier.fee(),
                    monthlyEmi(amount, tier.apr(), tier.termMonths())));
        }
        return offers;
    }

    /**
     * {@code P × r × (1+r)^n / ((1+r)^n − 1)} with {@code r = apr / 1200},
     * rounded up; {@code P / n} when the rate is zero.
     */
    static BigDecimal monthlyEmi(BigDecimal principal, BigDecimal apr, int months) {
        MathContext mc = MathContext.DECIMAL64;
        BigDecimal rate = apr.divide(new BigDecimal("1200"), mc);
        if (rate.signum() == 0) {
            return principal.divide(BigDecimal.valueOf(months), 0, RoundingMode.CEILING);
        }
        BigDecimal growth = BigDecimal.ONE.add(rate).pow(months, mc);
        BigDecimal emi = principal.multiply(rate, mc).multiply(growth, mc)
                .divide(growth.subtract(BigDecimal.ONE), mc);
        return emi.setScale(0, RoundingMode.CEILING);
    }

    private static String newReference() {
        return "REF-" + ThreadLocalRandom.current().nextInt(100000, 1000000);
    }
}
