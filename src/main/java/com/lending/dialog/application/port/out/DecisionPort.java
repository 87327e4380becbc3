package com.lending.dialog.application.port.out;

import java.util.List;
import java.util.Map;

import com.lending.dialog.domain.entity.FinalDecision;
import com.lending.dialog.domain.entity.LoanApplication;
import com.lending.dialog.domain.entity.Offer;

/**
 * Secondary (outbound) port: credit decisioning backend.
 */
public interface DecisionPort {

    /**
     * Proposes offers for an application, best first. An empty list means the
     * application is rejected at pre-qualification.
     */
    List<Offer> proposeOffers(LoanApplication application);

    /**
     * Final decision on the completed application.
     *
     * @param identity user identity
     * @param answers  all onboarding answers, including the chosen offer
     */
    FinalDecision finalDecision(String identity, Map<String, Object> answers);
}
