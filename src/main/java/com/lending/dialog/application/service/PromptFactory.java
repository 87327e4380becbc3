package com.lending.dialog.application.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.lending.dialog.domain.entity.JourneyStep;
import com.lending.dialog.domain.entity.LoanRecord;
import com.lending.dialog.domain.entity.Offer;
import com.lending.dialog.domain.entity.PromptOption;
import com.lending.dialog.domain.entity.PromptSpec;
import com.lending.dialog.domain.entity.Session;
import com.lending.dialog.domain.valueobject.Language;
import com.lending.dialog.domain.valueobject.StepId;
import com.lending.dialog.domain.valueobject.ValidationError;

/**
 * Builds the prompt set for steps, menus and hints.
 * <p>
 * CHOICE prompts carry at most {@code maxOptionsPerPrompt} options (the
 * channel's button limit); longer option lists continue in follow-up CHOICE
 * prompts titled "More options".
 * </p>
 */
public class PromptFactory {

    public static final String OPTION_CONNECT_AGENT = "connect_agent";
    public static final String OPTION_SEND_EMAIL = "send_email";
    public static final String OPTION_DOWNLOAD_APP = "download_app";

    private static final String AGREEMENT_FILE = "Loan_Agreement.pdf";
    private static final String STATEMENT_FILE = "Loan_Statement.pdf";

    /**
     * Static links rendered into prompts.
     */
    public record Links(String agreementUrl, String statementUrl, String appUrl, String repayUrl,
            String supportEmail) {
    }

    private final PromptCatalog catalog;
    private final Links links;
    private final int maxOptionsPerPrompt;

    public PromptFactory(PromptCatalog catalog, Links links, int maxOptionsPerPrompt) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (links == null) {
            throw new IllegalArgumentException("links cannot be null");
        }
        if (maxOptionsPerPrompt < 1) {
            throw new IllegalArgumentException("maxOptionsPerPrompt must be >= 1, got: " + maxOptionsPerPrompt);
        }
        this.catalog = catalog;
        this.links = links;
        this.maxOptionsPerPrompt = maxOptionsPerPrompt;
    }

    // ─────────────────── Step Prompts ───────────────────

    /**
     * Prompt set asking for the input of a step.
     */
    public List<PromptSpec> forStep(JourneyStep step, Session session) {
        Language lang = session.getLanguage();
        String body = catalog.text(lang, step.getPromptKey());
        List<PromptSpec> prompts = new ArrayList<>();

        if (step.getId() == StepId.OFFER_SELECTION) {
            prompts.addAll(paginate(lang, offersBody(lang, session.getOffers()), optionsFor(step, session)));
            prompts.add(PromptSpec.text(catalog.text(lang, "offers_prompt")));
            return prompts;
        }
        if (step.getId() == StepId.AGREEMENT_ACK) {
            prompts.add(PromptSpec.document(body, links.agreementUrl(), AGREEMENT_FILE));
            prompts.addAll(paginate(lang, catalog.text(lang, "agreement_sent"), optionsFor(step, session)));
            return prompts;
        }

        switch (step.getInputKind()) {
            case CHOICE -> prompts.addAll(paginate(lang, body, optionsFor(step, session)));
            case FREE_TEXT, DOCUMENT, NONE -> prompts.add(PromptSpec.text(body));
        }
        return prompts;
    }

    /**
     * Options currently valid for a step: static options, or one per stored
     * offer for OFFER_SELECTION.
     */
    public List<PromptOption> optionsFor(JourneyStep step, Session session) {
        Language lang = session.getLanguage();
        List<PromptOption> options = new ArrayList<>();
        if (step.getId() == StepId.OFFER_SELECTION) {
            for (Offer offer : session.getOffers()) {
                options.add(new PromptOption(offer.optionId(), catalog.text(lang, "offer_select", offer.getIndex())));
            }
            return options;
        }
        for (String optionId : step.getOptions().keySet()) {
            options.add(new PromptOption(optionId, catalog.label(lang, optionId)));
        }
        return options;
    }

    // ─────────────────── Menus ───────────────────

    /**
     * Top-level menu: language choice until a language is set, then the main offer menu.
     */
    public List<PromptSpec> topMenu(Session session) {
        Language lang = session.getLanguage();
        List<PromptSpec> prompts = new ArrayList<>();
        if (lang == null) {
            prompts.add(PromptSpec.text(catalog.text(null, "welcome")));
            prompts.addAll(languageMenu());
            return prompts;
        }
        prompts.addAll(paginate(lang, catalog.text(lang, "main_offer_intro"), List.of(
                new PromptOption(JourneyDefinition.OPTION_GET_LOAN, catalog.label(lang, JourneyDefinition.OPTION_GET_LOAN)),
                new PromptOption(JourneyDefinition.OPTION_SUPPORT, catalog.label(lang, JourneyDefinition.OPTION_SUPPORT)))));
        return prompts;
    }

    public List<PromptSpec> languageMenu() {
        return paginate(null, catalog.text(null, "language_prompt"), List.of(
                new PromptOption(JourneyDefinition.OPTION_LANG_EN, Language.EN.getDisplayName()),
                new PromptOption(JourneyDefinition.OPTION_LANG_HI, Language.HI.getDisplayName())));
    }

    /**
     * "Connect to agent" follow-up after a support answer; with {@code offerEmail}
     * the mail option is offered as well.
     */
    public PromptSpec escalationChoice(Language lang, String bodyKey, boolean offerEmail) {
        List<PromptOption> options = new ArrayList<>();
        options.add(new PromptOption(OPTION_CONNECT_AGENT, catalog.label(lang, OPTION_CONNECT_AGENT)));
        if (offerEmail) {
            options.add(new PromptOption(OPTION_SEND_EMAIL, catalog.label(lang, OPTION_SEND_EMAIL)));
        }
        return PromptSpec.choice(catalog.text(lang, bodyKey), options);
    }

    // ─────────────────── Post-loan ───────────────────

    public PromptSpec loanSummary(Language lang, LoanRecord record) {
        return PromptSpec.text(catalog.text(lang, "post_loan_details",
                record.getReferenceId(),
                record.getStatus(),
                formatAmount(record.getApprovedAmount()),
                record.getApr() != null ? record.getApr().stripTrailingZeros().toPlainString() : "-",
                record.getTermMonths()));
    }

    public PromptSpec statementDocument(Language lang) {
        return PromptSpec.document(catalog.text(lang, "post_loan_download"), links.statementUrl(), STATEMENT_FILE);
    }

    public PromptSpec repaymentInfo(Language lang) {
        return text(lang, "post_loan_repay_info", links.repayUrl());
    }

    public PromptSpec appDownload(Language lang) {
        return text(lang, "download_app_answer", links.appUrl());
    }

    public PromptSpec supportEmail(Language lang) {
        return text(lang, "send_email_answer", links.supportEmail());
    }

    // ─────────────────── Generic ───────────────────

    public PromptSpec hint(Language lang, ValidationError error) {
        return PromptSpec.text(catalog.text(lang, error.getHintKey()));
    }

    public String label(Language lang, String optionId) {
        return catalog.label(lang, optionId);
    }

    public PromptSpec text(Language lang, String key, Object... args) {
        return PromptSpec.text(catalog.text(lang, key, args));
    }

    /**
     * Splits options across CHOICE prompts of at most {@code maxOptionsPerPrompt} options.
     */
    public List<PromptSpec> paginate(Language lang, String body, List<PromptOption> options) {
        List<PromptSpec> pages = new ArrayList<>();
        if (options.isEmpty()) {
            pages.add(PromptSpec.text(body));
            return pages;
        }
        for (int from = 0; from < options.size(); from += maxOptionsPerPrompt) {
            int to = Math.min(from + maxOptionsPerPrompt, options.size());
            String pageBody = from == 0 ? body : catalog.text(lang, "more_options");
            pages.add(PromptSpec.choice(pageBody, options.subList(from, to)));
        }
        return pages;
    }

    private String offersBody(Language lang, List<Offer> offers) {
        StringBuilder body = new StringBuilder(catalog.text(lang, "decision_approved_intro"));
        for (Offer offer : offers) {
            body.append("\n\n").append(catalog.text(lang, "offer_line",
                    offer.getIndex(),
                    formatAmount(offer.getAmount()),
                    offer.getTermMonths(),
                    offer.getApr().stripTrailingZeros().toPlainString(),
                    offer.getProcessingFeePercent().stripTrailingZeros().toPlainString(),
                    formatAmount(offer.getMonthlyEmi())));
        }
        return body.toString();
    }

    static String formatAmount(BigDecimal amount) {
        if (amount == null) {
            return "-";
        }
        return String.format(Locale.ROOT, "%,.0f", amount);
    }
}
