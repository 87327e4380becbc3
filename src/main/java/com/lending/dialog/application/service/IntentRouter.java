package com.lending.dialog.application.service;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.lending.dialog.domain.entity.InboundEvent;
import com.lending.dialog.domain.valueobject.Language;

/**
 * Keyword and button table for users at the top-level menu, plus the global
 * switches honoured in every journey.
 * <p>
 * Matching is exact on the normalized input (lower-cased, trimmed, inner
 * whitespace collapsed). Keywords match whole inputs only, so "help me with
 * my loan" typed as a support question is never read as a command.
 * </p>
 */
public class IntentRouter {

    public enum GlobalSwitch {
        SUPPORT,
        MENU,
        LANGUAGE
    }

    public enum Route {
        LANGUAGE_CHOSEN,
        START_ONBOARDING,
        SUPPORT,
        KYC,
        POST_LOAN,
        TOP_MENU,
        MISS
    }

    /**
     * Routing decision at the top-level menu.
     *
     * @param route    where to go
     * @param language chosen language for LANGUAGE_CHOSEN, else null
     * @param optionId post-loan option to apply right after entering POST_LOAN, else null
     */
    public record Routing(Route route, Language language, String optionId) {

        static Routing of(Route route) {
            return new Routing(route, null, null);
        }
    }

    private static final Map<String, GlobalSwitch> GLOBAL_SWITCHES = Map.of(
            "support", GlobalSwitch.SUPPORT,
            "help", GlobalSwitch.SUPPORT,
            "menu", GlobalSwitch.MENU,
            "restart", GlobalSwitch.MENU,
            "language", GlobalSwitch.LANGUAGE);

    private static final Map<String, Language> LANGUAGE_KEYWORDS = Map.of(
            JourneyDefinition.OPTION_LANG_EN, Language.EN,
            JourneyDefinition.OPTION_LANG_HI, Language.HI,
            "english", Language.EN,
            "hindi", Language.HI,
            "हिंदी", Language.HI,
            "हिन्दी", Language.HI);

    private static final Set<String> APPLY_KEYWORDS = Set.of(
            JourneyDefinition.OPTION_GET_LOAN, "apply", "loan", "new loan", "get loan", "get a loan",
            "finance", "start", "continue", "लोन");

    private static final Set<String> SUPPORT_KEYWORDS = Set.of(
            JourneyDefinition.OPTION_SUPPORT, JourneyDefinition.OPTION_POST_SUPPORT, "customer care", "agent");

    private static final Set<String> KYC_KEYWORDS = Set.of("kyc", "re-kyc", "rekyc", "verify");

    private static final Set<String> POST_LOAN_OPTIONS = Set.of(
            JourneyDefinition.OPTION_POST_VIEW, JourneyDefinition.OPTION_POST_DOWNLOAD,
            JourneyDefinition.OPTION_POST_REPAY, "my loan");

    private static final Set<String> GREETINGS = Set.of(
            "hi", "hello", "hey", "hii", "namaste", "नमस्ते", "start over");

    /**
     * Global switch for the event, if its input is exactly a switch keyword.
     */
    public Optional<GlobalSwitch> globalSwitch(InboundEvent event) {
        return Optional.ofNullable(GLOBAL_SWITCHES.get(event.normalizedInput()));
    }

    /**
     * Routes an event received while the user is at the top-level menu.
     *
     * @param event   inbound event
     * @param hasLoan true if the user has a disbursed loan (flag or stored record)
     */
    public Routing route(InboundEvent event, boolean hasLoan) {
        String input = event.normalizedInput();
        if (input.isEmpty()) {
            return Routing.of(Route.MISS);
        }

        Language language = LANGUAGE_KEYWORDS.get(input);
        if (language != null) {
            return new Routing(Route.LANGUAGE_CHOSEN, language, null);
        }
        if (APPLY_KEYWORDS.contains(input)) {
            return Routing.of(Route.START_ONBOARDING);
        }
        if (SUPPORT_KEYWORDS.contains(input)) {
            return Routing.of(Route.SUPPORT);
        }
        if (KYC_KEYWORDS.contains(input)) {
            return Routing.of(Route.KYC);
        }
        if (hasLoan && POST_LOAN_OPTIONS.contains(input)) {
            String option = input.startsWith("post_") ? input : null;
            return new Routing(Route.POST_LOAN, null, option);
        }
        if (hasLoan && "menu".equals(input)) {
            return Routing.of(Route.POST_LOAN);
        }
        if (GREETINGS.contains(input) || "menu".equals(input) || "restart".equals(input)) {
            return Routing.of(Route.TOP_MENU);
        }
        return Routing.of(Route.MISS);
    }
}
