package com.lending.dialog.application.service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import com.lending.dialog.domain.valueobject.Language;

/**
 * English and Hindi message packs keyed by message key or option id.
 * <p>
 * Templates use {@link String#format} placeholders. A key missing from the
 * Hindi pack falls back to English; a key missing everywhere renders as the
 * key itself and logs a warning.
 * </p>
 */
public class PromptCatalog {

    private static final Logger log = Logger.getLogger(PromptCatalog.class.getName());

    private final Map<Language, Map<String, String>> packs = new EnumMap<>(Language.class);

    public PromptCatalog() {
        packs.put(Language.EN, english());
        packs.put(Language.HI, hindi());
    }

    /**
     * Renders a message in the given language (English when null).
     */
    public String text(Language language, String key, Object... args) {
        Language lang = Language.orDefault(language);
        String template = packs.get(lang).get(key);
        if (template == null) {
            template = packs.get(Language.EN).get(key);
        }
        if (template == null) {
            log.warning(String.format("action=missing_prompt key=%s language=%s", key, lang));
            return key;
        }
        return args.length == 0 ? template : String.format(template, args);
    }

    /**
     * Button / list label for an option id.
     */
    public String label(Language language, String optionId) {
        return text(language, optionId);
    }

    public boolean has(String key) {
        return packs.get(Language.EN).containsKey(key);
    }

    // ─────────────────── Packs ───────────────────

    private static Map<String, String> english() {
        Map<String, String> m = new HashMap<>();
        m.put("welcome", "👋 Welcome to PayU Finance. I am your Personal Loan assistant.");
        m.put("language_prompt", "Please choose your preferred language.");
        m.put("language_changed", "Language updated.");
        m.put("main_offer_intro", "Get a loan up to ₹5,00,000 in under 5 minutes. Apply Now!");
        m.put("ask_name", "Please share your full name (as per PAN)");
        m.put("ask_dob", "Please enter your date of birth in DD-MM-YYYY format\ne.g. 31-12-1995");
        m.put("ask_employment", "Select your Employment type");
        m.put("ask_salary", "What's your Monthly Income in INR\nOnly enter Numbers");
        m.put("ask_purpose", "What will this loan help you with?");
        m.put("ask_consent", "I authorize PayU Finance to process my information and pull credit bureau records.");
        m.put("decision_submit", "Processing your loan application...");
        m.put("decision_rejected", "We're sorry!\nYour profile is rejected due to %s. Please come back later.");
        m.put("decision_approved_intro", "🎉 You're eligible for a loan. Below are few curated offers for you");
        m.put("offer_line", "⭐ *Offer %d*\n• Amount: ₹%s\n• Tenure: %d months\n• APR: %s%%\n"
                + "• Processing fee: %s%%\n• EMI: ₹%s");
        m.put("offers_prompt", "Select an offer to proceed or type Support for help");
        m.put("ask_kyc", "Complete KYC to proceed. Tap Complete KYC.");
        m.put("kyc_completed", "KYC is successfully completed. Moving to Selfie now.");
        m.put("ask_selfie", "Please take a selfie now using WhatsApp camera and send it here.");
        m.put("selfie_received", "Looking good, smarty!");
        m.put("kyc_refreshed", "Your KYC details are updated. Thank you!");
        m.put("ask_bank", "Please provide bank details in the format:\n<IFSC>\n<account_number>");
        m.put("bank_details_received", "Bank details received for account %s.");
        m.put("nach_prompt", "Complete NACH (mandate) to enable auto-debit. Tap Complete NACH.");
        m.put("agreement_prompt", "Please review and agree to the Customer Agreement to proceed.");
        m.put("agreement_sent", "Read the Agreement carefully and tap Agree to sign and continue.");
        m.put("agreement_signed", "🎉 Congratulations! Everything's done and your amount will be credited to your account soon.");
        m.put("decision_final", "Running final checks...");
        m.put("final_approval", "✅ Loan approved!\nAmount: ₹%s.\nLoan ID: %s");
        m.put("final_reject", "We're unable to disburse the loan because: %s. Please contact Support.");
        m.put("try_again", "Something went wrong on our side. Please send your last message again in a moment.");
        m.put("invalid_choice", "Please choose from the available options.");
        m.put("more_options", "More options");
        m.put("routing_miss", "Sorry, I didn't get that. Please choose an option below.");
        m.put("session_reset", "Your previous session expired due to inactivity. Let's start again.");

        m.put("support_prompt", "Tell me briefly how I can help you?");
        m.put("support_closing", "If you need further help, connect to an agent.");
        m.put("support_no_answer", "I couldn't find a precise answer. Do you want to connect to a PayU specialist?");
        m.put("support_escalation_ack", "A PayU specialist has been notified and will reach out shortly.");
        m.put("download_app_answer", "Download the PayU Finance app from Play Store / App Store: %s");
        m.put("send_email_answer", "Drop us a line at %s and we'll get back at the earliest.");
        m.put("kb_emi", "You can pay via PayU app, netbanking or UPI. Choose Repay Loan in the menu for a payment link.");
        m.put("kb_status", "Open PayU app > My Loans, or ask me to show loan details.");
        m.put("kb_statement", "Your loan statement is available as a PDF from Download Loan PDF in the menu.");
        m.put("kb_foreclosure", "You can foreclose your loan any time after the first EMI from PayU app > My Loans > Foreclose.");
        m.put("kb_interest", "Interest rates depend on your profile and start from 16.5% per annum.");

        m.put("post_loan_menu", "Choose an option");
        m.put("post_loan_details", "Loan ID: %s\nStatus: %s\nAmount: ₹%s\nAPR: %s%%\nTenure: %d months");
        m.put("post_loan_no_record", "I couldn't find a loan on your number yet.");
        m.put("post_loan_download", "Here is your loan statement.");
        m.put("post_loan_repay_info", "Pay your EMI securely here: %s");

        m.put("hint_empty", "I didn't receive anything. Please try again.");
        m.put("hint_unparseable_date", "Invalid date. Please provide in DD-MM-YYYY format\ne.g. 31-12-1995");
        m.put("hint_future_date", "Date of birth cannot be in the future.");
        m.put("hint_underage", "You must be at least 18 years old to apply.");
        m.put("hint_overage", "Applicants must be 75 years or younger.");
        m.put("hint_not_numeric", "Please enter numbers only (e.g. 45000)");
        m.put("hint_non_positive", "Amount must be greater than zero (e.g. 45000)");
        m.put("hint_ambiguous", "Please answer Yes or No.");
        m.put("hint_unknown_option", "Please choose from the available options.");
        m.put("hint_missing_document", "Please send a photo using the WhatsApp camera.");
        m.put("hint_bank_details", "Please send the IFSC on the first line and the account number on the second.");
        m.put("hint_consent_required", "Consent is required to proceed with credit evaluation.");
        m.put("hint_agreement_required", "You need to agree to the Customer Agreement to receive the loan.");

        m.put("lang_en", "English");
        m.put("lang_hi", "हिंदी");
        m.put("intent_get_loan", "Get Loan");
        m.put("intent_support", "Support");
        m.put("emp_salaried", "Salaried");
        m.put("emp_self_employed", "Self-Employed");
        m.put("emp_others", "Others");
        m.put("purpose_personal", "Personal");
        m.put("purpose_education", "Education");
        m.put("purpose_medical", "Medical");
        m.put("purpose_home", "Home");
        m.put("purpose_travel", "Travel");
        m.put("purpose_others", "Others");
        m.put("consent_yes", "Yes, I agree");
        m.put("consent_no", "No");
        m.put("offer_select", "Accept %d");
        m.put("kyc_complete", "Complete KYC");
        m.put("nach_complete", "Complete NACH");
        m.put("agree_yes", "Agree");
        m.put("agree_no", "Not Agree");
        m.put("connect_agent", "Connect to Agent");
        m.put("send_email", "Mail Us");
        m.put("download_app", "Download App");
        m.put("post_view", "View Loan Details");
        m.put("post_download", "Download Loan PDF");
        m.put("post_repay", "Repay Loan");
        m.put("post_support", "Support");
        return m;
    }

    private static Map<String, String> hindi() {
        Map<String, String> m = new HashMap<>();
        m.put("welcome", "👋 पेयू फाइनेंस में आपका स्वागत है। मैं आपका पर्सनल लोन असिस्टेंट हूँ।");
        m.put("language_prompt", "कृपया अपनी पसंदीदा भाषा चुनें:");
        m.put("language_changed", "भाषा बदल दी गई है।");
        m.put("main_offer_intro", "आप 5 मिनट में ₹5,00,000 तक का लोन प्राप्त कर सकते हैं। आप क्या करना चाहेंगे?");
        m.put("ask_name", "कृपया अपना पूरा नाम लिखें (आधिकारिक आईडी के अनुसार)।");
        m.put("ask_dob", "कृपया अपनी जन्मतिथि DD-MM-YYYY फॉर्मेट में दें (उदा. 31-12-1990)।");
        m.put("ask_employment", "अपना रोजगार प्रकार चुनें:");
        m.put("ask_salary", "कृपया अपनी औसत मासिक आय ₹ में लिखें (सिर्फ अंक).");
        m.put("ask_purpose", "इस लोन का मुख्य उद्देश्य क्या है? विकल्प चुनें।");
        m.put("ask_consent", "क्या आप PayU को अपने विवरण प्रोसेस करने और क्रेडिट ब्यूरो जांच करने की सहमति देते हैं?");
        m.put("decision_submit", "आपकी जानकारी जाँच के लिए भेज रहा हूँ...");
        m.put("decision_rejected", "क्षमा करें, हम अभी लोन स्वीकृत नहीं कर पाए क्योंकि: %s. कृपया Support का उपयोग करें।");
        m.put("decision_approved_intro", "🎉 आप प्रावधानिक रूप से पात्र हैं। उपलब्ध ऑफ़र नीचे हैं:");
        m.put("offer_line", "⭐ *ऑफ़र %d*\n• राशि: ₹%s\n• अवधि: %d महीने\n• APR: %s%%\n"
                + "• प्रोसेसिंग फीस: %s%%\n• EMI: ₹%s");
        m.put("offers_prompt", "किसी ऑफ़र का चयन करें या Support चुनें।");
        m.put("ask_kyc", "कृपया KYC पूरा करें। Complete KYC दबाएँ।");
        m.put("kyc_completed", "KYC पूरा हो गया। अब सेल्फ़ी की बारी है।");
        m.put("ask_selfie", "कृपया अब WhatsApp कैमरा का उपयोग कर सेल्फ़ी लें और भेजें।");
        m.put("selfie_received", "सेल्फ़ी प्राप्त हो गई।");
        m.put("kyc_refreshed", "आपका KYC अपडेट हो गया है। धन्यवाद!");
        m.put("ask_bank", "कृपया बैंक विवरण दें\n<IFSC>\n<account_number>");
        m.put("bank_details_received", "खाता %s के लिए बैंक विवरण प्राप्त।");
        m.put("nach_prompt", "NACH (मंडेट) पूरा करें। Complete NACH दबाएँ।");
        m.put("agreement_prompt", "कृपया ग्राहक समझौते पढ़ें और सहमति दें।");
        m.put("agreement_sent", "समझौता भेजा गया। Agree दबाएँ।");
        m.put("agreement_signed", "धन्यवाद, समझौता स्वीकार कर लिया गया।");
        m.put("decision_final", "अंतिम जाँच चल रही है...");
        m.put("final_approval", "✅ लोन स्वीकृत और जारी किया गया! राशि: ₹%s. संदर्भ: %s");
        m.put("final_reject", "हम लोन जारी नहीं कर पा रहे हैं क्योंकि: %s. कृपया Support से संपर्क करें।");
        m.put("try_again", "हमारी ओर से कुछ गड़बड़ हुई। कृपया थोड़ी देर में अपना संदेश फिर से भेजें।");
        m.put("invalid_choice", "कृपया उपलब्ध विकल्पों में से चुनें।");
        m.put("more_options", "और विकल्प");
        m.put("routing_miss", "क्षमा करें, मैं समझ नहीं पाया। कृपया नीचे से एक विकल्प चुनें।");
        m.put("session_reset", "निष्क्रियता के कारण आपका पिछला सत्र समाप्त हो गया। चलिए फिर से शुरू करते हैं।");

        m.put("support_prompt", "कृपया बताएं कि आपको किस प्रकार मदद चाहिए।");
        m.put("support_closing", "यदि आपको और सहायता चाहिए तो एजेंट से कनेक्ट करें।");
        m.put("support_no_answer", "मुझे सटीक उत्तर नहीं मिला। क्या आप PayU विशेषज्ञ से जुड़ना चाहेंगे?");
        m.put("support_escalation_ack", "PayU विशेषज्ञ को सूचित कर दिया गया है, वे जल्द ही संपर्क करेंगे।");
        m.put("download_app_answer", "PayU Finance ऐप Play Store / App Store से डाउनलोड करें: %s");
        m.put("send_email_answer", "हमें %s पर लिखें, हम जल्द से जल्द जवाब देंगे।");
        m.put("kb_emi", "आप PayU ऐप, नेटबैंकिंग या UPI से EMI चुका सकते हैं। भुगतान लिंक के लिए मेनू में लोन चुका दें चुनें।");
        m.put("kb_status", "PayU ऐप > My Loans खोलें, या मुझसे लोन विवरण दिखाने को कहें।");
        m.put("kb_statement", "आपका लोन स्टेटमेंट मेनू में लोन पीडीएफ डाउनलोड करें से मिलेगा।");
        m.put("kb_foreclosure", "पहली EMI के बाद आप PayU ऐप > My Loans > Foreclose से लोन बंद कर सकते हैं।");
        m.put("kb_interest", "ब्याज दर आपकी प्रोफ़ाइल पर निर्भर करती है और 16.5% प्रति वर्ष से शुरू होती है।");

        m.put("post_loan_menu", "एक विकल्प चुनें:");
        m.put("post_loan_details", "लोन ID: %s\nस्थिति: %s\nराशि: ₹%s\nAPR: %s%%\nअवधि: %d महीने");
        m.put("post_loan_no_record", "आपके नंबर पर अभी कोई लोन नहीं मिला।");
        m.put("post_loan_download", "यह रहा आपका लोन स्टेटमेंट।");
        m.put("post_loan_repay_info", "अपनी EMI यहाँ सुरक्षित रूप से चुकाएँ: %s");

        m.put("hint_empty", "मुझे कुछ प्राप्त नहीं हुआ। कृपया फिर से प्रयास करें।");
        m.put("hint_unparseable_date", "अमान्य तिथि फॉर्मेट। कृपया DD-MM-YYYY (उदा. 31-12-1990) में दें।");
        m.put("hint_future_date", "जन्मतिथि भविष्य की नहीं हो सकती।");
        m.put("hint_underage", "आवेदन के लिए आपकी आयु कम से कम 18 वर्ष होनी चाहिए।");
        m.put("hint_overage", "आवेदक की आयु 75 वर्ष या उससे कम होनी चाहिए।");
        m.put("hint_not_numeric", "कृपया केवल संख्याएँ भेजें (उदा. 45000)।");
        m.put("hint_non_positive", "राशि शून्य से अधिक होनी चाहिए (उदा. 45000)।");
        m.put("hint_ambiguous", "कृपया हाँ या नहीं में उत्तर दें।");
        m.put("hint_unknown_option", "कृपया उपलब्ध विकल्पों में से चुनें।");
        m.put("hint_missing_document", "कृपया WhatsApp कैमरा से फ़ोटो भेजें।");
        m.put("hint_bank_details", "कृपया पहली पंक्ति में IFSC और दूसरी में खाता संख्या भेजें।");
        m.put("hint_consent_required", "आगे बढ़ने के लिए सहमति आवश्यक है।");
        m.put("hint_agreement_required", "लोन प्राप्त करने के लिए समझौते पर सहमति आवश्यक है।");

        m.put("intent_get_loan", "लोन लें");
        m.put("intent_support", "सपोर्ट");
        m.put("emp_salaried", "नौकरीपेशा (Salaried)");
        m.put("emp_self_employed", "स्वरोज़गार (Self-Employed)");
        m.put("emp_others", "अन्य (Other)");
        m.put("consent_yes", "हाँ, मैं सहमत हूँ");
        m.put("consent_no", "नहीं");
        m.put("offer_select", "स्वीकार करें %d");
        m.put("connect_agent", "एजेंट से कनेक्ट करें");
        m.put("send_email", "ईमेल भेजें");
        m.put("download_app", "एप डाउनलोड करें");
        m.put("post_view", "लोन विवरण देखें");
        m.put("post_download", "लोन पीडीएफ डाउनलोड करें");
        m.put("post_repay", "लोन चुका दें");
        m.put("post_support", "सपोर्ट");
        return m;
    }
}
