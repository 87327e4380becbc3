package com.lending.dialog.application.port.out;

import java.util.Optional;

import com.lending.dialog.domain.valueobject.Language;

/**
 * Secondary (outbound) port: free-form support answering (e.g. an LLM).
 */
public interface SupportPort {

    /**
     * @param question user question as typed
     * @param language language to answer in
     * @return answer text, or empty when the responder has nothing useful
     */
    Optional<String> answer(String question, Language language);
}
