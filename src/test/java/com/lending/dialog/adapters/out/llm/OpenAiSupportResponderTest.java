package com.lending.dialog.adapters.out.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lending.dialog.application.exception.GatewayFailureException;
import com.lending.dialog.bootstrap.config.DialogProperties;
import com.lending.dialog.domain.valueobject.Language;

class OpenAiSupportResponderTest {

    private static final String URL = "https://llm.test/v1/chat/completions";

    private MockRestServiceServer server;
    private OpenAiSupportResponder responder;

    @BeforeEach
    void setUp() {
        DialogProperties properties = new DialogProperties();
        properties.getSupport().getLlm().setEnabled(true);
        properties.getSupport().getLlm().setApiKey("sk-test");
        properties.getSupport().getLlm().setUrl(URL);

        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        responder = new OpenAiSupportResponder(new RestTemplateBuilder(customizer), new ObjectMapper(), properties);
        server = customizer.getServer();
    }

    @Test
    void testAnswer_ReturnsReply() {
        // Given
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andRespond(withSuccess(reply("  Open the app and tap Profile.  "), MediaType.APPLICATION_JSON));

        // When
        Optional<String> answer = responder.answer("How do I update my address?", Language.EN);

        // Then
        assertEquals(Optional.of("Open the app and tap Profile."), answer);
        server.verify();
    }

    @Test
    void testAnswer_UnknownMeansNoAnswer() {
        // Given
        server.expect(requestTo(URL)).andRespond(withSuccess(reply("UNKNOWN"), MediaType.APPLICATION_JSON));

        // When / Then
        assertTrue(responder.answer("What is my balance?", Language.HI).isEmpty());
    }

    @Test
    void testAnswer_ServerErrorIsGatewayFailure() {
        // Given
        server.expect(requestTo(URL)).andRespond(withServerError());

        // When / Then
        assertThrows(GatewayFailureException.class, () -> responder.answer("Hello?", Language.EN));
    }

    private static String reply(String content) {
        return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + content + "\"}}]}";
    }
}
