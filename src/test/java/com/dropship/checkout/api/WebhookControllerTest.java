package com.dropship.checkout.api;

import com.dropship.checkout.adapters.StripeWebhookHandler;
import com.dropship.checkout.core.reconcile.WebhookEvent;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = WebhookController.class)
class WebhookControllerTest {

    private static final String PAYLOAD =
            "{\"id\":\"evt_1\",\"type\":\"payment_intent.succeeded\",\"data\":{\"object\":{\"id\":\"pi_123\"}}}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StripeWebhookHandler stripeWebhookHandler;

    @Test
    void acknowledgesHandledEvent() throws Exception {
        when(stripeWebhookHandler.handle(PAYLOAD, "t=1,v1=abc"))
                .thenReturn(new WebhookEvent("evt_1", WebhookEvent.PAYMENT_SUCCEEDED, "pi_123"));

        mockMvc.perform(post("/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", "t=1,v1=abc")
                        .content(PAYLOAD))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        verify(stripeWebhookHandler).handle(PAYLOAD, "t=1,v1=abc");
    }

    @Test
    void badSignatureIsPlainTextBadRequest() throws Exception {
        when(stripeWebhookHandler.handle(PAYLOAD, "t=1,v1=bad"))
                .thenThrow(new WebhookSignatureException("No signatures found matching the expected signature for payload"));

        mockMvc.perform(post("/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", "t=1,v1=bad")
                        .content(PAYLOAD))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Webhook Error: No signatures found matching the expected signature for payload"));
    }

    @Test
    void malformedPayloadIsBadRequest() throws Exception {
        when(stripeWebhookHandler.handle("oops", null)).thenThrow(new ValidationException("Malformed webhook payload"));

        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content("oops"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
    }
}
