package com.dropship.checkout.adapters;

import com.dropship.checkout.api.ConfigurationException;
import com.dropship.checkout.api.UpstreamException;
import com.dropship.checkout.config.CheckoutProperties;
import com.dropship.checkout.core.ExchangeRateService;
import com.dropship.checkout.domain.CartItem;
import com.dropship.checkout.domain.CheckoutContext;
import com.dropship.checkout.domain.ConfirmationStyle;
import com.dropship.checkout.domain.Customer;
import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.GatewayInitiation;
import com.dropship.checkout.domain.ProfitSplit;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
class OpayAdapterTest {

    private static final String BASE_URL = "https://sandboxapi.opaycheckout.test/api/v1/international/cashier";
    private static final String SECRET = "OPAYPRV-test-secret";
    private static final String RESPONSE = "{\"code\":\"00000\",\"message\":\"SUCCESSFUL\",\"data\":{\"cashierUrl\":\"https://pay.opay.test/x\"}}";

    @Mock
    private ExchangeRateService exchangeRateService;

    private MockRestServiceServer server;
    private CheckoutProperties properties;
    private OpayAdapter adapter;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new CheckoutProperties();
        properties.getOpay().setBaseUrl(BASE_URL);
        properties.getOpay().setPublicKey("OPAYPUB-test");
        properties.getOpay().setSecretKey(SECRET);
        properties.getOpay().setCallbackUrl("https://shop.test/opay/callback");
        adapter = new OpayAdapter(restTemplate, exchangeRateService, properties, new ObjectMapper());
    }

    @Test
    void submitsSignedInvoiceInKobo() {
        when(exchangeRateService.getUsdToNgnRate()).thenReturn(new BigDecimal("1500"));
        server.expect(requestTo(BASE_URL + "/invoices/create"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer OPAYPUB-test"))
                .andExpect(jsonPath("$.amount").value(3000000))
                .andExpect(jsonPath("$.currency").value("NGN"))
                .andExpect(jsonPath("$.country").value("NG"))
                .andExpect(jsonPath("$.payType").value("WEB"))
                .andExpect(jsonPath("$.userInfo.userId").value("ada@example.com"))
                .andExpect(jsonPath("$.userInfo.name").value("Ada"))
                .andExpect(request -> {
                    String body = ((MockClientHttpRequest) request).getBodyAsString();
                    assertThat(request.getHeaders().getFirst(OpayAdapter.SIGNATURE_HEADER)).isEqualTo(hmacSha512Hex(body));
                })
                .andRespond(withSuccess(RESPONSE, MediaType.APPLICATION_JSON));

        GatewayInitiation initiation = adapter.initiate(context(Customer.of("Ada", "ada@example.com", null, null, "Lagos")));

        server.verify();
        assertThat(initiation.getReference()).startsWith("opay_ref_");
        assertThat(initiation.getTotalMinorNgn()).isEqualTo(3000000L);
        assertThat(initiation.getTotalMinorUsd()).isEqualTo(2000L);
        assertThat(initiation.getRate()).isEqualByComparingTo("1500");
        DraftOrder draft = initiation.getDraftOrder().orElseThrow();
        assertThat(draft.getPaymentReference()).isEqualTo(initiation.getReference());
        assertThat(draft.getGatewayResponse()).isEqualTo(RESPONSE);
        assertThat(draft.getProfitMinor()).isEqualTo(800L);
        assertThat(adapter.getConfirmationStyle()).isEqualTo(ConfirmationStyle.NONE);
    }

    @Test
    void anonymousBuyerIsSentAsGuest() {
        when(exchangeRateService.getUsdToNgnRate()).thenReturn(new BigDecimal("1500"));
        server.expect(requestTo(BASE_URL + "/invoices/create"))
                .andExpect(jsonPath("$.userInfo.userId").value("guest"))
                .andExpect(jsonPath("$.userInfo.name").value("Anonymous"))
                .andRespond(withSuccess(RESPONSE, MediaType.APPLICATION_JSON));

        adapter.initiate(context(Customer.empty()));

        server.verify();
    }

    @Test
    void referencesAreUnique() {
        when(exchangeRateService.getUsdToNgnRate()).thenReturn(new BigDecimal("1500"));
        server.expect(requestTo(BASE_URL + "/invoices/create")).andRespond(withSuccess(RESPONSE, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/invoices/create")).andRespond(withSuccess(RESPONSE, MediaType.APPLICATION_JSON));

        String first = adapter.initiate(context(Customer.empty())).getReference();
        String second = adapter.initiate(context(Customer.empty())).getReference();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void failedSubmissionProducesNoDraft() {
        when(exchangeRateService.getUsdToNgnRate()).thenReturn(new BigDecimal("1500"));
        server.expect(requestTo(BASE_URL + "/invoices/create")).andRespond(withServerError());

        assertThatThrownBy(() -> adapter.initiate(context(Customer.empty()))).isInstanceOf(UpstreamException.class);
    }

    @Test
    void missingCredentialsFailBeforeAnyCall() {
        properties.getOpay().setSecretKey("");

        assertThatThrownBy(() -> adapter.initiate(context(Customer.empty()))).isInstanceOf(ConfigurationException.class);
        verifyNoInteractions(exchangeRateService);
        server.verify();
    }

    private static String hmacSha512Hex(String body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA512");
            mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA512"));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static CheckoutContext context(Customer customer) {
        return CheckoutContext.builder()
                .items(List.of(CartItem.builder().id("p1").price(new BigDecimal("20.00"))
                        .supplierCost(new BigDecimal("12.00")).build()))
                .customer(customer)
                .split(new ProfitSplit(2000L, 1200L))
                .shippingFeeMinor(2000L)
                .build();
    }
}
