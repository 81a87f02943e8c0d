package com.dropship.checkout.core;

import com.dropship.checkout.api.PaymentNotConfirmedException;
import com.dropship.checkout.api.ValidationException;
import com.dropship.checkout.compliance.OrderAuditLogger;
import com.dropship.checkout.config.CheckoutProperties;
import com.dropship.checkout.core.reconcile.NoConfirmation;
import com.dropship.checkout.core.reconcile.OrderReconciler;
import com.dropship.checkout.core.reconcile.PollResult;
import com.dropship.checkout.domain.CartItem;
import com.dropship.checkout.domain.CheckoutContext;
import com.dropship.checkout.domain.CheckoutResult;
import com.dropship.checkout.domain.ConfirmationStyle;
import com.dropship.checkout.domain.Customer;
import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.GatewayInitiation;
import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.ProfitSplit;
import com.dropship.checkout.messaging.OrderEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs a checkout end to end: validate the cart, split the money, hand off to the gateway
 * adapter, record the draft.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutOrchestrator {

    private final GatewayRegistry gatewayRegistry;
    private final ProfitSplitCalculator splitCalculator;
    private final ShippingFeeResolver shippingFeeResolver;
    private final OrderLedger ledger;
    private final OrderReconciler reconciler;
    private final OrderAuditLogger auditLogger;
    private final OrderEventProducer eventProducer;
    private final CheckoutProperties properties;

    /**
     * Validates the cart and initiates a payment with {@code gateway}. Nothing reaches the
     * gateway unless the cart is non-empty, the total is positive and the profit is not
     * negative. The draft (when the gateway path produces one) is written only after the
     * gateway accepted the initiation.
     */
    public CheckoutResult checkout(GatewayType gateway, List<CartItem> items, Customer customer) {
        ProfitSplit split = validatedSplit(items);
        Customer buyer = customer != null ? customer : Customer.empty();
        long shippingFee = shippingFeeResolver.resolveFee(buyer.getState());

        CheckoutContext context = CheckoutContext.builder()
                .items(items)
                .customer(buyer)
                .split(split)
                .shippingFeeMinor(shippingFee)
                .currency(properties.getStripe().getCurrency())
                .build();

        GatewayAdapter adapter = gatewayRegistry.adapterFor(gateway);
        log.info("Starting checkout: gateway={}, items={}, totalMinor={}, supplierShareMinor={}, shippingFeeMinor={}",
                gateway, items.size(), split.getTotalMinor(), split.getSupplierShareMinor(), shippingFee);
        GatewayInitiation initiation = gatewayRegistry.invoke(adapter, () -> adapter.initiate(context));
        auditLogger.logInitiation(initiation);

        String localOrderId = initiation.getDraftOrder()
                .map(this::recordDraft)
                .orElse(null);

        if (localOrderId != null && adapter.getConfirmationStyle() == ConfirmationStyle.NONE) {
            reconciler.apply(initiation.getReference(), new NoConfirmation(initiation.getReference()));
        }
        return CheckoutResult.builder()
                .initiation(initiation)
                .localOrderId(localOrderId)
                .build();
    }

    /**
     * Records a Stripe order once the client reports its intent confirmed. The intent is
     * re-read from Stripe; the client's word alone never marks anything paid.
     * <p>
     * The recorded totals come from the submitted cart, like every other checkout path. A cart
     * total that differs from the intent's amount is logged at WARN but not rejected.
     */
    public Order placeStripeOrder(List<CartItem> items, Customer customer, String paymentIntentId) {
        if (paymentIntentId == null || paymentIntentId.isBlank()) {
            throw new ValidationException("paymentIntentId required");
        }
        ProfitSplit split = validatedSplit(items);

        GatewayAdapter adapter = gatewayRegistry.adapterFor(GatewayType.STRIPE);
        PollResult poll = gatewayRegistry.invoke(adapter, () -> adapter.verify(paymentIntentId))
                .orElseThrow(() -> new IllegalStateException("Stripe adapter cannot retrieve intents"));
        if (!poll.isSucceeded()) {
            log.warn("Place-order for intent={} refused, status={}", paymentIntentId, poll.getGatewayStatus());
            throw new PaymentNotConfirmedException("Payment not successful (status: " + poll.getGatewayStatus() + ")");
        }

        Object intentAmount = poll.getTransaction() != null ? poll.getTransaction().get("amount") : null;
        if (intentAmount instanceof Number && ((Number) intentAmount).longValue() != split.getTotalMinor()) {
            log.warn("Place-order cart total differs from intent={}: cartTotalMinor={}, intentAmount={}; recording cart total",
                    paymentIntentId, split.getTotalMinor(), intentAmount);
        }

        DraftOrder draft = DraftOrder.builder()
                .paymentReference(paymentIntentId)
                .gateway(GatewayType.STRIPE)
                .customer(customer != null ? customer : Customer.empty())
                .items(items)
                .totalMinorUsd(split.getTotalMinor())
                .supplierShareMinor(split.getSupplierShareMinor())
                .profitMinor(split.getProfitMinor())
                .build();
        recordDraft(draft);
        reconciler.apply(paymentIntentId, poll);
        return ledger.findByReference(paymentIntentId)
                .orElseThrow(() -> new IllegalStateException("Order " + paymentIntentId + " missing after insert"));
    }

    private ProfitSplit validatedSplit(List<CartItem> items) {
        if (items == null || items.isEmpty()) {
            throw new ValidationException("cartItems required");
        }
        ProfitSplit split;
        try {
            split = splitCalculator.computeSplit(items);
        } catch (ArithmeticException e) {
            log.warn("Rejecting cart with out-of-range amounts: {}", e.getMessage());
            throw new ValidationException("Cart amounts out of range", e);
        }
        if (split.getTotalMinor() <= 0) {
            throw new ValidationException("Cart total must be positive, got " + split.getTotalMinor());
        }
        if (split.isLoss()) {
            log.warn("Rejecting checkout at a loss: totalMinor={}, supplierShareMinor={}",
                    split.getTotalMinor(), split.getSupplierShareMinor());
            throw new ValidationException("Supplier cost exceeds price (profit " + split.getProfitMinor() + ")");
        }
        return split;
    }

    private String recordDraft(DraftOrder draft) {
        String localOrderId = ledger.createDraft(draft);
        auditLogger.logDraft(draft, localOrderId);
        eventProducer.publishDraftCreated(draft, localOrderId);
        return localOrderId;
    }
}
