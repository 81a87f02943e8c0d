package com.dropship.checkout.compliance;

import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.GatewayInitiation;
import com.dropship.checkout.domain.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the money trail of every checkout to the log under an {@code [AUDIT]} prefix, so the
 * split between supplier and store can be reconstructed without the database. No customer
 * contact data is logged.
 */
@Slf4j
@Component
public class OrderAuditLogger {

    public void logInitiation(GatewayInitiation initiation) {
        log.info("[AUDIT] CHECKOUT_INITIATED gateway={} reference={} totalMinorUsd={} totalMinorNgn={} "
                        + "supplierShareMinor={} applicationFeeMinor={} rate={}",
                initiation.getGateway(),
                initiation.getReference(),
                initiation.getTotalMinorUsd(),
                initiation.getTotalMinorNgn(),
                initiation.getSupplierShareMinor(),
                initiation.getApplicationFeeMinor(),
                initiation.getRate());
    }

    public void logDraft(DraftOrder draft, String localOrderId) {
        log.info("[AUDIT] ORDER_DRAFT localOrderId={} reference={} gateway={} totalMinorUsd={} totalMinorNgn={} "
                        + "supplierShareMinor={} profitMinor={}",
                localOrderId,
                draft.getPaymentReference(),
                draft.getGateway(),
                draft.getTotalMinorUsd(),
                draft.getTotalMinorNgn(),
                draft.getSupplierShareMinor(),
                draft.getProfitMinor());
    }

    public void logTransition(String reference, OrderStatus target, String channel, boolean applied) {
        log.info("[AUDIT] ORDER_TRANSITION reference={} target={} channel={} applied={}",
                reference, target, channel, applied);
    }
}
