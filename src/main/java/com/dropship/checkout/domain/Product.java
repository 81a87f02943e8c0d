package com.dropship.checkout.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Catalog entry priced for display: canonical USD cents plus a naira price at the live rate.
 */
@Value
@Builder
public class Product {

    String id;
    String title;
    long priceMinorUsd;
    BigDecimal priceMajorUsd;
    BigDecimal priceMajorNgn;
    long supplierCostMinorUsd;
    String sku;
    String image;
}
