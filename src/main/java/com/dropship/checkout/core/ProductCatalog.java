package com.dropship.checkout.core;

import com.dropship.checkout.domain.Product;

import java.util.List;

/**
 * Read side of the product catalog.
 */
public interface ProductCatalog {

    /**
     * All products, each priced in USD and in naira at the current rate.
     */
    List<Product> getProductsWithLivePricing();
}
