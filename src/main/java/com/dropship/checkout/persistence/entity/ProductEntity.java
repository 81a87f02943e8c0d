package com.dropship.checkout.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog row. Maintained by the catalog admin tooling; checkout only reads it.
 */
@Entity
@Table(name = "products")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "title")
    private String title;

    @Column(name = "price_usd_cents", nullable = false)
    private long priceUsdCents;

    @Column(name = "supplier_cost_usd_cents", nullable = false)
    private long supplierCostUsdCents;

    @Column(name = "supplier_sku")
    private String supplierSku;

    @Column(name = "img")
    private String img;
}
