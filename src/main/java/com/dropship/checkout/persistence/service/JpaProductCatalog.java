package com.dropship.checkout.persistence.service;

import com.dropship.checkout.api.LedgerPersistenceException;
import com.dropship.checkout.core.ExchangeRateService;
import com.dropship.checkout.core.MoneyUnits;
import com.dropship.checkout.core.ProductCatalog;
import com.dropship.checkout.domain.Product;
import com.dropship.checkout.persistence.entity.ProductEntity;
import com.dropship.checkout.persistence.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaProductCatalog implements ProductCatalog {

    private final ProductRepository productRepository;
    private final ExchangeRateService exchangeRateService;

    @Override
    @Transactional(readOnly = true)
    public List<Product> getProductsWithLivePricing() {
        BigDecimal rate = exchangeRateService.getUsdToNgnRate();
        List<ProductEntity> rows;
        try {
            rows = productRepository.findAll(Sort.by(Sort.Direction.DESC, "id"));
        } catch (DataAccessException e) {
            log.error("Failed to load products", e);
            throw new LedgerPersistenceException("Failed to load products", e);
        }
        return rows.stream()
                .map(row -> toProduct(row, rate))
                .collect(Collectors.toList());
    }

    private static Product toProduct(ProductEntity row, BigDecimal rate) {
        BigDecimal usd = MoneyUnits.toMajorUnits(row.getPriceUsdCents());
        return Product.builder()
                .id(row.getId())
                .title(row.getTitle())
                .priceMinorUsd(row.getPriceUsdCents())
                .priceMajorUsd(usd)
                .priceMajorNgn(usd.multiply(rate).setScale(2, RoundingMode.HALF_UP))
                .supplierCostMinorUsd(row.getSupplierCostUsdCents())
                .sku(row.getSupplierSku() != null ? row.getSupplierSku() : "")
                .image(row.getImg() != null ? row.getImg() : "")
                .build();
    }
}
