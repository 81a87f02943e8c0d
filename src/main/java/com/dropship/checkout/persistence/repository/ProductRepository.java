package com.dropship.checkout.persistence.repository;

import com.dropship.checkout.persistence.entity.ProductEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Read access to the product catalog.
 */
@Repository
public interface ProductRepository extends JpaRepository<ProductEntity, String> {
}
