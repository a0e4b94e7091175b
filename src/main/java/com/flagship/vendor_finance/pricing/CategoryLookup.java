package com.flagship.vendor_finance.pricing;

import java.util.Optional;

/**
 * Resolves a product category by identifier.
 * Provided by the catalogue owner; an empty result means the category is unknown.
 */
public interface CategoryLookup {

    Optional<Category> findById(String categoryId);
}
