package com.flagship.vendor_finance.pricing;

import com.flagship.vendor_finance.config.FinancePolicyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CategoryLookup} backed by the {@code finance.policy.categories} map.
 * Identifiers are matched case-insensitively.
 */
@Component
@Slf4j
public class ConfiguredCategoryLookup implements CategoryLookup {

    private final Map<String, Category> categories;

    /**
     * @throws IllegalStateException if two configured ids differ only by case or surrounding spaces
     */
    public ConfiguredCategoryLookup(FinancePolicyProperties policy) {
        Map<String, Category> byId = new LinkedHashMap<>();
        policy.getCategories().forEach((id, rates) -> {
            Category previous = byId.putIfAbsent(normalize(id), new Category(id, rates.getDefaultUpliftRate()));
            if (previous != null) {
                throw new IllegalStateException(String.format(
                    "Pricing categories '%s' and '%s' clash: category ids are case-insensitive",
                    previous.getId(), id));
            }
        });
        this.categories = Collections.unmodifiableMap(byId);
        log.info("Loaded {} pricing categories", categories.size());
    }

    @Override
    public Optional<Category> findById(String categoryId) {
        if (categoryId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(categories.get(normalize(categoryId)));
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
