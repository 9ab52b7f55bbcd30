package uk.gegc.trivia.features.category.application;

import uk.gegc.trivia.features.category.api.dto.CategoryListResponse;

import java.util.Map;

public interface CategoryService {

    CategoryListResponse listCategories();

    /**
     * Category labels keyed by id, in id order.
     */
    Map<Integer, String> getCategoryTypes();
}
