package uk.gegc.trivia.features.category.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.trivia.features.category.api.dto.CategoryListResponse;
import uk.gegc.trivia.features.category.application.CategoryService;
import uk.gegc.trivia.features.category.domain.model.Category;
import uk.gegc.trivia.features.category.domain.repository.CategoryRepository;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class CategoryServiceImpl implements CategoryService {

    private final CategoryRepository categoryRepository;

    @Override
    public CategoryListResponse listCategories() {
        Map<Integer, String> categories = getCategoryTypes();
        return new CategoryListResponse(true, categories, categories.size());
    }

    @Override
    public Map<Integer, String> getCategoryTypes() {
        Map<Integer, String> categories = new LinkedHashMap<>();
        for (Category category : categoryRepository.findAllByOrderByIdAsc()) {
            categories.put(category.getId(), category.getType());
        }
        return categories;
    }
}
