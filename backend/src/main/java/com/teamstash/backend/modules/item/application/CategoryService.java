package com.teamstash.backend.modules.item.application;

import java.util.List;

import com.teamstash.backend.modules.item.infrastructure.persistence.CategoryRepository;
import com.teamstash.backend.modules.item.presentation.dto.CategoryResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class CategoryService {

    private final CategoryRepository categoryRepository;

    public CategoryService(CategoryRepository categoryRepository) {
        this.categoryRepository = categoryRepository;
    }

    public List<CategoryResponse> listCategories() {
        return categoryRepository.findAllByOrderByNameAsc().stream()
                .map(CategoryResponse::from)
                .toList();
    }
}
