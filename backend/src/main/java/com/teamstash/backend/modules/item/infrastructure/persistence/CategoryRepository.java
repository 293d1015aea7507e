package com.teamstash.backend.modules.item.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.teamstash.backend.modules.item.domain.Category;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CategoryRepository extends JpaRepository<Category, UUID> {

    List<Category> findAllByOrderByNameAsc();
}
