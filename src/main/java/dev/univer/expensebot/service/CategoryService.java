package dev.univer.expensebot.service;

import dev.univer.expensebot.model.Category;
import dev.univer.expensebot.repo.CategoryRepository;
import dev.univer.expensebot.repo.ExpenseRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class CategoryService {
    public static final int MAX_NAME_LENGTH = 50;

    private final CategoryRepository categoryRepository;
    private final ExpenseRepository expenseRepository;

    /** All categories by id, so that matching ties always resolve the same way. */
    public List<Category> getAll() {
        return categoryRepository.findAllByOrderByIdAsc();
    }

    public Optional<Category> findById(Long id) {
        return categoryRepository.findById(id);
    }

    public Optional<Category> findByName(String name) {
        return categoryRepository.findByNormalizedName(normalizeName(name));
    }

    @Transactional
    public Category create(String rawName) {
        String name = validateName(rawName);
        if (findByName(name).isPresent()) {
            throw new IllegalArgumentException("Category already exists: " + name);
        }
        return save(name);
    }

    /** Returns the category with this name, creating it when there is none. */
    @Transactional
    public Category findOrCreate(String rawName) {
        String name = validateName(rawName);
        return findByName(name).orElseGet(() -> save(name));
    }

    @Transactional
    public Category rename(Category category, String rawName) {
        String name = validateName(rawName);
        category.setName(name);
        category.setNormalizedName(normalizeName(name));
        return categoryRepository.save(category);
    }

    /**
     * Deletes the category; its expenses stay, uncategorized.
     *
     * @return how many expenses lost the category
     */
    @Transactional
    public int delete(Category category) {
        int uncategorized = expenseRepository.clearCategory(category.getId());
        categoryRepository.delete(category);
        return uncategorized;
    }

    /**
     * Checks a user-typed category name and returns it trimmed.
     *
     * @throws IllegalArgumentException with a message fit to show the user
     */
    public static String validateName(String raw) {
        String name = raw == null ? "" : raw.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Category name cannot be empty.");
        }
        if (name.codePointCount(0, name.length()) > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Category name is too long (max " + MAX_NAME_LENGTH + " characters).");
        }
        if (name.codePoints().anyMatch(Character::isISOControl)) {
            throw new IllegalArgumentException("Category name contains invalid characters.");
        }
        return name;
    }

    public static List<String> names(List<Category> categories) {
        return categories.stream().map(Category::getName).toList();
    }

    static String normalizeName(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    private Category save(String name) {
        Category c = Category.builder()
                .name(name)
                .normalizedName(normalizeName(name))
                .createdAt(Instant.now())
                .build();
        return categoryRepository.save(c);
    }
}
