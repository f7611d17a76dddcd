package dev.univer.expensebot.service;

import dev.univer.expensebot.model.Category;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** {@code /categories}, {@code /addcategory}, {@code /renamecategory} and {@code /deletecategory}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategoryCommandService {
    static final String RENAME_FORMAT = "❌ Please use the format:\n/renamecategory Old Name -> New Name";

    private final CategoryService categoryService;

    public String list() {
        List<Category> categories;
        try {
            categories = categoryService.getAll();
        } catch (DataAccessException e) {
            log.error("Failed to fetch categories", e);
            return "❌ Failed to fetch categories. Please try again.";
        }
        if (categories.isEmpty()) return "No categories yet. Create one with /addcategory <name>";
        return "📁 Categories\n\n" + categories.stream()
                .map(c -> "• " + c.getName())
                .collect(Collectors.joining("\n"));
    }

    public String add(String raw) {
        if (raw == null || raw.isBlank()) return "Usage: /addcategory <name>";
        try {
            Category c = categoryService.create(CategoryService.validateName(raw));
            log.info("Category {} created via command", c.getId());
            return "✅ Category created: " + c.getName();
        } catch (IllegalArgumentException e) {
            return "❌ " + e.getMessage();
        } catch (DataAccessException e) {
            log.error("Failed to create category", e);
            return "❌ Failed to create category. Please try again.";
        }
    }

    /** "/renamecategory Food -> Food - Dining Out". Renaming to another case of the same name is allowed. */
    public String rename(String args) {
        String[] names = args == null ? new String[0] : args.split("->", -1);
        if (names.length != 2) return RENAME_FORMAT;
        String oldName = names[0].trim();
        String newName = names[1].trim();
        if (oldName.isEmpty() || newName.isEmpty()) {
            return "❌ Both old and new category names are required.\n\nUsage: /renamecategory Old Name -> New Name";
        }
        try {
            newName = CategoryService.validateName(newName);
        } catch (IllegalArgumentException e) {
            return "❌ " + e.getMessage();
        }

        try {
            Optional<Category> found = categoryService.findByName(oldName);
            if (found.isEmpty()) {
                return "❌ Category '" + oldName + "' not found.\n\nUse /categories to see all categories.";
            }
            Category category = found.get();
            Optional<Category> clash = categoryService.findByName(newName);
            if (clash.isPresent() && !clash.get().getId().equals(category.getId())) {
                return "❌ Category '" + clash.get().getName() + "' already exists.";
            }
            String previous = category.getName();
            categoryService.rename(category, newName);
            log.info("Category {} renamed", category.getId());
            return "✅ Category '" + previous + "' renamed to '" + newName + "'.";
        } catch (DataAccessException e) {
            log.error("Failed to rename category '{}'", oldName, e);
            return "❌ Failed to rename category. Please try again.";
        }
    }

    /** Deletes the category named exactly (ignoring case); its expenses become uncategorized. */
    public String delete(String raw) {
        if (raw == null || raw.isBlank()) {
            return "❌ Please provide a category name.\n\nUsage: /deletecategory Food - Dining Out";
        }
        String name = raw.trim();
        try {
            Optional<Category> found = categoryService.findByName(name);
            if (found.isEmpty()) {
                return "❌ Category '" + name + "' not found.\n\nUse /categories to see all categories.";
            }
            Category category = found.get();
            int uncategorized = categoryService.delete(category);
            log.info("Category {} deleted, {} expense(s) uncategorized", category.getId(), uncategorized);
            String text = "✅ Category '" + category.getName() + "' deleted.";
            if (uncategorized > 0) {
                text += "\n\n" + uncategorized + " expense(s) have been uncategorized.";
            }
            return text;
        } catch (DataAccessException e) {
            log.error("Failed to delete category '{}'", name, e);
            return "❌ Failed to delete category. Please try again.";
        }
    }
}
