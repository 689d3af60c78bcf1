package com.htnews.categoriesrepository.repository;

import com.htnews.categoriesrepository.client.CategoriesClient;
import com.htnews.categoriesrepository.exception.CategoryException;
import com.htnews.categoriesrepository.exception.CategoryNotFoundFailure;
import com.htnews.categoriesrepository.exception.CreateCategoryFailure;
import com.htnews.categoriesrepository.exception.DeleteCategoryFailure;
import com.htnews.categoriesrepository.exception.GetCategoriesFailure;
import com.htnews.categoriesrepository.exception.GetCategoryFailure;
import com.htnews.categoriesrepository.exception.UpdateCategoryFailure;
import com.htnews.categoriesrepository.model.Category;
import com.htnews.common.dto.PaginatedResponse;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Function;

/**
 * {@link CategoriesRepository} backed by a {@link CategoriesClient}.
 * Stateless apart from the client reference, so a single instance can be shared between threads.
 */
@Slf4j
@RequiredArgsConstructor
public class CategoriesRepositoryImpl implements CategoriesRepository {

    @NonNull
    private final CategoriesClient categoriesClient;

    @Override
    public PaginatedResponse<Category> getCategories(Integer limit, String startAfterId) {
        log.debug("Fetching categories: limit={}, startAfterId={}", limit, startAfterId);
        try {
            List<Category> categories = categoriesClient.getCategories(limit, startAfterId);
            if (categories == null) {
                throw new IllegalStateException("Categories client returned no list");
            }

            // A full page is taken to mean more data may follow; a short page or an unbounded request is complete.
            boolean hasMore = limit != null && categories.size() == limit;
            String cursor = categories.isEmpty() ? null : categories.get(categories.size() - 1).getId();

            return PaginatedResponse.<Category>builder()
                    .items(categories)
                    .cursor(cursor)
                    .hasMore(hasMore)
                    .build();
        } catch (RuntimeException e) {
            throw wrap("getCategories", e, GetCategoriesFailure::new);
        }
    }

    @Override
    public Category getCategory(String id) {
        log.debug("Fetching category: id={}", id);
        try {
            return categoriesClient.getCategory(id);
        } catch (CategoryNotFoundFailure e) {
            throw passThrough("getCategory", e);
        } catch (RuntimeException e) {
            throw wrap("getCategory", e, GetCategoryFailure::new);
        }
    }

    @Override
    public Category createCategory(String name, String description, String iconUrl) {
        log.debug("Creating category: name='{}'", name);
        Category created;
        try {
            created = categoriesClient.createCategory(name, description, iconUrl);
        } catch (RuntimeException e) {
            throw wrap("createCategory", e, CreateCategoryFailure::new);
        }
        log.info("Category created: id={}, name='{}'", created.getId(), created.getName());
        return created;
    }

    @Override
    public Category updateCategory(Category category) {
        log.debug("Updating category: id={}", category.getId());
        Category updated;
        try {
            updated = categoriesClient.updateCategory(category);
        } catch (CategoryNotFoundFailure e) {
            throw passThrough("updateCategory", e);
        } catch (RuntimeException e) {
            throw wrap("updateCategory", e, UpdateCategoryFailure::new);
        }
        log.info("Category updated: id={}, name='{}'", updated.getId(), updated.getName());
        return updated;
    }

    @Override
    public void deleteCategory(String id) {
        log.debug("Deleting category: id={}", id);
        try {
            categoriesClient.deleteCategory(id);
        } catch (CategoryNotFoundFailure e) {
            throw passThrough("deleteCategory", e);
        } catch (RuntimeException e) {
            throw wrap("deleteCategory", e, DeleteCategoryFailure::new);
        }
        log.info("Category deleted: id={}", id);
    }

    private static CategoryNotFoundFailure passThrough(String operation, CategoryNotFoundFailure notFound) {
        // Not-found handling belongs to the caller
        log.debug("{}: category {} not found", operation, notFound.getCategoryId());
        return notFound;
    }

    private static CategoryException wrap(String operation, RuntimeException cause,
                                          Function<Throwable, CategoryException> failure) {
        log.warn("{} failed: {}", operation, CategoryException.describe(cause));
        return failure.apply(cause);
    }
}
