package com.htnews.categoriesrepository.repository;

import com.htnews.categoriesrepository.exception.CategoryException;
import com.htnews.categoriesrepository.exception.CategoryNotFoundFailure;
import com.htnews.categoriesrepository.exception.CreateCategoryFailure;
import com.htnews.categoriesrepository.exception.DeleteCategoryFailure;
import com.htnews.categoriesrepository.exception.GetCategoriesFailure;
import com.htnews.categoriesrepository.exception.GetCategoryFailure;
import com.htnews.categoriesrepository.exception.UpdateCategoryFailure;
import com.htnews.categoriesrepository.model.Category;
import com.htnews.common.dto.PaginatedResponse;

/**
 * Entry point for business logic working with categories.
 * Every method makes exactly one call to the underlying categories client and
 * reports failures as a {@link CategoryException}.
 */
public interface CategoriesRepository {

    /**
     * Fetches one page of categories.
     *
     * @param limit        page size, or null for no explicit page size
     * @param startAfterId id of the last category of the previous page, or null to start at the beginning
     * @return the page; {@code hasMore} is true only when a limit was given and the page is full
     * @throws GetCategoriesFailure if the client call fails
     */
    PaginatedResponse<Category> getCategories(Integer limit, String startAfterId);

    default PaginatedResponse<Category> getCategories() {
        return getCategories(null, null);
    }

    /**
     * @throws CategoryNotFoundFailure if no category has this id
     * @throws GetCategoryFailure      on any other client failure
     */
    Category getCategory(String id);

    /**
     * @throws CreateCategoryFailure if the client call fails
     */
    Category createCategory(String name, String description, String iconUrl);

    /**
     * Replaces the category identified by {@code category.getId()} with the given values.
     *
     * @throws CategoryNotFoundFailure if no category has this id
     * @throws UpdateCategoryFailure   on any other client failure
     */
    Category updateCategory(Category category);

    /**
     * @throws CategoryNotFoundFailure if no category has this id
     * @throws DeleteCategoryFailure   on any other client failure
     */
    void deleteCategory(String id);
}
