package com.htnews.categoriesrepository.client;

import com.htnews.categoriesrepository.exception.CategoryNotFoundFailure;
import com.htnews.categoriesrepository.model.Category;

import java.util.List;

/**
 * Data source for categories (remote API, database, in-memory store...).
 * <p>
 * Implementations report a missing category by throwing {@link CategoryNotFoundFailure}.
 * Any other unchecked exception is treated as a general failure of the call.
 */
public interface CategoriesClient {

    // limit and startAfterId may both be null
    List<Category> getCategories(Integer limit, String startAfterId);

    Category getCategory(String id);

    Category createCategory(String name, String description, String iconUrl);

    // category.getId() selects the category to replace
    Category updateCategory(Category category);

    void deleteCategory(String id);
}
