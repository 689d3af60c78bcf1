package com.htnews.categoriesrepository.exception;

/**
 * Thrown when updating a category fails for a reason other than not found.
 */
public final class UpdateCategoryFailure extends CategoryException {

    public UpdateCategoryFailure(Throwable cause) {
        super("Failed to update category: " + describe(cause), cause);
    }
}
