package com.htnews.categoriesrepository.exception;

/**
 * Thrown when creating a category fails.
 */
public final class CreateCategoryFailure extends CategoryException {

    public CreateCategoryFailure(Throwable cause) {
        super("Failed to create category: " + describe(cause), cause);
    }
}
