package com.htnews.categoriesrepository.exception;

/**
 * Thrown when listing categories fails.
 */
public final class GetCategoriesFailure extends CategoryException {

    public GetCategoriesFailure(Throwable cause) {
        super("Failed to get categories: " + describe(cause), cause);
    }
}
