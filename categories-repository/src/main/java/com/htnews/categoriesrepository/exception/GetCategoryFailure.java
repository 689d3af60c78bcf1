package com.htnews.categoriesrepository.exception;

/**
 * Thrown when fetching a single category fails for a reason other than not found.
 */
public final class GetCategoryFailure extends CategoryException {

    public GetCategoryFailure(Throwable cause) {
        super("Failed to get category: " + describe(cause), cause);
    }
}
