package com.htnews.categoriesrepository.exception;

/**
 * Thrown when deleting a category fails for a reason other than not found.
 */
public final class DeleteCategoryFailure extends CategoryException {

    public DeleteCategoryFailure(Throwable cause) {
        super("Failed to delete category: " + describe(cause), cause);
    }
}
