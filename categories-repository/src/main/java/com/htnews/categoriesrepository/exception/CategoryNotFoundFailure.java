package com.htnews.categoriesrepository.exception;

/**
 * Thrown by a categories client when no category exists for an id.
 * The repository passes it through unchanged on get, update and delete.
 */
public final class CategoryNotFoundFailure extends CategoryException {

    private final String categoryId;

    public CategoryNotFoundFailure(String categoryId) {
        this(categoryId, null);
    }

    public CategoryNotFoundFailure(String categoryId, Throwable cause) {
        super("Category not found: " + categoryId, cause);
        this.categoryId = categoryId;
    }

    public String getCategoryId() {
        return categoryId;
    }
}
