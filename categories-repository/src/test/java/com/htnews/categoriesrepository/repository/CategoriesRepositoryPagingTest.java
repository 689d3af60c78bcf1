package com.htnews.categoriesrepository.repository;

import com.htnews.categoriesrepository.client.InMemoryCategoriesClient;
import com.htnews.categoriesrepository.exception.CategoryException;
import com.htnews.categoriesrepository.exception.CategoryNotFoundFailure;
import com.htnews.categoriesrepository.exception.GetCategoriesFailure;
import com.htnews.categoriesrepository.exception.UpdateCategoryFailure;
import com.htnews.categoriesrepository.model.Category;
import com.htnews.common.dto.PaginatedResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the repository against an in-memory client to check that cursors chain across pages
 * and that create, update and delete behave end to end.
 */
@DisplayName("CategoriesRepository Paging Tests")
class CategoriesRepositoryPagingTest {

  private InMemoryCategoriesClient client;
  private CategoriesRepository repository;

  @BeforeEach
  void setUp() {
    client = new InMemoryCategoriesClient();
    repository = new CategoriesRepositoryImpl(client);
  }

  @Test
  @DisplayName("should walk every category page by page using the cursor")
  void shouldWalkAllPages() {
    // Arrange
    List<String> createdIds = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      createdIds.add(repository.createCategory("Category " + i, null, null).getId());
    }

    // Act
    List<String> seenIds = new ArrayList<>();
    List<Boolean> hasMoreFlags = new ArrayList<>();
    String cursor = null;
    boolean hasMore = true;
    while (hasMore) {
      PaginatedResponse<Category> page = repository.getCategories(3, cursor);
      page.getItems().forEach(c -> seenIds.add(c.getId()));
      hasMoreFlags.add(page.isHasMore());
      cursor = page.getCursor();
      hasMore = page.isHasMore();
    }

    // Assert
    assertThat(seenIds).containsExactlyElementsOf(createdIds);
    assertThat(hasMoreFlags).containsExactly(true, true, false);
    assertThat(cursor).isEqualTo(createdIds.get(6));
  }

  @Test
  @DisplayName("should request one extra empty page when the total is a multiple of the page size")
  void shouldRequestExtraPageOnExactMultiple() {
    // Arrange
    for (int i = 0; i < 4; i++) {
      repository.createCategory("Category " + i, null, null);
    }

    // Act
    PaginatedResponse<Category> first = repository.getCategories(2, null);
    PaginatedResponse<Category> second = repository.getCategories(2, first.getCursor());
    PaginatedResponse<Category> third = repository.getCategories(2, second.getCursor());

    // Assert
    assertThat(second.isHasMore()).isTrue();
    assertThat(third.getItems()).isEmpty();
    assertThat(third.getCursor()).isNull();
    assertThat(third.isHasMore()).isFalse();
  }

  @Test
  @DisplayName("should update, read back and delete a category")
  void shouldUpdateAndDelete() {
    // Arrange
    Category created = repository.createCategory("Sports", "All sports", "sports.png");

    // Act
    Category updated = repository.updateCategory(created.withName("World Sports"));
    Category fetched = repository.getCategory(created.getId());
    repository.deleteCategory(created.getId());

    // Assert
    assertThat(updated.getName()).isEqualTo("World Sports");
    assertThat(fetched).isEqualTo(updated);
    assertThatThrownBy(() -> repository.getCategory(created.getId()))
        .isInstanceOf(CategoryNotFoundFailure.class);
    assertThatThrownBy(() -> repository.deleteCategory(created.getId()))
        .isInstanceOf(CategoryNotFoundFailure.class)
        .isInstanceOf(CategoryException.class);
  }

  @Test
  @DisplayName("should wrap a backend failure and make one client call per operation")
  void shouldWrapBackendFailure() {
    // Arrange
    Category created = repository.createCategory("Politics", null, null);
    client.failNextCall(new IllegalStateException("connection reset"));
    int callsBefore = client.getCallCount();

    // Act & Assert
    assertThatThrownBy(() -> repository.updateCategory(created))
        .isInstanceOf(UpdateCategoryFailure.class)
        .hasRootCauseMessage("connection reset");
    assertThatThrownBy(() -> repository.getCategories(5, "no-such-cursor"))
        .isInstanceOf(GetCategoriesFailure.class)
        .hasCauseInstanceOf(IllegalArgumentException.class);
    assertThat(client.getCallCount()).isEqualTo(callsBefore + 2);
  }

  @Test
  @DisplayName("should serve concurrent callers from one instance")
  void shouldServeConcurrentCallers() throws Exception {
    // Arrange
    ExecutorService executor = Executors.newFixedThreadPool(8);
    List<Future<Category>> futures = new ArrayList<>();

    // Act
    try {
      for (int i = 0; i < 40; i++) {
        String name = "Concurrent " + i;
        futures.add(executor.submit(() -> repository.createCategory(name, null, null)));
      }
      for (Future<Category> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdown();
    }

    // Assert
    PaginatedResponse<Category> all = repository.getCategories();
    assertThat(all.getItems()).hasSize(40);
    assertThat(all.isHasMore()).isFalse();
  }
}
