package com.flamingo.ai.manualkb.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.manualkb.domain.enums.IssueSeverity;
import com.flamingo.ai.manualkb.service.pipeline.PageWorkerPool.PageResults;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PageWorkerPoolTest {

  private ExecutorService executor;

  @AfterEach
  void tearDown() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  @Test
  @DisplayName("Should return items in page order regardless of completion order")
  void shouldKeepPageOrder() {
    // Given
    executor = Executors.newFixedThreadPool(4);
    PageWorkerPool pool = new PageWorkerPool(executor);
    Map<Integer, String> pages = new LinkedHashMap<>();
    pages.put(3, "c");
    pages.put(1, "a");
    pages.put(2, "b");

    // When
    PageResults<String> results =
        pool.run(
            "test",
            pages,
            (page, text) -> {
              sleepQuietly((4 - page) * 20L);
              return List.of(text + page, text.toUpperCase() + page);
            });

    // Then
    assertThat(results.items()).containsExactly("a1", "A1", "b2", "B2", "c3", "C3");
    assertThat(results.issues()).isEmpty();
  }

  @Test
  @DisplayName("Should skip a failing page and report it as a warning")
  void shouldReportFailedPage() {
    // Given
    PageWorkerPool pool = new PageWorkerPool(Runnable::run);
    Map<Integer, String> pages = Map.of(1, "ok", 2, "boom", 3, "ok");

    // When
    PageResults<Integer> results =
        pool.run(
            "parts",
            pages,
            (page, text) -> {
              if ("boom".equals(text)) {
                throw new IllegalStateException("unreadable table");
              }
              return List.of(page);
            });

    // Then
    assertThat(results.items()).containsExactly(1, 3);
    assertThat(results.issues()).singleElement().satisfies(
        issue -> {
          assertThat(issue.stage()).isEqualTo("parts");
          assertThat(issue.field()).isEqualTo("page");
          assertThat(issue.value()).isEqualTo("2");
          assertThat(issue.message()).isEqualTo("Page 2 skipped: unreadable table");
          assertThat(issue.severity()).isEqualTo(IssueSeverity.WARNING);
          assertThat(issue.isBlocking()).isFalse();
        });
  }

  @Test
  @DisplayName("Should tolerate tasks that return null")
  void shouldIgnoreNullResults() {
    PageWorkerPool pool = new PageWorkerPool(Runnable::run);

    PageResults<String> results = pool.run("links", Map.of(1, "x"), (page, text) -> null);

    assertThat(results.items()).isEmpty();
    assertThat(results.issues()).isEmpty();
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
