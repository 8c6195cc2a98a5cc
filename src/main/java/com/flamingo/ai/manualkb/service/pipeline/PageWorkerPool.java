package com.flamingo.ai.manualkb.service.pipeline;

import com.flamingo.ai.manualkb.domain.enums.IssueSeverity;
import com.flamingo.ai.manualkb.domain.model.ValidationIssue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs a per-page extraction task on the bounded page executor and reassembles the results in
 * page order. A failing page is skipped and reported; the other pages are unaffected.
 */
@Component
@Slf4j
public class PageWorkerPool {

  private final Executor executor;

  public PageWorkerPool(@Qualifier("pageExtractionExecutor") Executor executor) {
    this.executor = executor;
  }

  /**
   * Applies a task to every page.
   *
   * @param stage stage name used in issues and logs
   * @param pages page texts keyed by 1-based page number
   * @param task extraction applied to each page
   * @return items of all pages in ascending page order, plus one issue per failed page
   */
  public <T> PageResults<T> run(String stage, Map<Integer, String> pages, PageTask<T> task) {
    Map<Integer, CompletableFuture<List<T>>> futures = new TreeMap<>();
    pages.forEach(
        (page, text) ->
            futures.put(
                page, CompletableFuture.supplyAsync(() -> task.extract(page, text), executor)));

    List<T> items = new ArrayList<>();
    List<ValidationIssue> issues = new ArrayList<>();
    futures.forEach(
        (page, future) -> {
          try {
            List<T> found = future.join();
            if (found != null) {
              items.addAll(found);
            }
          } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} failed on page {}: {}", stage, page, cause.getMessage());
            issues.add(
                new ValidationIssue(
                    stage,
                    "page",
                    String.valueOf(page),
                    "Page " + page + " skipped: " + cause.getMessage(),
                    IssueSeverity.WARNING));
          }
        });
    return new PageResults<>(List.copyOf(items), List.copyOf(issues));
  }

  // ---- inner types ----

  /** Extraction applied to a single page. */
  @FunctionalInterface
  public interface PageTask<T> {
    List<T> extract(int pageNumber, String text);
  }

  /**
   * Items and problems of a per-page run.
   *
   * @param items results in page order
   * @param issues one warning per failed page
   */
  public record PageResults<T>(List<T> items, List<ValidationIssue> issues) {}
}
