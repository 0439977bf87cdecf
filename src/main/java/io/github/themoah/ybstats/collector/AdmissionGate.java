package io.github.themoah.ybstats.collector;

import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs asynchronous tasks with a bound on how many are in flight at once.
 */
public final class AdmissionGate {

  private AdmissionGate() {}

  /**
   * Applies {@code task} to every item, never running more than {@code parallelism}
   * tasks at the same time. Workers take the next item as soon as their previous task
   * completes, so a slow item holds back only its own slot.
   *
   * @param items the items to process
   * @param parallelism maximum tasks in flight, values below 1 are treated as 1
   * @param task function that starts the work for one item
   * @return Future with one result per item, in item order, completed once every task
   *   completed; fails with the first task failure
   */
  public static <T, R> Future<List<R>> runBounded(
      List<T> items, int parallelism, Function<T, Future<R>> task) {

    if (items.isEmpty()) {
      return Future.succeededFuture(List.of());
    }

    int workers = Math.min(Math.max(parallelism, 1), items.size());
    List<R> results = Collections.synchronizedList(new ArrayList<>(Collections.nCopies(items.size(), null)));
    AtomicInteger next = new AtomicInteger();

    List<Future<Void>> chains = new ArrayList<>(workers);
    for (int i = 0; i < workers; i++) {
      chains.add(drain(items, next, results, task));
    }

    return Future.all(chains).map(v -> new ArrayList<>(results));
  }

  private static <T, R> Future<Void> drain(
      List<T> items, AtomicInteger next, List<R> results, Function<T, Future<R>> task) {

    int index = next.getAndIncrement();
    if (index >= items.size()) {
      return Future.succeededFuture();
    }
    return task.apply(items.get(index))
      .compose(result -> {
        results.set(index, result);
        return drain(items, next, results, task);
      });
  }
}
