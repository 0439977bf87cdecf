package io.github.themoah.ybstats;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Decides when the second capture of an adhoc diff starts.
 */
@FunctionalInterface
public interface AdhocTrigger {

  Future<Void> awaitEndCapture();

  /**
   * Starts the second capture right away.
   */
  static AdhocTrigger immediate() {
    return Future::succeededFuture;
  }

  /**
   * Prompts on {@code prompt} and waits on a worker thread until a line is read from {@code in}.
   */
  static AdhocTrigger enterKey(Vertx vertx, InputStream in, PrintStream prompt) {
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    return () -> vertx.executeBlocking(() -> {
      prompt.print("Begin capture done, press enter to capture the end and show the difference ");
      prompt.flush();
      reader.readLine();
      return null;
    });
  }
}
