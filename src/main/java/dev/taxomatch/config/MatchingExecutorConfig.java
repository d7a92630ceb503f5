package dev.taxomatch.config;

import dev.taxomatch.match.MatchingConfig;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Thread pool on which candidates are matched, sized by {@code taxomatch.matching.concurrency}. */
@Configuration
public class MatchingExecutorConfig {

  @Bean(name = "matchingExecutor", destroyMethod = "shutdown")
  public ExecutorService matchingExecutor(MatchingConfig matchingConfig) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "taxomatch-match-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(matchingConfig.concurrency(), threadFactory);
  }
}
