package io.b2mash.reportengine.config;

import io.b2mash.reportengine.cache.CacheProperties;
import io.b2mash.reportengine.catalog.CatalogProperties;
import io.b2mash.reportengine.credential.CredentialProperties;
import io.b2mash.reportengine.customreport.ScheduledJobLookup;
import io.b2mash.reportengine.execution.ExecutionProperties;
import io.b2mash.reportengine.execution.connector.ConnectorProperties;
import io.b2mash.reportengine.query.QueryProperties;
import io.b2mash.reportengine.source.SourceProperties;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import tools.jackson.databind.json.JsonMapper;

@Configuration
@EnableConfigurationProperties({
  SourceProperties.class,
  CredentialProperties.class,
  CatalogProperties.class,
  QueryProperties.class,
  ExecutionProperties.class,
  ConnectorProperties.class,
  CacheProperties.class
})
public class EngineConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  JsonMapper jsonMapper() {
    return JsonMapper.builder().build();
  }

  /** Runs submitted executions. Bounded queue; callers see a rejection when it is full. */
  @Bean
  ThreadPoolTaskExecutor reportExecutor(ExecutionProperties properties) {
    var workers = properties.workers();
    var executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("report-exec-");
    executor.setCorePoolSize(workers.coreSize());
    executor.setMaxPoolSize(workers.maxSize());
    executor.setQueueCapacity(workers.queueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(workers.shutdownGrace().toMillis());
    return executor;
  }

  /** Fires execution timeouts and the idle connection sweep. */
  @Bean
  ThreadPoolTaskScheduler taskScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("report-timer-");
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  /** Used when no scheduler integration provides one: nothing is ever scheduled. */
  @Bean
  @ConditionalOnMissingBean(ScheduledJobLookup.class)
  ScheduledJobLookup scheduledJobLookup() {
    return customReportId -> false;
  }
}
