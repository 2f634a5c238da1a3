package alert.grouping.infrastructure.config;

import alert.grouping.infrastructure.executor.DefaultLogicExecutor;
import alert.grouping.infrastructure.executor.LogicExecutor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor logicExecutor() {
    return new DefaultLogicExecutor();
  }
}
