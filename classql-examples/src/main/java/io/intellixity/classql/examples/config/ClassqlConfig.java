package io.intellixity.classql.examples.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.classql.jdbc.JdbcHandle;
import io.intellixity.classql.jdbc.JdbcQueryExecutor;
import io.intellixity.classql.jdbc.QueryRunner;
import io.intellixity.classql.jdbc.schema.SchemaInspector;
import io.intellixity.classql.render.ResultRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(ClassqlProperties.class)
public class ClassqlConfig {
  private static final Logger log = LoggerFactory.getLogger(ClassqlConfig.class);
  private static final String HANDLE_ID = "jdbc:classql";

  @Bean(destroyMethod = "close")
  public HikariDataSource classqlDataSource(ClassqlProperties props, ResourceLoader resources) {
    String url = props.getJdbcUrl();
    if (url == null || url.isBlank()) throw new IllegalArgumentException("Missing classql.jdbc-url");

    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(url);
    hc.setUsername(props.getUsername());
    hc.setPassword(props.getPassword());
    hc.setMaximumPoolSize(props.getMaximumPoolSize());
    hc.setPoolName("classql");
    HikariDataSource ds = new HikariDataSource(hc);

    if (props.getDemoData().isEnabled()) {
      applyDemoData(ds, resources, props.getDemoData().getScript());
    }
    return ds;
  }

  public static void applyDemoData(DataSource ds, ResourceLoader resources, String script) {
    ResourceDatabasePopulator populator = new ResourceDatabasePopulator(resources.getResource(script));
    populator.setSqlScriptEncoding("UTF-8");
    DatabasePopulatorUtils.execute(populator, ds);
    log.info("classql.demo_data applied script={}", script);
  }

  @Bean
  public JdbcHandle classqlHandle(DataSource ds) {
    return new JdbcHandle(HANDLE_ID, ds);
  }

  @Bean
  public JdbcQueryExecutor jdbcQueryExecutor(JdbcHandle handle) {
    return new JdbcQueryExecutor(handle);
  }

  @Bean
  public QueryRunner queryRunner(JdbcQueryExecutor executor) {
    return new QueryRunner(executor);
  }

  @Bean
  public SchemaInspector schemaInspector(JdbcQueryExecutor executor) {
    return new SchemaInspector(executor);
  }

  @Bean
  public ResultRenderer resultRenderer(ObjectMapper mapper) {
    return new ResultRenderer(mapper);
  }
}
