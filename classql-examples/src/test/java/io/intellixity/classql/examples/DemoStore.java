package io.intellixity.classql.examples;

import io.intellixity.classql.examples.config.ClassqlConfig;
import io.intellixity.classql.examples.service.QueryService;
import io.intellixity.classql.jdbc.JdbcHandle;
import io.intellixity.classql.jdbc.JdbcQueryExecutor;
import io.intellixity.classql.jdbc.QueryRunner;
import io.intellixity.classql.render.ResultRenderer;
import org.springframework.core.io.DefaultResourceLoader;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;

/** SQLite file store loaded with the bundled demo data. */
public final class DemoStore {
  public static final String SCRIPT = "classpath:demo-data.sql";

  private DemoStore() {}

  public static SQLiteDataSource dataSource(Path dir) {
    SQLiteDataSource ds = new SQLiteDataSource();
    ds.setUrl("jdbc:sqlite:" + dir.resolve("demo.db").toAbsolutePath());
    ClassqlConfig.applyDemoData(ds, new DefaultResourceLoader(), SCRIPT);
    return ds;
  }

  public static JdbcQueryExecutor executor(Path dir) {
    return new JdbcQueryExecutor(new JdbcHandle("demo", dataSource(dir)));
  }

  public static QueryService queryService(Path dir) {
    return new QueryService(new QueryRunner(executor(dir)), new ResultRenderer());
  }
}
