package io.intellixity.classql.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "classql")
public class ClassqlProperties {
  private String jdbcUrl = "jdbc:sqlite:classql.db";
  private String username;
  private String password;
  private int maximumPoolSize = 4;
  private final Schema schema = new Schema();
  private final DemoData demoData = new DemoData();

  public String getJdbcUrl() { return jdbcUrl; }
  public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
  public String getUsername() { return username; }
  public void setUsername(String username) { this.username = username; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  public int getMaximumPoolSize() { return maximumPoolSize; }
  public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  public Schema getSchema() { return schema; }
  public DemoData getDemoData() { return demoData; }

  public static class Schema {
    /** Rows sampled per table by the schema endpoint. */
    private int sampleRows = 20;

    public int getSampleRows() { return sampleRows; }
    public void setSampleRows(int sampleRows) { this.sampleRows = sampleRows; }
  }

  public static class DemoData {
    private boolean enabled;
    private String script = "classpath:demo-data.sql";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getScript() { return script; }
    public void setScript(String script) { this.script = script; }
  }
}
