package io.intellixity.classql.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class ClassqlExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(ClassqlExamplesApplication.class, args);
  }
}
