package uk.ac.ebi.biostudies.index_core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IndexCoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(IndexCoreApplication.class, args);
  }
}
