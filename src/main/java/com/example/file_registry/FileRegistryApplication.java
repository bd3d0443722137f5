package com.example.file_registry;

import lombok.Generated;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Generated
@SpringBootApplication
public class FileRegistryApplication {
  public static void main(String[] args) {
    SpringApplication.run(FileRegistryApplication.class, args);
  }
}
