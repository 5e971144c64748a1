package com.notelinker.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NoteLinkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(NoteLinkerApplication.class, args);
  }
}
