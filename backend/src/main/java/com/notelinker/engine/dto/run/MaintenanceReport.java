package com.notelinker.engine.dto.run;

import java.util.ArrayList;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "Outcome of a maintenance pass over the vault")
public class MaintenanceReport {
  private String operation;
  private int scanned;
  private int updated;
  private int skipped;
  private final List<String> warnings = new ArrayList<>();

  public MaintenanceReport(String operation) {
    this.operation = operation;
  }
}
