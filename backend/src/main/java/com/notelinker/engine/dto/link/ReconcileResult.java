package com.notelinker.engine.dto.link;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Links added to and removed from one note")
public class ReconcileResult {
  private int added;
  private int removed;

  public static ReconcileResult unchanged() {
    return new ReconcileResult(0, 0);
  }

  public boolean isChanged() {
    return added > 0 || removed > 0;
  }
}
