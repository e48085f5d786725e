package com.cario.scholar.app.service.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Shape of the model's answer to the affiliation prompt; also the source of its JSON schema. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AffiliationExtraction {

  private List<AuthorEntry> authors = new ArrayList<>();

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class AuthorEntry {
    private String name;
    private List<String> affiliations = new ArrayList<>();
    private String email;
  }
}
