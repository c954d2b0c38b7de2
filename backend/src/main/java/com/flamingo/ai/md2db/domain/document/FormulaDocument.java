package com.flamingo.ai.md2db.domain.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** Canonical LaTeX formula source, delimiters stripped. */
@Document(collection = "formulas")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FormulaDocument implements CanonicalEntity {

  @Id private String id;

  private String formula;

  private String hash;
}
