package com.flamingo.ai.md2db.domain.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** Canonical answer option text shared by every question offering it. */
@Document(collection = "options")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptionDocument implements CanonicalEntity {

  @Id private String id;

  private String content;

  private String hash;
}
