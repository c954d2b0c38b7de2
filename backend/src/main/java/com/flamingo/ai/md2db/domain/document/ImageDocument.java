package com.flamingo.ai.md2db.domain.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** Canonical image reference, keyed by the digest of its URL. The alt text is not hashed. */
@Document(collection = "images")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImageDocument implements CanonicalEntity {

  @Id private String id;

  private String url;

  private String alt;

  private String hash;
}
