package com.cario.scholar.app.service.worker;

import com.cario.scholar.app.model.KnownAuthor;
import java.util.Optional;

/** Read access to previously persisted author data, keyed by exact author name. */
@FunctionalInterface
public interface AuthorKnowledge {

  AuthorKnowledge NONE = name -> Optional.empty();

  Optional<KnownAuthor> find(String authorName);
}
