package com.example.rdsbroker.core.tags;

import java.util.List;

/** Remote lookup behind a {@link TagStore}. */
@FunctionalInterface
public interface TagSource {

  /**
   * Lists the tags currently attached to a resource.
   *
   * @param resourceId provider resource name (ARN)
   * @return tags in provider order
   */
  List<Tag> fetch(String resourceId);
}
