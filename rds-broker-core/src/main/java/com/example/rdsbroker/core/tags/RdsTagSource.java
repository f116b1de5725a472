package com.example.rdsbroker.core.tags;

import com.example.rdsbroker.core.aws.ProviderErrors;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.ListTagsForResourceRequest;

/** {@link TagSource} backed by the RDS {@code ListTagsForResource} call. */
public final class RdsTagSource implements TagSource {

  private final RdsClient rds;

  public RdsTagSource(final RdsClient rds) {
    this.rds = Objects.requireNonNull(rds, "rds");
  }

  @Override
  public List<Tag> fetch(final String resourceId) {
    final var request = ListTagsForResourceRequest.builder().resourceName(resourceId).build();
    final var response =
        ProviderErrors.call("list tags for " + resourceId, () -> rds.listTagsForResource(request));
    if (!response.hasTagList()) return List.of();
    return response.tagList().stream().map(t -> new Tag(t.key(), t.value())).toList();
  }
}
