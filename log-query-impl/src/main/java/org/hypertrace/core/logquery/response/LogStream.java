package org.hypertrace.core.logquery.response;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

/**
 * Entries of one label set, e.g. {@code {app="foo", env="prod"}}. Within one shard answer the
 * entries are sorted in the query direction.
 */
@Value
public class LogStream {
  @NonNull String labels;
  @NonNull List<Entry> entries;
}
