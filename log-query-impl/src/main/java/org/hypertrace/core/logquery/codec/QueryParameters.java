package org.hypertrace.core.logquery.codec;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.List;
import java.util.Optional;
import okhttp3.FormBody;
import okhttp3.HttpUrl;

/** Decoded query string and form values of a request, in the order they were sent. */
public class QueryParameters {
  private static final HttpUrl FORM_PARSING_BASE = HttpUrl.get("http://localhost/");

  private final ListMultimap<String, String> values;

  private QueryParameters(ListMultimap<String, String> values) {
    this.values = values;
  }

  public static QueryParameters of(ListMultimap<String, String> values) {
    return new QueryParameters(ImmutableListMultimap.copyOf(values));
  }

  public static QueryParameters fromUrl(HttpUrl url) {
    ImmutableListMultimap.Builder<String, String> builder = ImmutableListMultimap.builder();
    for (int i = 0; i < url.querySize(); i++) {
      String value = url.queryParameterValue(i);
      builder.put(url.queryParameterName(i), value == null ? "" : value);
    }
    return new QueryParameters(builder.build());
  }

  /** Parses an {@code application/x-www-form-urlencoded} body. */
  public static QueryParameters fromForm(String body) {
    return fromUrl(FORM_PARSING_BASE.newBuilder().encodedQuery(body).build());
  }

  public static QueryParameters fromFormBody(FormBody body) {
    ImmutableListMultimap.Builder<String, String> builder = ImmutableListMultimap.builder();
    for (int i = 0; i < body.size(); i++) {
      builder.put(body.name(i), body.value(i));
    }
    return new QueryParameters(builder.build());
  }

  /** Values of {@code this} come first, as form values take precedence over the URL query. */
  public QueryParameters followedBy(QueryParameters other) {
    return new QueryParameters(
        ImmutableListMultimap.<String, String>builder()
            .putAll(values)
            .putAll(other.values)
            .build());
  }

  /** First non-empty value of the parameter. */
  public Optional<String> get(String name) {
    return values.get(name).stream().filter(value -> !value.isEmpty()).findFirst();
  }

  public List<String> getAll(String name) {
    return values.get(name);
  }
}
