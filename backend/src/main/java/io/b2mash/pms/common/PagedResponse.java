package io.b2mash.pms.common;

import java.util.List;
import java.util.function.Function;

/** Limit/offset page of results with the total count of the unpaged query. */
public record PagedResponse<T>(List<T> items, Pagination pagination) {

  public record Pagination(long total, int limit, int offset, boolean hasMore) {}

  public static <T> PagedResponse<T> of(List<T> items, long total, int limit, int offset) {
    return new PagedResponse<>(
        items, new Pagination(total, limit, offset, (long) offset + items.size() < total));
  }

  public <R> PagedResponse<R> map(Function<T, R> mapper) {
    return new PagedResponse<>(items.stream().map(mapper).toList(), pagination);
  }
}
