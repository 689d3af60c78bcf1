package com.htnews.common.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of a listing call.
 * The cursor is the id of the last item on the page (null when the page is empty)
 * and can be passed back as "start after" to fetch the next page.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaginatedResponse<T> {

    List<T> items;

    String cursor;

    @JsonProperty("has_more")
    boolean hasMore;

    @Builder
    @JsonCreator
    public PaginatedResponse(@JsonProperty("items") List<T> items,
                             @JsonProperty("cursor") String cursor,
                             @JsonProperty("has_more") boolean hasMore) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.cursor = cursor;
        this.hasMore = hasMore;
    }

    public static <T> PaginatedResponse<T> empty() {
        return new PaginatedResponse<>(List.of(), null, false);
    }
}
