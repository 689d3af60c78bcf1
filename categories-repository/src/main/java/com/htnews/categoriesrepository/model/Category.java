package com.htnews.categoriesrepository.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * A news category. The id is assigned by the categories client and never changes;
 * one is generated when a category is built without an id.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Category {

    @NonNull
    @Builder.Default
    String id = UUID.randomUUID().toString();

    @NonNull
    String name;

    String description;

    @JsonProperty("icon_url")
    String iconUrl;
}
