package com.example.astromech.core.s3;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import software.amazon.awssdk.services.s3.model.Tag;

/**
 * Conversions between a tag map and the forms S3 uses on the wire: the {@code TagSet} list
 * returned by GetObjectTagging and the URL-encoded {@code Tagging} parameter of PutObject.
 */
public final class TagSets {

  private TagSets() {}

  /**
   * Flattens a tag set into a map. When a key repeats, the last value wins.
   *
   * @param tagSet tags as returned by S3
   * @return key to value, in tag set order
   */
  public static Map<String, String> toMap(final List<Tag> tagSet) {
    return tagSet.stream()
        .collect(
            Collectors.toMap(Tag::key, Tag::value, (first, last) -> last, LinkedHashMap::new));
  }

  /**
   * Expands a map into a tag set.
   *
   * @param tags key to value
   * @return tags in map iteration order
   */
  public static List<Tag> toTagSet(final Map<String, String> tags) {
    return tags.entrySet().stream()
        .map(tag -> Tag.builder().key(tag.getKey()).value(tag.getValue()).build())
        .collect(Collectors.toList());
  }

  /**
   * Encodes tags as a query string, e.g. {@code project=astro&owner=team+a}.
   *
   * @param tags key to value
   * @return the encoded tags, empty for an empty map
   */
  public static String toTagging(final Map<String, String> tags) {
    return tags.entrySet().stream()
        .map(tag -> encode(tag.getKey()) + "=" + encode(tag.getValue()))
        .collect(Collectors.joining("&"));
  }

  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
