/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

import lombok.NonNull;
import lombok.experimental.UtilityClass;

/**
 * Cache keys for query text.
 *
 * <p>Normalization collapses whitespace runs to one space, trims, and strips trailing statement
 * terminators. It is idempotent, so queries differing only in layout or a trailing {@code ;} share
 * one key. The key is {@code prefix + sha1hex(normalized)}.
 */
@UtilityClass
public class QueryFingerprint {

  public static final String DEFAULT_PREFIX = "ch:query:";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public String normalize(@NonNull final String sql) {
    String normalized = WHITESPACE.matcher(sql).replaceAll(" ").trim();
    while (normalized.endsWith(";")) {
      normalized = normalized.substring(0, normalized.length() - 1).trim();
    }
    return normalized;
  }

  public String fingerprint(final String sql) {
    return fingerprint(DEFAULT_PREFIX, sql);
  }

  /**
   * Namespaced SHA-1 key of the normalized query.
   *
   * @param prefix key namespace
   * @param sql raw query text
   * @return {@code prefix} followed by 40 lowercase hex digits
   */
  public String fingerprint(@NonNull final String prefix, @NonNull final String sql) {
    return prefix + sha1Hex(normalize(sql));
  }

  private String sha1Hex(final String text) {
    try {
      final var digest = MessageDigest.getInstance("SHA-1");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 not available", e);
    }
  }
}
