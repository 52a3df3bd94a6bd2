package com.designauditor.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;

public final class PagePaths {

  private PagePaths() {}

  /** Path of a page url with trailing slashes stripped; the site root is {@code /}. */
  public static String pathOf(String url) {
    if (url == null || url.isBlank()) {
      return "/";
    }
    String path;
    try {
      URI uri = new URI(url.trim());
      path = uri.getRawPath();
      if (uri.getScheme() == null && uri.getHost() == null && path != null && !path.startsWith("/")) {
        int slash = path.indexOf('/');
        path = slash < 0 ? "" : path.substring(slash);
      }
    } catch (URISyntaxException e) {
      path = fallbackPath(url.trim());
    }
    return normalize(path);
  }

  public static String normalize(String path) {
    if (path == null) {
      return "/";
    }
    String value = path.trim();
    while (value.endsWith("/")) {
      value = value.substring(0, value.length() - 1);
    }
    if (value.isEmpty()) {
      return "/";
    }
    return value.startsWith("/") ? value : "/" + value;
  }

  private static String fallbackPath(String url) {
    String value = url;
    int scheme = value.indexOf("://");
    if (scheme >= 0) {
      value = value.substring(scheme + 3);
    }
    int slash = value.indexOf('/');
    if (slash < 0) {
      return "";
    }
    value = value.substring(slash);
    int query = value.indexOf('?');
    if (query >= 0) {
      value = value.substring(0, query);
    }
    int fragment = value.indexOf('#');
    return fragment >= 0 ? value.substring(0, fragment) : value;
  }
}
