package com.example.authengine.origin;

import com.example.authengine.pipeline.AuthRequest;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a caller-supplied URL may be used as a redirect or callback target.
 * Absolute URLs are compared by origin only; the raw string is never suffix-matched.
 */
@Slf4j
public class TrustedOriginGuard {

  private static final Pattern SAFE_RELATIVE_PATH = Pattern.compile(
      "^/(?!/|\\\\|%2f|%5c)[\\w\\-.+/@]*(?:\\?[\\w\\-.+/=&%@]*)?$", Pattern.CASE_INSENSITIVE);

  private final String baseOrigin;
  private final List<String> staticOrigins;
  private final TrustedOriginsProvider provider;

  public TrustedOriginGuard(String baseOrigin, List<String> staticOrigins, TrustedOriginsProvider provider) {
    String normalized = originOf(baseOrigin);
    this.baseOrigin = normalized != null ? normalized : baseOrigin.toLowerCase(Locale.ROOT);
    this.staticOrigins = staticOrigins == null ? List.of() : List.copyOf(staticOrigins);
    this.provider = provider;
  }

  public boolean isTrusted(String url, boolean allowRelativePaths) {
    return isTrusted(url, allowRelativePaths, null);
  }

  public boolean isTrusted(String url, boolean allowRelativePaths, AuthRequest request) {
    if (url == null || url.isBlank()) {
      return false;
    }
    if (url.startsWith("/") || !url.contains(":")) {
      return allowRelativePaths && SAFE_RELATIVE_PATH.matcher(url).matches();
    }
    String origin = originOf(url);
    if (origin == null) {
      return false;
    }
    if (origin.equals(baseOrigin)) {
      return true;
    }
    URI uri = URI.create(url);
    for (String entry : trustedOrigins(request)) {
      if (matchesEntry(entry, uri, origin)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Static plus dynamic entries for this request.
   */
  public List<String> trustedOrigins(AuthRequest request) {
    List<String> all = new ArrayList<>(staticOrigins);
    if (provider != null) {
      List<String> dynamic = provider.trustedOrigins(request);
      if (dynamic != null) {
        all.addAll(dynamic);
      }
    }
    return all;
  }

  /**
   * Returns {@code scheme://host[:port]} for an absolute http(s) URL, or null for anything else.
   * The scheme's default port is dropped, so {@code https://a.com:443} is {@code https://a.com}.
   */
  public static String originOf(String url) {
    try {
      URI uri = new URI(url);
      String scheme = uri.getScheme();
      if (scheme == null || uri.getHost() == null) {
        return null;
      }
      scheme = scheme.toLowerCase(Locale.ROOT);
      if (!scheme.equals("http") && !scheme.equals("https")) {
        return null;
      }
      String origin = scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT);
      int port = explicitPort(scheme, uri.getPort());
      return port == -1 ? origin : origin + ":" + port;
    } catch (URISyntaxException e) {
      return null;
    }
  }

  private static boolean matchesEntry(String entry, URI uri, String origin) {
    if (entry == null || entry.isBlank()) {
      return false;
    }
    String pattern = entry.trim().toLowerCase(Locale.ROOT);
    if (!pattern.contains("*") && !pattern.contains("?")) {
      return origin.equals(originOf(pattern));
    }

    String scheme = null;
    int schemeIdx = pattern.indexOf("://");
    if (schemeIdx >= 0) {
      scheme = pattern.substring(0, schemeIdx);
      pattern = pattern.substring(schemeIdx + 3);
    }
    int slash = pattern.indexOf('/');
    if (slash >= 0) {
      pattern = pattern.substring(0, slash);
    }
    if (scheme != null && !scheme.equals(uri.getScheme().toLowerCase(Locale.ROOT))) {
      return false;
    }
    String host = uri.getHost().toLowerCase(Locale.ROOT);
    int port = explicitPort(uri.getScheme().toLowerCase(Locale.ROOT), uri.getPort());
    String target = pattern.contains(":") && port != -1 ? host + ":" + port : host;
    return globToRegex(pattern).matcher(target).matches();
  }

  private static int explicitPort(String scheme, int port) {
    if ((port == 443 && scheme.equals("https")) || (port == 80 && scheme.equals("http"))) {
      return -1;
    }
    return port;
  }

  private static Pattern globToRegex(String glob) {
    StringBuilder regex = new StringBuilder();
    for (char c : glob.toCharArray()) {
      switch (c) {
        case '*' -> regex.append("[^./:]+");
        case '?' -> regex.append("[^./:]");
        default -> regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(regex.toString());
  }
}
