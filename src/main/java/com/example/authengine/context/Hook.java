package com.example.authengine.context;

import java.util.Comparator;

/**
 * A before- or after-hook. Lower priorities run first; equal priorities keep registration order.
 */
public record Hook(String id, HookMatcher matcher, int priority, HookHandler handler) {

  public static final int DEFAULT_PRIORITY = 0;

  /** Stable, so ties stay in registration order when used with {@code List.sort}. */
  public static final Comparator<Hook> BY_PRIORITY = Comparator.comparingInt(Hook::priority);

  public Hook {
    if (matcher == null || handler == null) {
      throw new IllegalArgumentException("Hook " + id + " needs a matcher and a handler");
    }
  }

  public static Hook of(String id, HookMatcher matcher, HookHandler handler) {
    return new Hook(id, matcher, DEFAULT_PRIORITY, handler);
  }
}
