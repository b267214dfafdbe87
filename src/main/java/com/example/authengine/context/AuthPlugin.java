package com.example.authengine.context;

/**
 * Extension point. A plugin describes its contribution; it never mutates the context.
 */
public interface AuthPlugin {

  String id();

  PluginContribution contribution(AuthOptions options);
}
