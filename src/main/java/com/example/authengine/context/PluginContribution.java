package com.example.authengine.context;

import com.example.authengine.exception.ErrorCode;
import com.example.authengine.pipeline.Endpoint;
import com.example.authengine.schema.FieldAttribute;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Everything one plugin adds to the context. Folded once at build time.
 */
@Value
@Builder
public class PluginContribution {

  String id;

  @Singular
  List<Endpoint> endpoints;

  @Singular
  List<Hook> beforeHooks;

  @Singular
  List<Hook> afterHooks;

  @Singular
  List<FieldAttribute> schemaFields;

  @Singular
  List<ErrorCode> errorCodes;
}
