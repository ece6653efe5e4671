package io.routedoc.core.engine;

import io.routedoc.core.model.Operation;
import io.routedoc.core.model.OperationKey;
import io.routedoc.core.model.PathTemplate;
import io.routedoc.core.model.SecurityScheme;
import io.routedoc.core.schema.SchemaRegistry;
import java.util.Map;

/**
 * A single materialized endpoint: its identity, its operation and what it contributes to the
 * document's components.
 *
 * @param key             operation identity
 * @param path            path template with the capture names used by this endpoint
 * @param operation       the operation
 * @param schemas         named types referenced by the operation
 * @param securitySchemes security schemes referenced by the operation
 */
record CompiledEndpoint(
        OperationKey key,
        PathTemplate path,
        Operation operation,
        SchemaRegistry schemas,
        Map<String, SecurityScheme> securitySchemes) {}
