package com.williamcallahan.contextaggregator.application.context;

import com.williamcallahan.contextaggregator.domain.context.ContextRequest;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the pipeline resolved for one request before fan-out.
 *
 * @param request original request
 * @param effectiveBudget token ceiling for selection
 * @param sources sources to query, registered and enabled, in request order
 * @param priorities effective weights (task defaults overridden by the request)
 * @param allocation per-source token allocation
 * @param assembly resolved assembly settings
 * @param deduplicate run deduplication
 * @param diversify rank with maximal marginal relevance
 * @param mmrLambda relevance weight for diversity ranking
 * @param requestTimeout outer deadline for the fan-out
 */
public record RequestPlan(
        ContextRequest request,
        int effectiveBudget,
        List<ContextSourceType> sources,
        Map<ContextSourceType, Integer> priorities,
        Map<ContextSourceType, Integer> allocation,
        AssemblySettings assembly,
        boolean deduplicate,
        boolean diversify,
        double mmrLambda,
        Duration requestTimeout) {

    public RequestPlan {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(assembly, "assembly");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        sources = sources == null ? List.of() : List.copyOf(sources);
        priorities = priorities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(priorities));
        allocation = allocation == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(allocation));
    }
}
