package com.civics.ingest.tracing;

import com.civics.ingest.core.model.Provider;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracing seam. The default {@link NoOpTracingService} does nothing, so the engine
 * runs without any tracing dependency on the classpath.
 *
 * <p>An ingest opens one {@value #RUN} span, one {@value #PROVIDER} span per provider worker and
 * one {@value #RECONCILE} span per phase that writes entities.</p>
 */
public interface TracingService {

    String RUN = "ingest.run";
    String PROVIDER = "ingest.provider";
    String RECONCILE = "ingest.reconcile";
    String PROMOTION = "ingest.promotion";

    String RUN_ID = "ingest.run_id";
    String MODE = "ingest.mode";
    String PROVIDER_KEY = "ingest.provider";
    String PHASE = "ingest.phase";

    Span start(String name, Map<String, ?> attributes);

    default Span run(String runId, String mode, String providers) {
        return start(RUN, attributes(RUN_ID, runId, MODE, mode, "ingest.providers", providers));
    }

    default Span provider(String runId, Provider provider, String mode) {
        return start(PROVIDER, attributes(RUN_ID, runId, PROVIDER_KEY, provider.key(), MODE, mode));
    }

    default Span reconcile(String runId, String phase) {
        return start(RECONCILE, attributes(RUN_ID, runId, PHASE, phase));
    }

    default Span promotion(String runId) {
        return start(PROMOTION, attributes(RUN_ID, runId));
    }

    private static Map<String, Object> attributes(Object... pairs) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            if (pairs[i + 1] != null) {
                attributes.put((String) pairs[i], pairs[i + 1]);
            }
        }
        return attributes;
    }
}
