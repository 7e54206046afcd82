package cloud.meridian.sdk.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call request extras: headers to add on top of the executor defaults and query parameters. Both maps keep
 * insertion order so the rendered query string is stable.
 */
public record RequestSpec(Map<String, String> headers, Map<String, Object> params) {

    private static final RequestSpec EMPTY = new RequestSpec(Map.of(), Map.of());

    public RequestSpec {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static RequestSpec empty() {
        return EMPTY;
    }

    public static RequestSpec of(Map<String, String> headers, Map<String, Object> params) {
        return new RequestSpec(headers, params);
    }

    /**
     * @return a copy whose parameters are this spec's parameters overlaid with {@code extra}.
     */
    public RequestSpec withParams(Map<String, Object> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(params);
        merged.putAll(extra);
        return new RequestSpec(headers, merged);
    }
}
