package com.synthgov.core.sanitize;

import com.synthgov.core.catalog.ThreatCatalog;
import com.synthgov.core.catalog.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an arbitrary nested metric map into a {@link MetricSnapshot}.
 *
 * <p>
 * This stage is total: whatever the input holds, it returns a snapshot and a
 * list of issues. Downstream stages can therefore assume every value they
 * resolve is usable.
 * </p>
 *
 * <ul>
 * <li>Nested maps are flattened into dotted paths. The caller's map is only read.</li>
 * <li>NaN and infinities anywhere become {@link MetricSnapshot#UNAVAILABLE}.</li>
 * <li>At paths the catalog reads, {@code null} and wrongly typed values become
 * {@link MetricSnapshot#UNAVAILABLE} too.</li>
 * <li>Everything else is copied through untouched, including unknown keys.</li>
 * </ul>
 */
public class MetricSanitizer {

    private static final Logger log = LoggerFactory.getLogger(MetricSanitizer.class);

    // Guards against self-referencing maps.
    private static final int MAX_DEPTH = 32;

    private final Map<String, ValueKind> expectedValueKinds;

    public MetricSanitizer(ThreatCatalog catalog) {
        this(catalog.getExpectedValueKinds());
    }

    public MetricSanitizer(Map<String, ValueKind> expectedValueKinds) {
        this.expectedValueKinds = Map.copyOf(expectedValueKinds);
    }

    public SanitizedMetrics sanitize(Map<?, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return new SanitizedMetrics(MetricSnapshot.empty(), List.of());
        }
        Map<String, Object> flat = new LinkedHashMap<>();
        List<SanitizationIssue> issues = new ArrayList<>();
        flatten("", raw, flat, issues, 0);
        if (!issues.isEmpty()) {
            log.debug("[SynthGov] Sanitizer recorded {} issue(s) across {} metric(s)", issues.size(), flat.size());
        }
        return new SanitizedMetrics(new MetricSnapshot(flat), issues);
    }

    /** Re-sanitizing a snapshot returns it unchanged with no issues. */
    public SanitizedMetrics sanitize(MetricSnapshot snapshot) {
        return sanitize(snapshot.asMap());
    }

    private void flatten(String prefix, Map<?, ?> source, Map<String, Object> target,
            List<SanitizationIssue> issues, int depth) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String path = prefix.isEmpty()
                    ? String.valueOf(entry.getKey())
                    : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map<?, ?> nested && depth < MAX_DEPTH && !expectedValueKinds.containsKey(path)) {
                flatten(path, nested, target, issues, depth + 1);
                continue;
            }
            target.put(path, clean(path, value, issues));
        }
    }

    private Object clean(String path, Object value, List<SanitizationIssue> issues) {
        if (value == MetricSnapshot.UNAVAILABLE) {
            return value;
        }
        if (isNonFinite(value)) {
            issues.add(new SanitizationIssue(path, SanitizationIssue.Reason.NON_FINITE, String.valueOf(value)));
            return MetricSnapshot.UNAVAILABLE;
        }

        ValueKind expected = expectedValueKinds.get(path);
        if (expected == null) {
            // Not read by any rule; kept for completeness, never judged.
            return value;
        }
        if (value == null) {
            issues.add(new SanitizationIssue(path, SanitizationIssue.Reason.NULL_VALUE, null));
            return MetricSnapshot.UNAVAILABLE;
        }
        if (expected == ValueKind.NUMBER && !(value instanceof Number)) {
            issues.add(new SanitizationIssue(path, SanitizationIssue.Reason.TYPE_MISMATCH,
                    "expected a number but was " + value.getClass().getSimpleName()));
            return MetricSnapshot.UNAVAILABLE;
        }
        if (expected == ValueKind.CATEGORY) {
            if (!(value instanceof CharSequence)) {
                issues.add(new SanitizationIssue(path, SanitizationIssue.Reason.TYPE_MISMATCH,
                        "expected a category label but was " + value.getClass().getSimpleName()));
                return MetricSnapshot.UNAVAILABLE;
            }
            if (value.toString().isBlank()) {
                issues.add(new SanitizationIssue(path, SanitizationIssue.Reason.TYPE_MISMATCH,
                        "was a blank category label"));
                return MetricSnapshot.UNAVAILABLE;
            }
            return value.toString();
        }
        return value;
    }

    // BigDecimal and BigInteger can overflow to infinity once read as a double
    private static boolean isNonFinite(Object value) {
        return value instanceof Number n && !Double.isFinite(n.doubleValue());
    }
}
