package io.surfworks.oxbow.audit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON form of an {@link AuditReport}, read by the fix-pattern learning store.
 *
 * <p>Format:
 * <pre>{@code
 * {
 *   "total_lines": 40,
 *   "unsafe_lines": 5,
 *   "unsafe_density_percent": 12.5,
 *   "average_confidence": 85.0,
 *   "meets_density_target": false,
 *   "regions": [
 *     { "line": 7, "form": "BLOCK", "kind": "RAW_POINTER_DEREF", "confidence": 85,
 *       "confidence_band": "HIGH", "line_count": 3, "remediation": "..." }
 *   ]
 * }
 * }</pre>
 */
public final class AuditReportJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private AuditReportJson() {}

    public static JsonObject toJsonTree(AuditReport report) {
        Objects.requireNonNull(report, "report cannot be null");

        JsonObject root = new JsonObject();
        root.addProperty("total_lines", report.totalLines());
        root.addProperty("unsafe_lines", report.unsafeLines());
        root.addProperty("unsafe_density_percent", report.densityPercent());
        root.addProperty("average_confidence", report.averageConfidence());
        root.addProperty("meets_density_target", report.meetsDensityTarget());

        JsonArray regions = new JsonArray();
        for (UnsafeRegion region : report.regions()) {
            JsonObject r = new JsonObject();
            r.addProperty("line", region.line());
            r.addProperty("form", region.form().name());
            r.addProperty("kind", region.kind().name());
            r.addProperty("confidence", region.confidence());
            r.addProperty("confidence_band", region.confidenceBand());
            r.addProperty("line_count", region.lineCount());
            r.addProperty("remediation", region.remediation());
            regions.add(r);
        }
        root.add("regions", regions);
        return root;
    }

    public static String toJson(AuditReport report) {
        return GSON.toJson(toJsonTree(report));
    }

    /**
     * Writes the report to a file, replacing any existing content.
     */
    public static void write(AuditReport report, Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Files.writeString(path, toJson(report), StandardCharsets.UTF_8);
    }
}
