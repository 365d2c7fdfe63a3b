package io.surfworks.oxbow.verify;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON form of a {@link DiffResult}, read by the fix-pattern learning store.
 *
 * <p>Format:
 * <pre>{@code
 * {
 *   "passed": false,
 *   "stdout_matches": false,
 *   "exit_code_matches": true,
 *   "divergences": ["stdout differs: ..."],
 *   "original": { "stdout": "from C\n", "stderr": "", "exit_code": 0 },
 *   "translated": { "stdout": "from Rust\n", "stderr": "", "exit_code": 0 }
 * }
 * }</pre>
 *
 * <p>Captured output is written as UTF-8 text with malformed bytes replaced; the
 * divergence strings show such bytes exactly, as {@code \xNN}.
 */
public final class DiffResultJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private DiffResultJson() {}

    public static JsonObject toJsonTree(DiffResult result) {
        Objects.requireNonNull(result, "result cannot be null");

        JsonObject root = new JsonObject();
        root.addProperty("passed", result.passed());
        root.addProperty("stdout_matches", result.stdoutMatches());
        root.addProperty("exit_code_matches", result.exitCodeMatches());
        root.add("divergences", GSON.toJsonTree(result.divergences()));
        root.add("original", output(result.originalOutput()));
        root.add("translated", output(result.translatedOutput()));
        return root;
    }

    public static String toJson(DiffResult result) {
        return GSON.toJson(toJsonTree(result));
    }

    public static void write(DiffResult result, Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Files.writeString(path, toJson(result), StandardCharsets.UTF_8);
    }

    private static JsonObject output(ExecutionOutput output) {
        JsonObject json = new JsonObject();
        json.addProperty("stdout", output.stdout());
        json.addProperty("stderr", output.stderr());
        json.addProperty("exit_code", output.exitCode());
        return json;
    }
}
