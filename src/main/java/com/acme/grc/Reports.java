package com.acme.grc;

import com.acme.grc.model.Enums.Severity;
import com.acme.grc.model.Finding;
import com.acme.grc.util.MapperUtil;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;

/** JSON report envelope shared by every command. */
final class Reports {
    static final String TOOL_VERSION = "1.0.0";

    private Reports() {}

    static Map<String, Object> envelope(String command, Map<String, Object> inputs) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("timestamp_utc", Instant.now().toString());
        report.put("tool", Map.of("name", "policy_control", "command", command, "version", "java-" + TOOL_VERSION));
        report.put("host", Map.of(
                "hostname", safeHostName(),
                "os", String.valueOf(System.getProperty("os.name")),
                "java", String.valueOf(System.getProperty("java.version"))
        ));
        report.put("inputs", inputs);
        return report;
    }

    static List<Map<String, Object>> findingsOut(List<Finding> findings) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Finding f : findings) {
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("severity", f.severity().toString());
            o.put("category", f.category());
            o.put("message", f.message());
            if (f.details() != null) o.put("details", f.details());
            out.add(o);
        }
        return out;
    }

    static Severity worst(List<Finding> findings) {
        if (findings.stream().anyMatch(f -> f.severity() == Severity.ERROR)) return Severity.ERROR;
        if (findings.stream().anyMatch(f -> f.severity() == Severity.WARN)) return Severity.WARN;
        return Severity.OK;
    }

    /** Writes {@code report} to {@code out}, or to a timestamped file named after the command. */
    static Path write(Map<String, Object> report, String out, String command) throws IOException {
        String outPath = (out != null && !out.isBlank())
                ? out
                : "policy_control_" + command + "_" + Instant.now().toString().replace(":", "").replace(".", "") + ".json";
        Path p = Path.of(outPath);
        MapperUtil.JSON.writeValue(p.toFile(), report);
        return p;
    }

    static Map<String, Object> inputs(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) m.put(String.valueOf(kv[i]), kv[i + 1]);
        return m;
    }

    static String safeHostName() {
        try { return InetAddress.getLocalHost().getHostName(); }
        catch (Exception e) { return "unknown"; }
    }
}
