package com.fortigate.config.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Comment lines found before the first {@code config} command. A FortiGate backup starts with
 * lines such as
 *
 * <pre>
 * #config-version=FGT60E-6.4.5-FW-build1828-210217:opmode=0:vdom=0:user=admin
 * #conf_file_ver=1234567890
 * #buildno=1828
 * #global_vdom=1
 * </pre>
 *
 * which are exposed both raw and as an ordered key/value map.
 */
public final class HeaderComments {
    static final String CONFIG_VERSION = "config-version";
    private static final String UNKNOWN = "?";

    private final List<String> lines;
    private final Map<String, String> metadata;

    public HeaderComments(List<String> lines) {
        this.lines = List.copyOf(lines);
        Map<String, String> parsed = new LinkedHashMap<>();
        for (String line : this.lines) {
            String body = line.startsWith("#") ? line.substring(1) : line;
            int eq = body.indexOf('=');
            if (eq > 0) {
                parsed.put(body.substring(0, eq).trim(), body.substring(eq + 1).trim());
            }
        }
        this.metadata = Collections.unmodifiableMap(parsed);
    }

    public static HeaderComments empty() {
        return new HeaderComments(List.of());
    }

    public List<String> getLines() {
        return lines;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /** FortiOS version, e.g. {@code 6.4.5-FW-build1828-210217}, or {@code ?}. */
    public String getVersion() {
        String modelAndVersion = modelAndVersion();
        int dash = modelAndVersion.indexOf('-');
        return dash < 0 ? UNKNOWN : modelAndVersion.substring(dash + 1);
    }

    /** Firewall model, e.g. {@code FGT60E}, or {@code ?}. */
    public String getModel() {
        String modelAndVersion = modelAndVersion();
        int dash = modelAndVersion.indexOf('-');
        return dash < 0 ? UNKNOWN : modelAndVersion.substring(0, dash);
    }

    /**
     * The {@code key=value} attributes following the model and version in the
     * {@code config-version} line ({@code opmode}, {@code vdom}, {@code user}).
     */
    public Map<String, String> getVersionAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        String value = metadata.get(CONFIG_VERSION);
        if (value != null) {
            String[] parts = value.split(":");
            for (int i = 1; i < parts.length; i++) {
                int eq = parts[i].indexOf('=');
                if (eq > 0) {
                    attributes.put(parts[i].substring(0, eq), parts[i].substring(eq + 1));
                }
            }
        }
        return attributes;
    }

    private String modelAndVersion() {
        String value = metadata.get(CONFIG_VERSION);
        if (value == null) {
            return UNKNOWN;
        }
        int colon = value.indexOf(':');
        return colon < 0 ? value : value.substring(0, colon);
    }
}
