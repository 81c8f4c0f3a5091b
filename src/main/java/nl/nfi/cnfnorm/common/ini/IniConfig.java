package nl.nfi.cnfnorm.common.ini;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.file.Files.readAllLines;

public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public boolean getBoolean(final String section, final String key) {
        final String value = getString(section, key);
        if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
            throw new IllegalArgumentException("INI config value is not a boolean: %s -> %s = %s".formatted(section, key, value));
        }
        return Boolean.parseBoolean(value);
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }
        return parse(readAllLines(path));
    }

    public static IniConfig parse(final List<String> lines) {
        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        Map<String, String> section = null;
        for (final String rawLine : lines) {
            final String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (!line.endsWith("]")) {
                    throw new IllegalArgumentException("INI config has unterminated section header: %s".formatted(line));
                }
                final String title = line.substring(1, line.length() - 1).strip();
                section = sections.computeIfAbsent(title, key -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new IllegalArgumentException("INI config has key outside of a section: %s".formatted(line));
            }

            final int separator = line.indexOf('=');
            if (separator < 0) {
                section.put(line, "");
            } else {
                section.put(line.substring(0, separator).strip(), line.substring(separator + 1).strip());
            }
        }
        return new IniConfig(sections);
    }
}
