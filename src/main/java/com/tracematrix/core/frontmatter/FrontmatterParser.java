package com.tracematrix.core.frontmatter;

import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts and parses the {@code ---} fenced header of a markdown file.
 * <p>
 * The block is loaded with SnakeYAML using a resolver that only recognises booleans and
 * nulls, so identifiers such as {@code 044} and dates stay textual. When YAML rejects the
 * block (unquoted colons in titles are the usual culprit) the parser falls back to reading
 * {@code key: value} lines, with {@code [a, b, c]} parsed as a list.
 */
@Component
public class FrontmatterParser {

    private static final Pattern BLOCK = Pattern.compile(
            "\\A---[ \\t]*\\R(?:(.*?)\\R)??---[ \\t]*(?:\\R|\\z)", Pattern.DOTALL);
    private static final Pattern BOOLEAN = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");
    private static final Pattern LINE = Pattern.compile("^([\\w-]+):\\s*(.*)$");

    private final LoaderOptions loaderOptions;

    public FrontmatterParser() {
        this.loaderOptions = new LoaderOptions();
        this.loaderOptions.setAllowDuplicateKeys(true);
    }

    /**
     * Parses the frontmatter at the top of {@code content}.
     *
     * @param content full file content
     * @return the parsed block, or {@link Frontmatter#absent()} when there is none
     */
    public Frontmatter parse(String content) {
        if (content == null) {
            return Frontmatter.absent();
        }
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;
        Matcher matcher = BLOCK.matcher(text);
        if (!matcher.find()) {
            return Frontmatter.absent();
        }
        String block = matcher.group(1) == null ? "" : matcher.group(1);
        try {
            Object loaded = newYaml().load(block);
            if (loaded == null) {
                return new Frontmatter(Frontmatter.Kind.PARSED, Map.of(), null);
            }
            if (loaded instanceof Map<?, ?> map) {
                return new Frontmatter(Frontmatter.Kind.PARSED, stringKeys(map), null);
            }
            return lenient(block, "frontmatter is not a mapping");
        } catch (YAMLException e) {
            return lenient(block, e.getMessage());
        }
    }

    private Yaml newYaml() {
        DumperOptions dumperOptions = new DumperOptions();
        return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
                dumperOptions, loaderOptions, new TextPreservingResolver());
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        var result = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> {
            if (k != null) {
                result.put(String.valueOf(k), v);
            }
        });
        return result;
    }

    static Frontmatter lenient(String block, String problem) {
        var fields = new LinkedHashMap<String, Object>();
        for (String line : block.split("\\R")) {
            Matcher m = LINE.matcher(line);
            if (!m.matches()) {
                continue;
            }
            String value = m.group(2).trim();
            if (value.startsWith("[") && value.endsWith("]")) {
                List<String> items = new ArrayList<>();
                String inner = value.substring(1, value.length() - 1);
                for (String item : inner.split(",")) {
                    String cleaned = item.trim().replaceAll("['\"]", "");
                    if (!cleaned.isEmpty()) {
                        items.add(cleaned);
                    }
                }
                fields.put(m.group(1), items);
            } else {
                fields.put(m.group(1), unquote(value));
            }
        }
        return new Frontmatter(Frontmatter.Kind.LENIENT, fields, problem);
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\""))
                || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    /**
     * Resolves {@code true}/{@code false} and nulls only; every other plain scalar, including
     * {@code yes}, {@code no}, {@code on} and {@code off}, stays a string.
     */
    static final class TextPreservingResolver extends Resolver {
        @Override
        protected void addImplicitResolvers() {
            addImplicitResolver(Tag.BOOL, BOOLEAN, "tTfF");
            addImplicitResolver(Tag.NULL, NULL, "~nN\0");
            addImplicitResolver(Tag.NULL, EMPTY, null);
        }
    }
}
