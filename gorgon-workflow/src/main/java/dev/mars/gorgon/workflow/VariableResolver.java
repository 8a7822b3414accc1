/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.gorgon.workflow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves variable references in step parameters.
 * <p>
 * References take the form {@code ${name}} or {@code {{name}}}; names may be dotted paths
 * into nested maps and lists ({@code review.summary}, {@code files.0}). A string that is
 * exactly one reference resolves to the bound value itself, so lists and maps survive
 * resolution. Any other string is interpolated with the values' string forms.
 * <p>
 * An unbound reference is an error unless its root name is listed as optional, in which
 * case it resolves to null (whole-string) or the empty string (interpolated).
 */
public class VariableResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\$\\{([^}]+)}|\\{\\{([^}]+)}}");

    private final Map<String, Object> variables;
    private final Set<String> optionalVariables;

    public VariableResolver(Map<String, Object> variables) {
        this(variables, Set.of());
    }

    public VariableResolver(Map<String, Object> variables, Set<String> optionalVariables) {
        this.variables = variables != null ? variables : Map.of();
        this.optionalVariables = optionalVariables != null ? optionalVariables : Set.of();
    }

    /**
     * Resolves every string inside the parameter map, descending into nested maps and lists.
     *
     * @throws TemplateResolutionException naming every unbound reference found
     */
    public Map<String, Object> resolveParams(Map<String, Object> params) {
        List<String> missing = new ArrayList<>();
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            resolved.put(entry.getKey(), resolveValue(entry.getValue(), missing));
        }
        failIfMissing(missing);
        return resolved;
    }

    /**
     * Resolves a single value: strings, maps and lists are resolved recursively; other
     * values are returned unchanged.
     */
    public Object resolve(Object value) {
        List<String> missing = new ArrayList<>();
        Object resolved = resolveValue(value, missing);
        failIfMissing(missing);
        return resolved;
    }

    /**
     * Interpolates a template into a string.
     */
    public String resolveString(String template) {
        if (template == null) {
            return null;
        }
        List<String> missing = new ArrayList<>();
        String resolved = interpolate(template, missing);
        failIfMissing(missing);
        return resolved;
    }

    public boolean hasVariables(String template) {
        return template != null && VARIABLE_PATTERN.matcher(template).find();
    }

    /**
     * Gets all variable names referenced in a template.
     */
    public static Set<String> getVariableNames(String template) {
        Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        while (matcher.find()) {
            names.add(referenceName(matcher));
        }
        return names;
    }

    /**
     * Looks a name up in a variable map. An exact key match wins; otherwise the name is
     * treated as a dotted path through nested maps and lists.
     */
    public static Optional<Object> lookup(Map<String, Object> variables, String name) {
        if (variables.containsKey(name)) {
            return Optional.ofNullable(variables.get(name));
        }
        String[] parts = name.split("\\.");
        if (parts.length < 2 || !variables.containsKey(parts[0])) {
            return Optional.empty();
        }
        Object current = variables.get(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            if (current instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) current;
                if (!map.containsKey(parts[i])) {
                    return Optional.empty();
                }
                current = map.get(parts[i]);
            } else if (current instanceof List) {
                List<?> list = (List<?>) current;
                try {
                    int index = Integer.parseInt(parts[i]);
                    if (index < 0 || index >= list.size()) {
                        return Optional.empty();
                    }
                    current = list.get(index);
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            } else {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    private Object resolveValue(Object value, List<String> missing) {
        if (value instanceof String) {
            String text = (String) value;
            Matcher matcher = VARIABLE_PATTERN.matcher(text);
            if (matcher.matches()) {
                String name = referenceName(matcher);
                if (!isBound(name)) {
                    recordMissing(name, missing);
                    return null;
                }
                return lookup(variables, name).orElse(null);
            }
            return interpolate(text, missing);
        }
        if (value instanceof Map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), resolveValue(entry.getValue(), missing));
            }
            return resolved;
        }
        if (value instanceof List) {
            List<Object> resolved = new ArrayList<>();
            for (Object element : (List<?>) value) {
                resolved.add(resolveValue(element, missing));
            }
            return resolved;
        }
        return value;
    }

    private String interpolate(String template, List<String> missing) {
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = referenceName(matcher);
            String replacement;
            if (isBound(name)) {
                Object bound = lookup(variables, name).orElse(null);
                replacement = bound != null ? bound.toString() : "";
            } else {
                recordMissing(name, missing);
                replacement = "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private boolean isBound(String name) {
        if (variables.containsKey(name)) {
            return true;
        }
        return lookup(variables, name).isPresent();
    }

    private void recordMissing(String name, List<String> missing) {
        String root = name.split("\\.")[0];
        if (!optionalVariables.contains(name) && !optionalVariables.contains(root) && !missing.contains(name)) {
            missing.add(name);
        }
    }

    private static void failIfMissing(List<String> missing) {
        if (!missing.isEmpty()) {
            throw new TemplateResolutionException("Unresolved variable(s): " + String.join(", ", missing), missing);
        }
    }

    private static String referenceName(Matcher matcher) {
        String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
        return name.trim();
    }
}
