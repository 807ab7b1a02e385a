package com.forgeloop.orchestrator.tracker;

import com.forgeloop.orchestrator.model.ComplexityCategory;
import com.forgeloop.orchestrator.model.Priority;
import com.forgeloop.orchestrator.model.WorkItemKind;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Label scheme used on tracker items:
 * <pre>
 *   forgeloop:&lt;project&gt;   every item of a project
 *   kind:feature | kind:bug
 *   priority:critical | high | medium | low
 *   complexity:simple | medium | complex
 * </pre>
 */
public final class TrackerLabels {

    private static final String KIND       = "kind:";
    private static final String PRIORITY   = "priority:";
    private static final String COMPLEXITY = "complexity:";

    private TrackerLabels() {}

    public static String project(String projectName) {
        return "forgeloop:" + projectName.strip().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]+", "-");
    }

    public static Set<String> forItem(String projectName, WorkItemKind kind, Priority priority,
                                      ComplexityCategory category) {
        Set<String> labels = new LinkedHashSet<>();
        labels.add(project(projectName));
        labels.add(KIND + lower(kind));
        labels.add(PRIORITY + lower(priority));
        if (category != null) {
            labels.add(COMPLEXITY + lower(category));
        }
        return labels;
    }

    /** Kind from the labels of an item created outside the orchestrator; FEATURE when absent. */
    public static WorkItemKind kindOf(Set<String> labels) {
        return parse(labels, KIND, WorkItemKind.class, WorkItemKind.FEATURE);
    }

    /** Priority from labels; MEDIUM when absent. */
    public static Priority priorityOf(Set<String> labels) {
        return parse(labels, PRIORITY, Priority.class, Priority.MEDIUM);
    }

    private static <E extends Enum<E>> E parse(Set<String> labels, String prefix, Class<E> type, E fallback) {
        for (String label : labels) {
            if (label.startsWith(prefix)) {
                String value = label.substring(prefix.length()).toUpperCase(Locale.ROOT);
                for (E constant : type.getEnumConstants()) {
                    if (constant.name().equals(value)) {
                        return constant;
                    }
                }
            }
        }
        return fallback;
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
