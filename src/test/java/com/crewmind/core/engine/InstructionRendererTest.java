package com.crewmind.core.engine;

import com.crewmind.core.model.OutputSchema;
import com.crewmind.core.model.TaskSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InstructionRendererTest {

    private final InstructionRenderer renderer = new InstructionRenderer(new ObjectMapper());

    private static TaskSpec task(String instruction, String... deps) {
        return new TaskSpec("t", "agent", "fallback description", instruction, null, List.of(deps),
                OutputSchema.EMPTY, false);
    }

    private static Map<String, Map<String, Object>> context() {
        var gap = new LinkedHashMap<String, Object>();
        gap.put("gap_name", "Wellness concierge");
        gap.put("competition_level", "Low");
        gap.put("size", 40);
        var ctx = new LinkedHashMap<String, Map<String, Object>>();
        ctx.put("research", gap);
        ctx.put("analysis", Map.of("output", "positive"));
        return ctx;
    }

    @Nested
    @DisplayName("placeholders")
    class Placeholders {

        @Test
        @DisplayName("field placeholder inserts string values verbatim and others as JSON")
        void fieldPlaceholder() {
            String out = renderer.render(task("Gap {{research.gap_name}} of size {{ research.size }}", "research"),
                    Map.of("research", context().get("research")));
            assertEquals("Gap Wellness concierge of size 40", out);
        }

        @Test
        @DisplayName("whole-output placeholder is JSON with sorted keys")
        void wholeOutput() {
            String out = renderer.render(task("Data: {{research}}", "research"),
                    Map.of("research", context().get("research")));
            assertEquals("Data: {\"competition_level\":\"Low\",\"gap_name\":\"Wellness concierge\",\"size\":40}", out);
        }

        @Test
        @DisplayName("missing field renders empty")
        void missingField() {
            String out = renderer.render(task("[{{research.nope}}]", "research"),
                    Map.of("research", context().get("research")));
            assertEquals("[]", out);
        }

        @Test
        @DisplayName("referencedTasks lists each referenced id once")
        void referencedTasks() {
            assertEquals(Set.of("a", "b"), InstructionRenderer.referencedTasks("{{a.x}} {{b}} {{a}}"));
            assertTrue(InstructionRenderer.referencedTasks(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("context section")
    class ContextSection {

        @Test
        @DisplayName("unreferenced dependencies are appended under headings")
        void appendsUnreferenced() {
            String out = renderer.render(task("Use {{research.gap_name}}.", "research", "analysis"), context());
            assertEquals("Use Wellness concierge.\n\nContext from previous tasks:\n\n### analysis\n{\"output\":\"positive\"}",
                    out);
        }

        @Test
        @DisplayName("no context section when everything is referenced or there are no dependencies")
        void noSection() {
            assertEquals("Plain", renderer.render(task("Plain"), Map.of()));
        }

        @Test
        @DisplayName("description is used when no instruction is given")
        void fallsBackToDescription() {
            assertEquals("fallback description", renderer.render(task(null), Map.of()));
        }
    }
}
