/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.SkillDraft;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Heuristic skill extraction from free dialog text.
 *
 * <p>
 * The first non-empty line is the goal. Later lines are classified as steps
 * (numbered, bulleted or starting with "step"), examples (mention an example)
 * or constraints (state a prohibition); anything else is ignored. Russian and
 * English keywords are recognized.
 */
@Component
public class SkillDialogExtractor {

    private static final Pattern NUMBERED = Pattern.compile("^\\d+(?:[.)]|\\s).*");
    private static final Pattern STEP_PREFIX = Pattern.compile("^(?:\\d+\\s*[.)]\\s*|[-*•]\\s+)");
    private static final List<String> STEP_WORDS = List.of("step", "шаг");
    private static final List<String> EXAMPLE_WORDS = List.of("example", "e.g.", "например", "пример");
    private static final List<String> CONSTRAINT_WORDS = List.of("must not", "never", "do not", "don't",
            "forbidden", "not allowed", "constraint", "нельзя", "ограничение", "не допускается", "запрещено");

    public SkillDraft extract(String dialogText, String modelName, String workspaceId) {
        List<String> lines = new ArrayList<>();
        if (dialogText != null) {
            for (String line : dialogText.split("\\R")) {
                String stripped = line.strip();
                if (!stripped.isEmpty()) {
                    lines.add(stripped);
                }
            }
        }

        String goal = lines.isEmpty() ? "" : lines.get(0);
        List<String> steps = new ArrayList<>();
        List<String> examples = new ArrayList<>();
        List<String> constraints = new ArrayList<>();

        for (String line : lines.subList(Math.min(1, lines.size()), lines.size())) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (isStep(line, lower)) {
                steps.add(STEP_PREFIX.matcher(line).replaceFirst("").strip());
            } else if (containsAny(lower, EXAMPLE_WORDS)) {
                examples.add(line);
            } else if (containsAny(lower, CONSTRAINT_WORDS)) {
                constraints.add(line);
            }
        }

        return SkillDraft.builder()
                .goal(goal)
                .steps(steps)
                .examples(examples)
                .constraints(constraints)
                .sources(new ArrayList<>(List.of("dialog")))
                .modelName(modelName)
                .workspaceId(workspaceId)
                .build();
    }

    private static boolean isStep(String line, String lower) {
        if (NUMBERED.matcher(line).matches() || line.startsWith("- ") || line.startsWith("* ")
                || line.startsWith("• ")) {
            return true;
        }
        for (String word : STEP_WORDS) {
            if (lower.startsWith(word)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
