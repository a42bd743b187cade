package com.deepansh.react.core;

import com.deepansh.react.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the labelled Thought / Action / Action Input sections from model output.
 *
 * Labels must start a line and may carry a step number ("Thought 2:") and either an
 * ASCII or a full-width colon. The Chinese labels 思考 / 行动 / 行动输入 are accepted too.
 * Each section runs until the next label it can be followed by:
 * <ul>
 *   <li>thought → next Action or Action Input label</li>
 *   <li>action → next Action Input or Observation label</li>
 *   <li>action input → next Observation label or end of text</li>
 * </ul>
 * An action written in usage syntax, {@code search[High Plains]}, is split into
 * action and input when there is no separate Action Input section.
 *
 * Never throws. Missing or blank thought/action, and a missing action input,
 * are replaced with the defaults from {@link AgentProperties.Parser}.
 */
@Component
@Slf4j
public class StepParser {

    private static final String NUM_COLON = "[ \\t]*\\d*[ \\t]*[:：]";
    private static final String THOUGHT_LABEL = "^[ \\t]*(?:thought|思考)" + NUM_COLON;
    private static final String ACTION_LABEL = "^[ \\t]*(?:action|行动)" + NUM_COLON;
    private static final String INPUT_LABEL = "^[ \\t]*(?:action[ \\t]+input|行动输入)" + NUM_COLON;
    private static final String OBSERVATION_LABEL = "^[ \\t]*(?:observation|观察)" + NUM_COLON;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE | Pattern.DOTALL;

    private static final Pattern THOUGHT = Pattern.compile(
            THOUGHT_LABEL + "(.*?)(?=" + ACTION_LABEL + "|" + INPUT_LABEL + "|\\z)", FLAGS);
    private static final Pattern ACTION = Pattern.compile(
            ACTION_LABEL + "(.*?)(?=" + INPUT_LABEL + "|" + OBSERVATION_LABEL + "|\\z)", FLAGS);
    private static final Pattern ACTION_INPUT = Pattern.compile(
            INPUT_LABEL + "(.*?)(?=" + OBSERVATION_LABEL + "|\\z)", FLAGS);

    private static final Pattern USAGE_SYNTAX = Pattern.compile("^([\\w-]+)\\s*\\[(.*)]$", Pattern.DOTALL);

    private final AgentProperties.Parser defaults;

    public StepParser(AgentProperties properties) {
        this.defaults = properties.getParser();
    }

    public ParsedStep parse(String text) {
        String content = text == null ? "" : text;
        Set<ParsedStep.Field> defaulted = EnumSet.noneOf(ParsedStep.Field.class);

        String thought = extract(THOUGHT, content);
        String action = extract(ACTION, content);
        String actionInput = extract(ACTION_INPUT, content);

        if (action != null) {
            Matcher usage = USAGE_SYNTAX.matcher(action);
            if (usage.matches()) {
                action = usage.group(1);
                if (actionInput == null) {
                    actionInput = usage.group(2).trim();
                }
            }
        }

        if (thought == null || thought.isEmpty()) {
            thought = defaults.getDefaultThought();
            defaulted.add(ParsedStep.Field.THOUGHT);
        }
        if (action == null || action.isEmpty()) {
            action = defaults.getDefaultAction();
            defaulted.add(ParsedStep.Field.ACTION);
        }
        if (actionInput == null) {
            actionInput = defaults.getDefaultActionInput();
            defaulted.add(ParsedStep.Field.ACTION_INPUT);
        }

        ParsedStep.Outcome outcome = defaulted.isEmpty()
                ? ParsedStep.Outcome.PARSED
                : ParsedStep.Outcome.DEFAULTED;

        if (outcome == ParsedStep.Outcome.DEFAULTED) {
            log.debug("Model output missing {}, defaults applied. Output: {}", defaulted, content);
        }

        return new ParsedStep(thought, action.toLowerCase(Locale.ROOT), actionInput, outcome, defaulted);
    }

    /** Trimmed first capture, or null when the label is absent. */
    private static String extract(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        return matcher.find() ? matcher.group(1).trim() : null;
    }
}
