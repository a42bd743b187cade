package com.deepansh.react.core;

import com.deepansh.react.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StepParserTest {

    private AgentProperties properties;
    private StepParser parser;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        parser = new StepParser(properties);
    }

    @Test
    void parse_wellFormed_extractsAllFields() {
        ParsedStep step = parser.parse("""
                Thought: I need to find the elevation range of the eastern sector.
                Action: search
                Action Input: High Plains (United States)""");

        assertThat(step.thought()).isEqualTo("I need to find the elevation range of the eastern sector.");
        assertThat(step.action()).isEqualTo("search");
        assertThat(step.actionInput()).isEqualTo("High Plains (United States)");
        assertThat(step.outcome()).isEqualTo(ParsedStep.Outcome.PARSED);
        assertThat(step.defaultedFields()).isEmpty();
    }

    @Test
    void parse_sameTextTwice_yieldsEqualResults() {
        String text = "Thought: compute it\nAction: calculator\nAction Input: 2 + 2";
        assertThat(parser.parse(text)).isEqualTo(parser.parse(text));
    }

    @Test
    void parse_multiLineThoughtAndNumberedLabels() {
        ParsedStep step = parser.parse("""
                Thought 2: First line of reasoning.
                Second line of reasoning.
                Action 2: Lookup
                Action Input 2: eastern sector""");

        assertThat(step.thought()).isEqualTo("First line of reasoning.\nSecond line of reasoning.");
        assertThat(step.action()).isEqualTo("lookup");
        assertThat(step.actionInput()).isEqualTo("eastern sector");
        assertThat(step.isDefaulted()).isFalse();
    }

    @Test
    void parse_missingActionInput_defaultsToEmptyString() {
        ParsedStep step = parser.parse("Thought: hmm\nAction: search");

        assertThat(step.action()).isEqualTo("search");
        assertThat(step.actionInput()).isEmpty();
        assertThat(step.outcome()).isEqualTo(ParsedStep.Outcome.DEFAULTED);
        assertThat(step.defaultedFields()).containsExactly(ParsedStep.Field.ACTION_INPUT);
    }

    @Test
    void parse_freeText_usesAllDefaults() {
        ParsedStep step = parser.parse("I think the answer is probably 42 but I'm not sure.");

        assertThat(step.thought()).isEqualTo("Continue analyzing the problem");
        assertThat(step.action()).isEqualTo("search");
        assertThat(step.actionInput()).isEmpty();
        assertThat(step.defaultedFields()).containsExactlyInAnyOrder(
                ParsedStep.Field.THOUGHT, ParsedStep.Field.ACTION, ParsedStep.Field.ACTION_INPUT);
    }

    @Test
    void parse_nullOrBlank_neverThrows() {
        assertThat(parser.parse(null).isDefaulted()).isTrue();
        assertThat(parser.parse("   ").isDefaulted()).isTrue();
    }

    @Test
    void parse_configuredDefaultsAreUsed() {
        properties.getParser().setDefaultAction("knowledge");
        properties.getParser().setDefaultThought("keep going");

        ParsedStep step = new StepParser(properties).parse("garbage");

        assertThat(step.action()).isEqualTo("knowledge");
        assertThat(step.thought()).isEqualTo("keep going");
    }

    @Test
    void parse_usageSyntaxOnActionLine_splitsActionAndInput() {
        ParsedStep step = parser.parse("Thought: look it up\nAction: search[Colorado orogeny]");

        assertThat(step.action()).isEqualTo("search");
        assertThat(step.actionInput()).isEqualTo("Colorado orogeny");
        assertThat(step.isDefaulted()).isFalse();
    }

    @Test
    void parse_finishAction_isRecognised() {
        ParsedStep step = parser.parse("Thought: done\nAction: FINISH\nAction Input: 1,800 to 7,000 ft");

        assertThat(step.isFinish()).isTrue();
        assertThat(step.actionInput()).isEqualTo("1,800 to 7,000 ft");
    }

    @Test
    void parse_hallucinatedObservation_isNotPartOfInput() {
        ParsedStep step = parser.parse("""
                Thought: search first
                Action: search
                Action Input: Harry Styles age
                Observation: 29 years old""");

        assertThat(step.actionInput()).isEqualTo("Harry Styles age");
    }

    @Test
    void parse_chineseLabels() {
        ParsedStep step = parser.parse("思考: 需要计算\n行动: calculator\n行动输入：29^0.23");

        assertThat(step.thought()).isEqualTo("需要计算");
        assertThat(step.action()).isEqualTo("calculator");
        assertThat(step.actionInput()).isEqualTo("29^0.23");
    }
}
