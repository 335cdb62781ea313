package com.buildmender.core.proposal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FixResponseParserTest {

    private final FixResponseParser parser = new FixResponseParser();

    @Test
    void testAppendProposal() {
        String response = """
            Observation: the build cannot find kotlin_version
            Thought: define it in gradle.properties
            Error_Type: MissingProperty
            Target_File: gradle.properties
            Fix_Content: kotlin_version=1.9.0
            """;

        FixProposal proposal = parser.parse(response);

        assertEquals(FixAction.APPEND, proposal.getAction());
        assertEquals(TargetFile.PROPERTIES_FILE, proposal.getTargetFile());
        assertEquals("kotlin_version=1.9.0", proposal.getContent());
        assertEquals("MissingProperty", proposal.getErrorType());
        assertNull(proposal.getMatchPattern());
    }

    @Test
    void testReplaceMatchProposal() {
        String response = """
            Error_Type: DependencyVersion
            Target_File: build.gradle
            Match_Pattern: `implementation 'com.google.guava:guava:.*'`
            Fix_Content:
            ```groovy
            implementation 'com.google.guava:guava:33.0.0-jre'
            ```
            """;

        FixProposal proposal = parser.parse(response);

        assertEquals(FixAction.REPLACE_MATCH, proposal.getAction());
        assertEquals(TargetFile.BUILD_SCRIPT, proposal.getTargetFile());
        assertEquals("implementation 'com.google.guava:guava:.*'", proposal.getMatchPattern().pattern());
        assertEquals("implementation 'com.google.guava:guava:33.0.0-jre'", proposal.getContent());
    }

    @Test
    void testMultiLineFixContentRunsToEnd() {
        String response = """
            Error_Type: MissingRepository
            Target_File: ./build.gradle
            Fix_Content: repositories {
                mavenCentral()
            }
            """;

        FixProposal proposal = parser.parse(response);

        assertEquals(FixAction.APPEND, proposal.getAction());
        assertEquals("repositories {\n    mavenCentral()\n}", proposal.getContent());
    }

    @Test
    void testNoFixSentinel() {
        String response = """
            Error_Type: CompilationError
            Target_File: none
            Fix_Content: NO_FIX
            """;

        FixProposal proposal = parser.parse(response);

        assertEquals(FixAction.NO_FIX, proposal.getAction());
        assertEquals("CompilationError", proposal.getErrorType());
    }

    @Test
    void testNoFixSentinelFollowedByExplanation() {
        String response = """
            Error_Type: Compilation error
            Target_File: gradle.properties
            Fix_Content: NO_FIX
            The failure is in Java source code, not in the build configuration.
            """;

        FixProposal proposal = parser.parse(response);

        assertEquals(FixAction.NO_FIX, proposal.getAction());
        assertFalse(proposal.getAction().isEdit());
    }

    @Test
    void testNoFixSentinelWithPunctuationOrQuotes() {
        String template = "Error_Type: Compilation error\nTarget_File: gradle.properties\nFix_Content: %s\n";

        assertEquals(FixAction.NO_FIX, parser.parse(template.formatted("NO_FIX.")).getAction());
        assertEquals(FixAction.NO_FIX, parser.parse(template.formatted("\"NO_FIX\"")).getAction());
        assertEquals(FixAction.NO_FIX, parser.parse(template.formatted("'no_fix'.")).getAction());
        assertEquals(FixAction.NO_FIX, parser.parse(template.formatted("```\nNO_FIX\n```")).getAction());
    }

    @Test
    void testPropertyThatMerelyStartsWithSentinelIsAnEdit() {
        String response = """
            Error_Type: MissingProperty
            Target_File: gradle.properties
            Fix_Content: NO_FIX_CHECKS=true
            """;

        assertEquals(FixAction.APPEND, parser.parse(response).getAction());
    }

    @Test
    void testBareNoFixSentinel() {
        assertEquals(FixAction.NO_FIX, parser.parse("NO_FIX").getAction());
        assertEquals(FixAction.NO_FIX, parser.parse("  `NO_FIX`\n").getAction());
        assertEquals(FixAction.NO_FIX, parser.parse("NO_FIX.\nI cannot tell what is wrong.").getAction());
    }

    @Test
    void testMissingTargetIsInvalid() {
        String response = """
            Error_Type: DependencyVersion
            Fix_Content: foo=2.0
            """;

        FixProposal proposal = parser.parse(response);

        assertEquals(FixAction.INVALID, proposal.getAction());
        assertTrue(proposal.getInvalidReason().contains("Target_File"));
    }

    @Test
    void testMissingErrorTypeIsInvalid() {
        String response = """
            Target_File: gradle.properties
            Fix_Content: foo=2.0
            """;

        assertEquals(FixAction.INVALID, parser.parse(response).getAction());
    }

    @Test
    void testTagsOutOfOrderAreInvalid() {
        String response = """
            Target_File: gradle.properties
            Error_Type: DependencyVersion
            Fix_Content: foo=2.0
            """;

        assertEquals(FixAction.INVALID, parser.parse(response).getAction());
    }

    @Test
    void testMatchPatternAfterFixContentIsInvalid() {
        String response = """
            Error_Type: DependencyVersion
            Target_File: gradle.properties
            Fix_Content: foo=2.0
            Match_Pattern: foo=.*
            """;

        assertEquals(FixAction.INVALID, parser.parse(response).getAction());
    }

    @Test
    void testUnknownTargetIsInvalid() {
        String response = """
            Error_Type: DependencyVersion
            Target_File: settings.gradle
            Fix_Content: include ':app'
            """;

        FixProposal proposal = parser.parse(response);

        assertEquals(FixAction.INVALID, proposal.getAction());
        assertTrue(proposal.getInvalidReason().contains("settings.gradle"));
    }

    @Test
    void testBrokenPatternIsInvalid() {
        String response = """
            Error_Type: DependencyVersion
            Target_File: gradle.properties
            Match_Pattern: foo=(
            Fix_Content: foo=2.0
            """;

        assertEquals(FixAction.INVALID, parser.parse(response).getAction());
    }

    @Test
    void testEmptyContentIsInvalid() {
        String response = """
            Error_Type: DependencyVersion
            Target_File: gradle.properties
            Fix_Content:
            """;

        assertEquals(FixAction.INVALID, parser.parse(response).getAction());
    }

    @Test
    void testFreeTextIsInvalidNotAppend() {
        FixProposal proposal = parser.parse("You should bump the guava version to 33.0.0-jre.");

        assertEquals(FixAction.INVALID, proposal.getAction());
        assertFalse(proposal.getAction().isEdit());
    }

    @Test
    void testEmptyResponseIsInvalid() {
        assertEquals(FixAction.INVALID, parser.parse(null).getAction());
        assertEquals(FixAction.INVALID, parser.parse("   ").getAction());
    }

    @Test
    void testTagsAreCaseInsensitive() {
        String response = """
            error_type: DependencyVersion
            TARGET_FILE: Gradle.Properties
            fix_content: foo=2.0
            """;

        FixProposal proposal = parser.parse(response);

        assertEquals(FixAction.APPEND, proposal.getAction());
        assertEquals(TargetFile.PROPERTIES_FILE, proposal.getTargetFile());
    }
}
