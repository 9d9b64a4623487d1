package me.golemcore.invocation.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunctionCallContentTest {

    private static final String CALL_ID = "call-1";
    private static final String FUNCTION_NAME = "get_weather";

    @Test
    void shouldConcatenateStringArgumentFragments() {
        FunctionCallContent first = FunctionCallContent.of(CALL_ID, FUNCTION_NAME, "{\"loca");
        FunctionCallContent second = FunctionCallContent.of(CALL_ID, FUNCTION_NAME, "tion\":\"Seattle\"}");

        FunctionCallContent merged = first.merge(second);

        assertEquals("{\"location\":\"Seattle\"}", merged.getRawArguments());
        assertEquals(CALL_ID, merged.getCallId());
        assertEquals(FUNCTION_NAME, merged.getName());
        assertEquals(Map.of("location", "Seattle"), merged.parseArguments());
    }

    @Test
    void shouldMergeStructuredArgumentsWithRightSideWinning() {
        FunctionCallContent first = FunctionCallContent.of(CALL_ID, FUNCTION_NAME,
                Map.<String, Object>of("location", "Seattle", "unit", "F"));
        FunctionCallContent second = FunctionCallContent.of(CALL_ID, FUNCTION_NAME,
                Map.<String, Object>of("unit", "C"));

        FunctionCallContent merged = first.merge(second);

        assertEquals(Map.of("location", "Seattle", "unit", "C"), merged.getArguments());
        assertNull(merged.getRawArguments());
    }

    @Test
    void shouldTakeOtherSideWhenOneSideHasNoArguments() {
        FunctionCallContent header = FunctionCallContent.builder().callId(CALL_ID).name(FUNCTION_NAME).build();
        FunctionCallContent body = FunctionCallContent.builder().rawArguments("{\"a\":1}").build();

        assertEquals("{\"a\":1}", header.merge(body).getRawArguments());
        assertEquals("{\"a\":1}", body.merge(header).getRawArguments());
        assertEquals(CALL_ID, body.merge(header).getCallId());
        assertEquals(FUNCTION_NAME, body.merge(header).getName());
    }

    @Test
    void shouldRejectMixedArgumentKinds() {
        FunctionCallContent text = FunctionCallContent.of(CALL_ID, FUNCTION_NAME, "{\"a\":");
        FunctionCallContent structured = FunctionCallContent.of(CALL_ID, FUNCTION_NAME,
                Map.<String, Object>of("a", 1));

        assertThrows(IllegalArgumentException.class, () -> text.merge(structured));
        assertThrows(IllegalArgumentException.class, () -> structured.merge(text));
    }

    @Test
    void shouldRejectDifferentCallIds() {
        FunctionCallContent first = FunctionCallContent.of("call-1", FUNCTION_NAME, "{}");
        FunctionCallContent second = FunctionCallContent.of("call-2", FUNCTION_NAME, "{}");

        assertThrows(ContentMismatchException.class, () -> first.merge(second));
    }

    @Test
    void shouldMergeStringFragmentsAssociatively() {
        FunctionCallContent a = FunctionCallContent.of(CALL_ID, FUNCTION_NAME, "{\"city\":");
        FunctionCallContent b = FunctionCallContent.builder().rawArguments("\"Par").build();
        FunctionCallContent c = FunctionCallContent.builder().rawArguments("is\"}").build();

        FunctionCallContent left = a.merge(b).merge(c);
        FunctionCallContent right = a.merge(b.merge(c));

        assertEquals(left.getRawArguments(), right.getRawArguments());
        assertEquals(left.getCallId(), right.getCallId());
        assertEquals(left.getName(), right.getName());
    }

    @Test
    void shouldNotMutateMergedFragments() {
        FunctionCallContent first = FunctionCallContent.of(CALL_ID, FUNCTION_NAME,
                Map.<String, Object>of("a", 1));
        FunctionCallContent second = FunctionCallContent.of(CALL_ID, FUNCTION_NAME,
                Map.<String, Object>of("b", 2));

        first.merge(second);

        assertEquals(Map.of("a", 1), first.getArguments());
        assertEquals(Map.of("b", 2), second.getArguments());
    }

    @Test
    void shouldWrapNonObjectJsonUnderRawKey() {
        assertEquals(Map.of("raw", List.of(1, 2)),
                FunctionCallContent.of(CALL_ID, FUNCTION_NAME, "[1,2]").parseArguments());
        assertEquals(Map.of("raw", 42), FunctionCallContent.of(CALL_ID, FUNCTION_NAME, "42").parseArguments());
    }

    @Test
    void shouldWrapUnparsableArgumentsAsString() {
        Map<String, Object> parsed = FunctionCallContent.of(CALL_ID, FUNCTION_NAME, "{not json").parseArguments();

        assertEquals(Map.of("raw", "{not json"), parsed);
    }

    @Test
    void shouldParseMissingArgumentsAsEmptyMap() {
        FunctionCallContent call = FunctionCallContent.builder().callId(CALL_ID).name(FUNCTION_NAME).build();

        assertFalse(call.hasArguments());
        assertTrue(call.parseArguments().isEmpty());
    }
}
