package com.oracle.optmcts.search;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AnswerExtractorTest {

    @Test
    void takesTheLastNumberPrinted() {
        assertEquals(Optional.of(1234.5), AnswerExtractor.lastNumber("Status: 1\nIterations 17\nOptimal value: 1234.5\n"));
    }

    @Test
    void handlesSignsAndExponents() {
        assertEquals(Optional.of(-42.0), AnswerExtractor.lastNumber("objective -42"));
        assertEquals(Optional.of(1.5e3), AnswerExtractor.lastNumber("value=1.5e3"));
        assertEquals(Optional.of(0.25), AnswerExtractor.lastNumber(".25"));
    }

    @Test
    void emptyWhenNothingNumeric() {
        assertEquals(Optional.empty(), AnswerExtractor.lastNumber("Infeasible"));
        assertEquals(Optional.empty(), AnswerExtractor.lastNumber(""));
        assertEquals(Optional.empty(), AnswerExtractor.lastNumber(null));
    }
}
