package org.catalogapi.export.sierra;

import java.util.List;

import org.catalogapi.export.sierra.model.RecordMetadata;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;
import static org.catalogapi.export.sierra.SierraFixtures.*;

class CallNumberResolverTest {

    @ParameterizedTest
    @CsvSource({
        "050, lc",
        "090, lc",
        "082, dewey",
        "092, dewey",
        "086, sudoc",
        "099, other"
    })
    void typeFollowsMarcTag(String tag, String expected) {
        assertEquals(expected, CallNumberResolver.typeForTag(tag));
    }

    @Test
    void displayJoinsSubfieldsOrUsesRawContent() {
        assertEquals("QA76.73 .J38 2010", CallNumberResolver.displayString("|aQA76.73|b.J38 2010"));
        assertEquals("LPCD100,001", CallNumberResolver.displayString("LPCD100,001 "));
        assertEquals("", CallNumberResolver.displayString(null));
    }

    @Test
    void onlyCallNumberFieldsAreReadInOccurrenceOrder() {
        var metadata = RecordMetadata.builder().varFields(List.of(
            sierraField("b", 0, "1000000001"),
            callNumberField("099", 1, "|aSecond"),
            callNumberField("090", 0, "|aFirst"),
            callNumberField(null, 2, "")
        )).build();

        var callNumbers = CallNumberResolver.callNumbers(metadata);
        assertEquals(List.of(new CallNumber("First", "lc"), new CallNumber("Second", "other")), callNumbers);
    }
}
