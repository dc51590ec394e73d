package org.tapline.records;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonPrimitive;

class RecordsTest {

    @Test
    @Tag("unit")
    void testToJson_EmptyStore() {
        assertThat(new Records().toJson()).isEqualTo("{}");
    }

    @Test
    @Tag("unit")
    void testToJson_UsesTwoSpaceIndentation() {
        Records records = new Records();
        records.put("moduleIds", new JsonPrimitive(3));
        records.childRecords("manifest", 0).put("hash", new JsonPrimitive("abc"));

        assertThat(records.toJson()).isEqualTo("{\n"
                + "  \"moduleIds\": 3,\n"
                + "  \"manifest\": [\n"
                + "    {\n"
                + "      \"hash\": \"abc\"\n"
                + "    }\n"
                + "  ]\n"
                + "}");
    }

    @Test
    @Tag("unit")
    void testParse_RoundTripsSerializedContent() {
        Records records = new Records();
        records.put("chunks", new JsonPrimitive("a<b>"));
        records.childRecords("child", 1).put("id", new JsonPrimitive(7));

        Records parsed = Records.parse(records.toJson());

        assertThat(parsed.toJson()).isEqualTo(records.toJson());
        assertThat(parsed.childCount("child")).isEqualTo(2);
        assertThat(parsed.childRecords("child", 1).get("id").getAsInt()).isEqualTo(7);
    }

    @Test
    @Tag("unit")
    void testParse_MalformedContentCarriesPrefix() {
        assertThatThrownBy(() -> Records.parse("{ \"unterminated\": "))
                .isInstanceOf(RecordsParseException.class)
                .hasMessageStartingWith(RecordsParseException.MESSAGE_PREFIX);
    }

    @Test
    @Tag("unit")
    void testParse_NonObjectRootRejected() {
        assertThatThrownBy(() -> Records.parse("[1, 2]"))
                .isInstanceOf(RecordsParseException.class)
                .hasMessageContaining("expected a JSON object");
        assertThatThrownBy(() -> Records.parse(""))
                .isInstanceOf(RecordsParseException.class);
    }

    @Test
    @Tag("unit")
    void testChildRecords_ReusesExistingEntryAtIndex() {
        Records records = new Records();
        records.childRecords("manifest", 0).put("seen", new JsonPrimitive(true));

        Records again = records.childRecords("manifest", 0);

        assertThat(again.get("seen").getAsBoolean()).isTrue();
        assertThat(records.childCount("manifest")).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testChildRecords_IsLiveViewIntoParent() {
        Records records = new Records();
        Records child = records.childRecords("manifest", 1);
        child.put("written", new JsonPrimitive("late"));

        assertThat(records.childCount("manifest")).isEqualTo(2);
        assertThat(records.get("manifest").getAsJsonArray().get(1).getAsJsonObject().get("written").getAsString())
                .isEqualTo("late");
    }

    @Test
    @Tag("unit")
    void testChildRecords_NegativeIndexRejected() {
        assertThatThrownBy(() -> new Records().childRecords("x", -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
