package com.arincdelta.jdbc.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.arincdelta.jdbc.output.Row;
import com.arincdelta.jdbc.record.ArincLine;
import com.arincdelta.jdbc.testing.ArincLines;
import java.sql.Types;
import java.util.List;
import org.junit.jupiter.api.Test;

final class RecordTypeRegistryTest {

    private final RecordTypeRegistry registry = RecordTypeRegistry.defaultRegistry();

    @Test
    void registersTheFourTypesInOrder() {
        assertEquals(List.of("PG", "PI", "PV", "DV"), registry.getTypeCodes());
        assertEquals("Communication", registry.find("pv").orElseThrow().getTitle());
        assertFalse(registry.find("PX").isPresent());
    }

    @Test
    void continuationColumnsDependOnType() {
        assertEquals(26, registry.continuationColumnFor("PV"));
        assertEquals(27, registry.applicationTypeColumnFor("PV"));
        assertEquals(22, registry.continuationColumnFor("PG"));
        assertEquals(RecordTypeTable.DEFAULT_CONTINUATION_COLUMN, registry.continuationColumnFor("ER"));
        assertEquals(RecordTypeTable.NO_APPLICATION_TYPE_COLUMN, registry.applicationTypeColumnFor("ER"));
    }

    @Test
    void rejectsDuplicateRegistration() {
        assertThrows(IllegalArgumentException.class, () -> new RecordTypeRegistry(List.of(new RunwayTable(), new RunwayTable())));
    }

    @Test
    void everyTypeEndsWithRawPayloadField() {
        for (RecordTypeTable table : registry.getTables()) {
            List<FieldDescriptor> fields = table.getFields();
            FieldDescriptor last = fields.get(fields.size() - 1);
            assertTrue(last.isRawPayload(), table.getTypeCode());
            assertEquals(RecordTypeTable.RAW_PAYLOAD_FIELD, last.getName());
        }
    }

    @Test
    void fieldsExtractTrimmedSlicesOrWholePayload() {
        ArincLine line = ArincLines.runway("LTAC", "RW03R", "0", "09000").build();
        FieldDescriptor length = FieldDescriptor.range("rwy_length_ft", 23, 27);

        assertEquals("09000", length.extract(line));
        assertEquals(line.payload(), FieldDescriptor.rawPayload("raw").extract(line));
        assertThrows(IllegalArgumentException.class, () -> FieldDescriptor.range("bad", 10, 9));
    }

    @Test
    void postProcessHooksTrimTypeSpecificFields() {
        Row row = new Row();
        row.put("communications_type", " TWR ");
        row.put("call_sign", "ADANA TOWER   ");
        new AirportCommunicationTable().postProcess(row);
        assertEquals("TWR", row.get("communications_type"));
        assertEquals("ADANA TOWER", row.get("call_sign"));

        Row localizer = new Row();
        localizer.put("localizer_identifier", "IAC X");
        new LocalizerTable().postProcess(localizer);
        assertEquals("IAC", localizer.get("localizer_identifier"));
    }

    @Test
    void headerDefinitionsAreVarchar() {
        TableDefinition definition = TableDefinition.ofHeader("current_PG", "Runway", List.of("icao", "runway_id"));
        assertEquals(List.of("icao", "runway_id"), definition.getColumnNames());
        assertEquals(Types.VARCHAR, definition.getColumns().get(0).getJdbcType());
        assertEquals(Types.INTEGER, SummaryTable.getDefinition().getColumns().get(1).getJdbcType());
    }
}
