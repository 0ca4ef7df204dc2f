package com.arincdelta.jdbc.schema;

import com.arincdelta.jdbc.output.Row;
import com.arincdelta.jdbc.record.TypeTuple;
import java.util.List;

/** PV: airport communication records. Continuation number sits in column 26 for this type. */
public final class AirportCommunicationTable extends RecordTypeTable {
    public static final String TYPE_CODE = "PV";

    public AirportCommunicationTable() {
        super(
                TYPE_CODE,
                TypeTuple.of("P", "V"),
                "Communication",
                26,
                27,
                List.of(
                        field("area_code", 2, 4),
                        field("blank_6", 6, 6),
                        field("icao", 7, 10),
                        field("icao_code", 11, 12),
                        field("communications_type", 14, 16),
                        field("communications_frequency", 17, 23),
                        field("guard_transmit", 24, 24),
                        field("frequency_units", 25, 25),
                        field("cont_no_column_26", 26, 26),
                        field("service_indicator", 27, 29),
                        field("radar_service", 30, 30),
                        field("modulation", 31, 31),
                        field("signal_emission", 32, 32),
                        field("latitude", 33, 41),
                        field("longitude", 42, 51),
                        field("magnetic_variation", 52, 56),
                        field("facility_elevation", 57, 61),
                        field("h24_indicator", 62, 62),
                        field("sectorization", 63, 68),
                        field("altitude_description", 69, 69),
                        field("communication_altitude_1", 70, 74),
                        field("communication_altitude_2", 75, 79),
                        field("sector_facility", 80, 83),
                        field("sector_facility_icao", 84, 85),
                        field("sector_facility_section", 86, 86),
                        field("sector_facility_subsection", 87, 87),
                        field("distance_description", 88, 88),
                        field("communications_distance", 89, 90),
                        field("remote_facility", 91, 94),
                        field("remote_facility_icao", 95, 96),
                        field("remote_facility_section", 97, 97),
                        field("remote_facility_subsection", 98, 98),
                        field("call_sign", 99, 123),
                        rawPayload()),
                List.of("icao", "communications_type", "communications_frequency"));
    }

    @Override
    public void postProcess(Row row) {
        strip(row, "communications_type", "communications_frequency", "call_sign");
    }
}
