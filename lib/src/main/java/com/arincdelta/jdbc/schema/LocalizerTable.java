package com.arincdelta.jdbc.schema;

import com.arincdelta.jdbc.output.Row;
import com.arincdelta.jdbc.record.TypeTuple;
import java.util.List;

/** PI: localizer / glide slope records. A localizer without glide slope is normal. */
public final class LocalizerTable extends RecordTypeTable {
    public static final String TYPE_CODE = "PI";

    public LocalizerTable() {
        super(
                TYPE_CODE,
                TypeTuple.of("P", "I"),
                "Localizer Glide Slope",
                22,
                23,
                List.of(
                        field("record_type", 1, 1),
                        field("area_code", 2, 4),
                        field("sec", 5, 5),
                        field("icao", 7, 10),
                        field("icao_code", 11, 12),
                        field("sub", 13, 13),
                        field("localizer_identifier", 14, 17),
                        field("ils_category", 18, 18),
                        field("localizer_frequency", 23, 27),
                        field("runway_identifier", 28, 32),
                        field("localizer_latitude", 33, 41),
                        field("localizer_longitude", 42, 51),
                        field("localizer_bearing", 52, 55),
                        field("glide_slope_latitude", 56, 64),
                        field("glide_slope_longitude", 65, 74),
                        field("localizer_position", 75, 78),
                        field("localizer_position_reference", 79, 79),
                        field("glide_slope_position", 80, 83),
                        field("localizer_width", 84, 87),
                        field("glide_slope_angle", 88, 90),
                        field("station_declination", 91, 95),
                        field("glide_slope_height_lthr", 96, 97),
                        field("glide_slope_elevation", 98, 102),
                        field("supporting_facility_id", 103, 106),
                        field("supporting_facility_icao", 107, 108),
                        field("supporting_facility_section", 109, 109),
                        field("supporting_facility_subsection", 110, 110),
                        rawPayload()),
                List.of("icao", "runway_identifier", "localizer_identifier"));
    }

    @Override
    public void postProcess(Row row) {
        keepLeading(row, "localizer_identifier", 4);
    }
}
