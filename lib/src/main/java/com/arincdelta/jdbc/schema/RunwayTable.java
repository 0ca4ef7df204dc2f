package com.arincdelta.jdbc.schema;

import com.arincdelta.jdbc.output.Row;
import com.arincdelta.jdbc.record.TypeTuple;
import java.util.List;

/** PG: airport runway records. */
public final class RunwayTable extends RecordTypeTable {
    public static final String TYPE_CODE = "PG";

    public RunwayTable() {
        super(
                TYPE_CODE,
                TypeTuple.of("P", "G"),
                "Runway",
                22,
                23,
                List.of(
                        field("area_code", 2, 4),
                        field("icao", 7, 10),
                        field("runway_id", 14, 18),
                        field("rwy_length_ft", 23, 27),
                        field("rwy_mag_brg_tenths", 28, 31),
                        field("lat_raw", 33, 41),
                        field("lon_raw", 42, 51),
                        field("rwy_grad_pct100", 52, 56),
                        field("lthr_elev_ft", 67, 71),
                        field("dthr_ft", 72, 75),
                        field("tch_raw", 76, 77),
                        field("rwy_width_ft", 78, 80),
                        field("loc_mls_gls_ident", 82, 85),
                        rawPayload()),
                List.of("icao", "runway_id"));
    }

    @Override
    public void postProcess(Row row) {
        keepLeading(row, "loc_mls_gls_ident", 4);
    }
}
