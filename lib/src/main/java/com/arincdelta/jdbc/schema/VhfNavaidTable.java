package com.arincdelta.jdbc.schema;

import com.arincdelta.jdbc.output.ExtraViewHandler;
import com.arincdelta.jdbc.output.Row;
import com.arincdelta.jdbc.output.VhfNavaidViews;
import com.arincdelta.jdbc.record.TypeTuple;
import java.util.List;
import java.util.Optional;

/**
 * DV: VHF navaid records (section D, blank subsection). Output is split into ILS/DME and VOR views
 * by {@link VhfNavaidViews}.
 */
public final class VhfNavaidTable extends RecordTypeTable {
    public static final String TYPE_CODE = "DV";

    private final ExtraViewHandler views = new VhfNavaidViews();

    public VhfNavaidTable() {
        super(
                TYPE_CODE,
                TypeTuple.of("D", " "),
                "VHF Navaid",
                22,
                23,
                List.of(
                        field("area_code", 2, 4),
                        field("subsection_code", 6, 6),
                        field("airport_icao", 7, 10),
                        field("icao_code", 11, 12),
                        field("ils_ident", 14, 17),
                        field("navaid_icao_code", 20, 21),
                        field("vor_frequency", 23, 27),
                        field("navaid_class", 28, 32),
                        field("vor_latitude", 33, 41),
                        field("vor_longitude", 42, 51),
                        field("dme_ident", 52, 55),
                        field("dme_latitude", 56, 64),
                        field("dme_longitude", 65, 74),
                        field("station_declination", 75, 79),
                        field("dme_elevation", 80, 84),
                        field("figure_of_merit", 85, 85),
                        field("ils_dme_bias", 86, 87),
                        field("frequency_protection", 88, 90),
                        field("datum_code", 91, 93),
                        field("vor_name", 94, 123),
                        rawPayload()),
                List.of("airport_icao", "ils_ident", "vor_frequency"));
    }

    @Override
    public void postProcess(Row row) {
        strip(row, "ils_ident", "vor_name", "airport_icao");
    }

    @Override
    public Optional<ExtraViewHandler> getExtraViewHandler() {
        return Optional.of(views);
    }
}
