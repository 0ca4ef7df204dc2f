package com.arincdelta.jdbc.loader;

import com.arincdelta.jdbc.output.ViewContext;
import com.arincdelta.jdbc.record.RecordFilter;
import com.arincdelta.jdbc.record.TypeTuple;
import com.arincdelta.jdbc.schema.RecordTypeRegistry;
import com.arincdelta.jdbc.schema.RecordTypeTable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable settings of one delta run: requested record types and the ICAO/area filters. Built and
 * validated before any file is read.
 */
public final class DeltaRequest {

    public static final String TYPES = "types";
    public static final String AIRPORT = "airport";
    public static final String AREA = "area";
    public static final String REGION = "region";

    private final RecordTypeRegistry registry;
    private final List<RecordTypeTable> tables;
    private final Set<String> icaoFilter;
    private final Set<String> areaFilter;
    private final boolean regionRequested;

    private DeltaRequest(
            RecordTypeRegistry registry,
            List<RecordTypeTable> tables,
            Set<String> icaoFilter,
            Set<String> areaFilter,
            boolean regionRequested) {
        this.registry = registry;
        this.tables = List.copyOf(tables);
        this.icaoFilter = icaoFilter == null ? null : Set.copyOf(icaoFilter);
        this.areaFilter = areaFilter == null ? null : Set.copyOf(areaFilter);
        this.regionRequested = regionRequested;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Reads {@value #TYPES}, {@value #AIRPORT}, {@value #AREA} and {@value #REGION}; absent keys mean no restriction. */
    public static DeltaRequest fromProperties(Properties properties) throws DeltaRequestException {
        Builder builder = builder();
        if (properties != null) {
            builder.types(properties.getProperty(TYPES))
                    .airport(properties.getProperty(AIRPORT))
                    .area(properties.getProperty(AREA))
                    .region(properties.getProperty(REGION));
        }
        return builder.build();
    }

    public RecordTypeRegistry getRegistry() {
        return registry;
    }

    /** Requested record types in request order. */
    public List<RecordTypeTable> getTables() {
        return tables;
    }

    public List<String> getTypeCodes() {
        List<String> codes = new ArrayList<>(tables.size());
        for (RecordTypeTable table : tables) {
            codes.add(table.getTypeCode());
        }
        return codes;
    }

    /** {@code null} when every airport is accepted. */
    public Set<String> getIcaoFilter() {
        return icaoFilter;
    }

    /** Effective area filter after region expansion; {@code null} when every area is accepted. */
    public Set<String> getAreaFilter() {
        return areaFilter;
    }

    public boolean isRegionRequested() {
        return regionRequested;
    }

    public boolean isAirportRequested() {
        return icaoFilter != null;
    }

    public RecordFilter toRecordFilter() {
        Set<TypeTuple> tuples = new LinkedHashSet<>();
        for (RecordTypeTable table : tables) {
            tuples.add(table.getTypeTuple());
        }
        return new RecordFilter(tuples, icaoFilter, areaFilter);
    }

    public ViewContext toViewContext() {
        return new ViewContext(regionRequested);
    }

    public static final class Builder {
        private RecordTypeRegistry registry = RecordTypeRegistry.defaultRegistry();
        private RegionPresets regionPresets = RegionPresets.defaults();
        private String types;
        private String airport;
        private String area;
        private String region;

        private Builder() {}

        public Builder registry(RecordTypeRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            return this;
        }

        public Builder regionPresets(RegionPresets regionPresets) {
            this.regionPresets = Objects.requireNonNull(regionPresets, "regionPresets");
            return this;
        }

        /** Comma-separated type codes; empty requests every registered type. */
        public Builder types(String types) {
            this.types = types;
            return this;
        }

        /** Comma-separated ICAO airport codes. */
        public Builder airport(String airport) {
            this.airport = airport;
            return this;
        }

        /** Comma-separated area codes; takes precedence over {@link #region(String)}. */
        public Builder area(String area) {
            this.area = area;
            return this;
        }

        /** Comma-separated region aliases or area codes. */
        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public DeltaRequest build() throws DeltaRequestException {
            List<RecordTypeTable> tables = resolveTypes();
            Set<String> icaoFilter = FilterLists.parse(airport);
            Set<String> regionTokens = FilterLists.parse(region);
            Set<String> regionAreas = regionTokens == null ? null : regionPresets.expand(regionTokens);
            Set<String> explicitArea = FilterLists.parse(area);
            Set<String> areaFilter = explicitArea != null ? explicitArea : regionAreas;
            return new DeltaRequest(registry, tables, icaoFilter, areaFilter, regionTokens != null);
        }

        private List<RecordTypeTable> resolveTypes() throws DeltaRequestException {
            Set<String> codes = FilterLists.parse(types);
            if (codes == null) {
                return new ArrayList<>(registry.getTables());
            }
            List<RecordTypeTable> tables = new ArrayList<>(codes.size());
            for (String code : codes) {
                RecordTypeTable table =
                        registry.find(code)
                                .orElseThrow(
                                        () -> new DeltaRequestException(
                                                "Unknown type '" + code + "'. Allowed: "
                                                        + String.join(", ", registry.getTypeCodes())));
                tables.add(table);
            }
            return tables;
        }
    }
}
