package io.cubedash.db;

import io.cubedash.model.DocumentStyle;

/**
 * SQL expressions that derive spatial and temporal fields from a catalog
 * dataset document, for a dataset table aliased {@code d}.
 *
 * <p>
 * Each expression evaluates to NULL when its source fields are missing, so a
 * badly-described dataset still gets a row (and shows up in the quality stats).
 * </p>
 */
public final class DatasetExtentSql {
    /** CRS given as a short authority code, eg. {@code EPSG:32753}. */
    public static final String AUTH_CODE_PATTERN = "^[A-Za-z0-9]+:[0-9]+$";
    /** Plain WKT ending in an authority code, eg. {@code ... AUTHORITY["EPSG","32756"]]}. */
    static final String WKT_AUTHORITY_PATTERN = "AUTHORITY\\[\"[a-zA-Z0-9]+\", *\"[0-9]+\"\\]\\]$";

    private final DocumentStyle style;
    private final String defaultCrs;

    /**
     * @param defaultCrs CRS assumed when a document's CRS cannot be resolved (eg. {@code EPSG:4326}), or null
     */
    public DatasetExtentSql(DocumentStyle style, String defaultCrs) {
        this.style = style;
        this.defaultCrs = defaultCrs;
        if (defaultCrs != null && !defaultCrs.matches(AUTH_CODE_PATTERN)) {
            throw new IllegalArgumentException("Default CRS must look like AUTH:CODE, got " + defaultCrs);
        }
    }

    public String centerTime() {
        if (style == DocumentStyle.EO3) {
            return midpointOr("d.metadata #>> '{properties,datetime}'",
                    "d.metadata #>> '{properties,dtr:start_datetime}'",
                    "d.metadata #>> '{properties,dtr:end_datetime}'");
        }
        return midpointOr("d.metadata #>> '{extent,center_dt}'",
                "d.metadata #>> '{extent,from_dt}'",
                "d.metadata #>> '{extent,to_dt}'");
    }

    public String creationTime() {
        if (style == DocumentStyle.EO3) {
            return "(d.metadata #>> '{properties,odc:processing_datetime}')::timestamptz";
        }
        return "(d.metadata #>> '{creation_dt}')::timestamptz";
    }

    public String regionCode() {
        if (style == DocumentStyle.EO3) {
            return "(d.metadata #>> '{properties,odc:region_code}')";
        }
        // Landsat-style path/row from the first reference point.
        return "coalesce(d.metadata #>> '{properties,odc:region_code}', "
                + "(d.metadata #>> '{image,satellite_ref_point_start,x}') || '_' || "
                + "(d.metadata #>> '{image,satellite_ref_point_start,y}'))";
    }

    public String sizeBytes() {
        if (style == DocumentStyle.EO3) {
            return "(d.metadata #>> '{properties,odc:file_size}')::bigint";
        }
        return "(d.metadata #>> '{size_bytes}')::bigint";
    }

    /**
     * The text CRS of the document (before resolution to an SRID).
     */
    public String crsText() {
        if (style == DocumentStyle.EO3) {
            return "(d.metadata ->> 'crs')";
        }
        return "(d.metadata #>> '{grid_spatial,projection,spatial_reference}')";
    }

    public String footprint() {
        String geom;
        if (style == DocumentStyle.EO3) {
            geom = "ST_GeomFromGeoJSON(d.metadata ->> 'geometry')";
        } else {
            geom = "coalesce("
                    + "ST_GeomFromGeoJSON(d.metadata #>> '{grid_spatial,projection,valid_data}'), "
                    + "ST_MakePolygon(ST_MakeLine(ARRAY["
                    + corner("ll") + ", " + corner("ul") + ", " + corner("ur") + ", " + corner("lr") + ", "
                    + corner("ll") + "])))";
        }
        return "ST_SetSRID(" + geom + ", " + srid() + ")";
    }

    /**
     * Resolves the document CRS to a PostGIS SRID, trying in order: an
     * authority code, WKT ending in an AUTHORITY clause, a legacy GDA94
     * datum/zone pair, then the default CRS.
     */
    public String srid() {
        String crs = crsText();
        StringBuilder sb = new StringBuilder("coalesce(");
        sb.append("CASE WHEN ").append(crs).append(" ~ '").append(AUTH_CODE_PATTERN).append("' THEN ")
                .append("(SELECT s.srid FROM spatial_ref_sys s WHERE lower(s.auth_name) = lower(split_part(")
                .append(crs).append(", ':', 1)) AND s.auth_srid = split_part(").append(crs)
                .append(", ':', 2)::integer LIMIT 1) END");

        sb.append(", CASE WHEN ").append(crs).append(" ~ '").append(WKT_AUTHORITY_PATTERN).append("' THEN ")
                .append("(SELECT s.srid FROM spatial_ref_sys s WHERE lower(s.auth_name) = lower(substring(")
                .append(crs).append(", 'AUTHORITY\\[\"([a-zA-Z0-9]+)\", *\"[0-9]+\"\\]\\]$')) ")
                .append("AND s.auth_srid = substring(").append(crs)
                .append(", 'AUTHORITY\\[\"[a-zA-Z0-9]+\", *\"([0-9]+)\"\\]\\]$')::integer LIMIT 1) END");

        if (style == DocumentStyle.EO) {
            // Some older datasets have datum/zone fields instead.
            sb.append(", CASE WHEN d.metadata #>> '{grid_spatial,projection,datum}' = 'GDA94' THEN ")
                    .append("(SELECT s.srid FROM spatial_ref_sys s WHERE lower(s.auth_name) = 'epsg' ")
                    .append("AND s.auth_srid = ('283' || abs((d.metadata #>> '{grid_spatial,projection,zone}')")
                    .append("::integer))::integer LIMIT 1) END");
        }

        if (defaultCrs != null) {
            String[] parts = defaultCrs.split(":");
            sb.append(", (SELECT s.srid FROM spatial_ref_sys s WHERE lower(s.auth_name) = '")
                    .append(parts[0].toLowerCase()).append("' AND s.auth_srid = ").append(Integer.parseInt(parts[1]))
                    .append(" LIMIT 1)");
        }
        sb.append(")");
        return sb.toString();
    }

    private static String corner(String key) {
        return "ST_MakePoint((d.metadata #>> '{grid_spatial,projection,geo_ref_points," + key + ",x}')::double precision, "
                + "(d.metadata #>> '{grid_spatial,projection,geo_ref_points," + key + ",y}')::double precision)";
    }

    private static String midpointOr(String exact, String start, String end) {
        return "coalesce((" + exact + ")::timestamptz, "
                + "(" + start + ")::timestamptz + (((" + end + ")::timestamptz - (" + start + ")::timestamptz) / 2))";
    }
}
