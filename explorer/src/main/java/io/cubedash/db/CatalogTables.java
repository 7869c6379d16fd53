package io.cubedash.db;

import io.cubedash.config.AppConfig;

/**
 * Table and column names of the dataset catalog for one index driver.
 *
 * <p>
 * The {@code postgres} driver keeps its tables in {@code agdc} and calls
 * products "dataset types"; the {@code postgis} driver uses {@code odc}.
 * </p>
 */
public record CatalogTables(
        String schema,
        String productTable,
        String datasetProductRef,
        String locationTable,
        String lineageTable,
        String lineageDerivedRef,
        String lineageSourceRef) {

    public static final CatalogTables POSTGRES = new CatalogTables(
            "agdc", "dataset_type", "dataset_type_ref",
            "dataset_location", "dataset_source", "dataset_ref", "source_dataset_ref");

    public static final CatalogTables POSTGIS = new CatalogTables(
            "odc", "product", "product_ref",
            "location", "dataset_lineage", "derived_dataset_ref", "source_dataset_ref");

    public static CatalogTables forDriver(String driver) {
        return AppConfig.DRIVER_POSTGIS.equals(driver) ? POSTGIS : POSTGRES;
    }

    public String dataset() {
        return schema + ".dataset";
    }

    public String product() {
        return schema + "." + productTable;
    }

    public String metadataType() {
        return schema + ".metadata_type";
    }

    public String location() {
        return schema + "." + locationTable;
    }

    public String lineage() {
        return schema + "." + lineageTable;
    }
}
