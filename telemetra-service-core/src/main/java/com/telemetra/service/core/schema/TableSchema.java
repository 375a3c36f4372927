package com.telemetra.service.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Column catalog and sample queries shown to users composing ad-hoc queries. */
public record TableSchema(
        @JsonProperty("table_name") String tableName,
        List<Column> columns,
        @JsonProperty("example_queries") List<ExampleQuery> exampleQueries) {

    public TableSchema {
        columns = columns == null ? List.of() : List.copyOf(columns);
        exampleQueries = exampleQueries == null ? List.of() : List.copyOf(exampleQueries);
    }

    public record Column(String name, String type, String description) {}

    public record ExampleQuery(String title, String description, String query) {}
}
