package com.semsql.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "semsql")
public class SemsqlProperties {
    private Schema schema = new Schema();
    private Compiler compiler = new Compiler();

    public static class Schema {
        private String location = "classpath:schema/tpch.json";

        // Getters and Setters
        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Compiler {
        /**
         * Prefix written before every table name, e.g. {@code tpch.tiny}. Empty for none.
         */
        private String tableQualifier = "";
        /**
         * LIMIT applied when a query does not ask for one. Null for no limit.
         */
        private Integer defaultLimit;

        // Getters and Setters
        public String getTableQualifier() {
            return tableQualifier;
        }

        public void setTableQualifier(String tableQualifier) {
            this.tableQualifier = tableQualifier;
        }

        public Integer getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(Integer defaultLimit) {
            this.defaultLimit = defaultLimit;
        }
    }

    // Getters and Setters
    public Schema getSchema() {
        return schema;
    }

    public void setSchema(Schema schema) {
        this.schema = schema;
    }

    public Compiler getCompiler() {
        return compiler;
    }

    public void setCompiler(Compiler compiler) {
        this.compiler = compiler;
    }
}
