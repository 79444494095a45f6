package com.semsql.config;

import com.semsql.model.SchemaGraph;
import com.semsql.service.SchemaGraphLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SchemaGraphConfig {

    @Bean
    public SchemaGraph schemaGraph(SchemaGraphLoader schemaGraphLoader, SemsqlProperties properties) {
        return schemaGraphLoader.load(properties.getSchema().getLocation());
    }
}
